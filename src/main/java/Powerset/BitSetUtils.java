package Powerset;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.List;

import Powerset.Model.NFA;
import Powerset.Model.StateSet;

/**
 * Conversions between NFA states and {@link BitSet}s of their ids.
 */
public class BitSetUtils {
    /**
     * @throws IllegalArgumentException if a state does not belong to the NFA
     */
    public static <S> BitSet toIds(NFA<S, ?> nfa, Collection<? extends S> states) {
        final BitSet ids = new BitSet(nfa.size());
        for (S s : states) {
            final int id = nfa.getStateId(s);
            if (id == NFA.MISSING_STATE) {
                throw new IllegalArgumentException(s + " is not a state of the automaton");
            }
            ids.set(id);
        }
        return ids;
    }

    /**
     * @return - states in id order
     */
    public static <S> List<S> toStates(NFA<S, ?> nfa, BitSet ids) {
        final List<S> result = new ArrayList<>(ids.cardinality());
        for (int i = ids.nextSetBit(0); i >= 0; i = ids.nextSetBit(i + 1)) {
            result.add(nfa.getState(i));
        }
        return result;
    }

    public static <S> StateSet<S> toStateSet(NFA<S, ?> nfa, BitSet ids) {
        return StateSet.of(toStates(nfa, ids));
    }
}
