package Powerset;

import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import Powerset.Model.NFA;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Epsilon-closure and move over sets of NFA states.
 * <p>
 * Each operator comes in two forms: over state identifiers, and over {@link BitSet}s of state ids as used by the
 * powerset construction. The BitSet forms never modify their argument.
 */
public class Closures {

    /**
     * Smallest superset of the given states that is closed under epsilon transitions.
     * @param nfa - automaton
     * @param states - states of the automaton
     * @return - epsilon closure, unmodifiable, in state id order
     * @throws IllegalArgumentException if a state does not belong to the NFA
     */
    public static <S, I> Set<S> epsilonClosure(NFA<S, I> nfa, Collection<? extends S> states) {
        final BitSet closure = epsilonClosure(nfa, BitSetUtils.toIds(nfa, states));
        return Collections.unmodifiableSet(new LinkedHashSet<>(BitSetUtils.toStates(nfa, closure)));
    }

    /**
     * Union of the successors of the given states under one symbol. Epsilon transitions are not followed.
     * @param nfa - automaton
     * @param states - states of the automaton
     * @param symbol - input symbol; a symbol outside the alphabet has no successors
     * @return - successors, unmodifiable, in state id order
     * @throws IllegalArgumentException if a state does not belong to the NFA
     */
    public static <S, I> Set<S> move(NFA<S, I> nfa, Collection<? extends S> states, I symbol) {
        final BitSet targets = move(nfa, BitSetUtils.toIds(nfa, states), symbol);
        return Collections.unmodifiableSet(new LinkedHashSet<>(BitSetUtils.toStates(nfa, targets)));
    }

    /**
     * Epsilon closure over state ids. Terminates on cyclic epsilon transitions, since a state is pushed only
     * when it first joins the closure.
     * @param nfa - automaton
     * @param ids - state ids
     * @return - new set with the ids of the epsilon closure
     */
    public static BitSet epsilonClosure(NFA<?, ?> nfa, BitSet ids) {
        final BitSet closure = (BitSet) ids.clone();
        final IntList stack = new IntArrayList(ids.cardinality());
        for (int i = ids.nextSetBit(0); i >= 0; i = ids.nextSetBit(i + 1)) {
            stack.add(i);
        }
        while (!stack.isEmpty()) {
            final int current = stack.removeInt(stack.size() - 1);
            final IntList targets = nfa.getEpsilonTargetIds(current);
            for (int k = 0; k < targets.size(); k++) {
                final int t = targets.getInt(k);
                if (!closure.get(t)) {
                    closure.set(t);
                    stack.add(t);
                }
            }
        }
        return closure;
    }

    /**
     * Move over state ids.
     * @param nfa - automaton
     * @param ids - state ids
     * @param symbol - input symbol
     * @return - new set with the successor ids
     */
    public static <I> BitSet move(NFA<?, I> nfa, BitSet ids, I symbol) {
        final BitSet result = new BitSet(nfa.size());
        for (int i = ids.nextSetBit(0); i >= 0; i = ids.nextSetBit(i + 1)) {
            nfa.collectTargetIds(i, symbol, result);
        }
        return result;
    }
}
