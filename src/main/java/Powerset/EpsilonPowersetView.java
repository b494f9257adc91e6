package Powerset;

import java.util.BitSet;
import java.util.Collection;

import Powerset.Model.NFA;
import net.automatalib.ts.AcceptorPowersetViewTS;

/**
 * Deterministic view of an epsilon-NFA whose states are epsilon-closed sets of NFA state ids.
 * The initial state is the closure of the start state, and the successor of a set under a symbol is the
 * closure of its move. The empty set is a regular (rejecting) state of the view, so successors are never null.
 * <p>
 * Being an AutomataLib acceptor, the view also decides NFA acceptance of a word on the fly, see
 * {@link #accepts(Iterable)}.
 *
 * @param <S> - NFA state type
 * @param <I> - input symbol type
 */
public class EpsilonPowersetView<S, I> implements AcceptorPowersetViewTS<BitSet, I, S> {
    private final NFA<S, I> nfa;

    public EpsilonPowersetView(NFA<S, I> nfa) {
        this.nfa = nfa;
    }

    public NFA<S, I> getNFA() {
        return nfa;
    }

    @Override
    public Collection<S> getOriginalStates(BitSet state) {
        return getOriginalTransitions(state);
    }

    @Override
    public Collection<S> getOriginalTransitions(BitSet state) {
        return BitSetUtils.toStates(nfa, state);
    }

    @Override
    public BitSet getTransition(BitSet state, I in) {
        return Closures.epsilonClosure(nfa, Closures.move(nfa, state, in));
    }

    @Override
    public boolean isAccepting(BitSet state) {
        return nfa.containsAccepting(state);
    }

    @Override
    public BitSet getInitialState() {
        final BitSet start = new BitSet(nfa.size());
        start.set(nfa.getStateId(nfa.getStartState()));
        return Closures.epsilonClosure(nfa, start);
    }
}
