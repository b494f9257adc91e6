package Powerset;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

import Powerset.Model.DFA;
import Powerset.Model.MalformedAutomatonException;
import Powerset.Model.NFA;
import Powerset.Model.StateSet;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;

/**
 * Conversion between this library's automata and AutomataLib's compact ones.
 */
public class AutomataLibBridge {
    private static final int MISSING_ELEMENT = -1;

    /**
     * Copy a DFA into a {@link CompactDFA}. States are numbered in iteration order of {@link DFA#getStates()};
     * missing transitions stay undefined.
     * @param dfa - DFA over sets of NFA states
     * @return - equivalent compact DFA over the same alphabet
     */
    public static <S, I> CompactDFA<I> toCompactDFA(DFA<S, I> dfa) {
        final Alphabet<I> alphabet = dfa.getInputAlphabet();
        final CompactDFA<I> out = new CompactDFA<>(alphabet, dfa.size());
        final Object2IntMap<StateSet<S>> stateIds = new Object2IntOpenHashMap<>(dfa.size());
        stateIds.defaultReturnValue(MISSING_ELEMENT);

        for (StateSet<S> s : dfa.getStates()) {
            final boolean acc = dfa.isAccepting(s);
            final int id = s.equals(dfa.getStartState()) ? out.addInitialState(acc) : out.addState(acc);
            stateIds.put(s, id);
        }
        for (Map.Entry<StateSet<S>, Map<I, StateSet<S>>> e : dfa.getTransitions().entrySet()) {
            final int source = stateIds.getInt(e.getKey());
            for (Map.Entry<I, StateSet<S>> t : e.getValue().entrySet()) {
                out.setTransition(source, alphabet.getSymbolIndex(t.getKey()), stateIds.getInt(t.getValue()));
            }
        }
        return out;
    }

    /**
     * Copy an (epsilon-free) {@link CompactNFA} into an {@link NFA} whose states are the compact state ids.
     * @param automaton - compact NFA with exactly one initial state
     * @return - equivalent NFA
     * @throws MalformedAutomatonException if the automaton does not have exactly one initial state
     */
    public static <I> NFA<Integer, I> fromCompactNFA(CompactNFA<I> automaton) {
        final Set<Integer> initialStates = automaton.getInitialStates();
        if (initialStates.size() != 1) {
            throw new MalformedAutomatonException(
                "Expected exactly one initial state, found " + initialStates.size());
        }
        final Alphabet<I> alphabet = automaton.getInputAlphabet();
        final List<Integer> states = new ArrayList<>(automaton.getStates());
        final NFA.Builder<Integer, I> builder = NFA.builder(states, alphabet);
        builder.setStartState(initialStates.iterator().next());

        for (Integer s : states) {
            if (automaton.isAccepting(s)) {
                builder.addAccepting(s);
            }
            for (I a : alphabet) {
                final Collection<Integer> targets = automaton.getTransitions(s, a);
                if (!targets.isEmpty()) {
                    builder.addTransitions(s, a, targets);
                }
            }
        }
        return builder.build();
    }
}
