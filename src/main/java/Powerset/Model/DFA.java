package Powerset.Model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import net.automatalib.alphabet.Alphabet;

/**
 * Immutable deterministic finite automaton whose states are sets of NFA states.
 * <p>
 * The transition table maps each state to at most one successor per symbol. A DFA produced by the subset
 * construction is total over its states; a DFA built by hand may be partial.
 *
 * @param <S> - NFA state type
 * @param <I> - input symbol type
 */
public final class DFA<S, I> {
    private final Set<StateSet<S>> states;
    private final Alphabet<I> alphabet;
    private final Map<StateSet<S>, Map<I, StateSet<S>>> transitions;
    private final StateSet<S> startState;
    private final Set<StateSet<S>> acceptingStates;

    /**
     * @param states - all states
     * @param alphabet - input symbols
     * @param transitions - state -> symbol -> successor
     * @param startState - start state, one of the states
     * @param acceptingStates - accepting states, a subset of the states
     * @throws MalformedAutomatonException if a state or symbol is referenced but not declared
     */
    public DFA(Collection<StateSet<S>> states,
               Alphabet<I> alphabet,
               Map<StateSet<S>, ? extends Map<I, StateSet<S>>> transitions,
               StateSet<S> startState,
               Collection<StateSet<S>> acceptingStates) {
        this.states = Collections.unmodifiableSet(new LinkedHashSet<>(states));
        this.alphabet = alphabet;

        requireState(startState, "Start state");
        this.startState = startState;

        for (StateSet<S> s : acceptingStates) {
            requireState(s, "Accepting state");
        }
        this.acceptingStates = Collections.unmodifiableSet(new LinkedHashSet<>(acceptingStates));

        final Map<StateSet<S>, Map<I, StateSet<S>>> table = new LinkedHashMap<>();
        for (Map.Entry<StateSet<S>, ? extends Map<I, StateSet<S>>> e : transitions.entrySet()) {
            requireState(e.getKey(), "Transition source");
            for (Map.Entry<I, StateSet<S>> t : e.getValue().entrySet()) {
                if (!alphabet.contains(t.getKey())) {
                    throw new MalformedAutomatonException("Transition symbol '" + t.getKey() + "' (from " + e.getKey()
                                                          + ") is not in the alphabet " + new ArrayList<>(alphabet));
                }
                requireState(t.getValue(), "Transition target (from " + e.getKey() + " on '" + t.getKey() + "')");
            }
            table.put(e.getKey(), Collections.unmodifiableMap(new LinkedHashMap<>(e.getValue())));
        }
        this.transitions = Collections.unmodifiableMap(table);
    }

    private void requireState(StateSet<S> state, String role) {
        if (state == null) {
            throw new MalformedAutomatonException(role + " is null");
        }
        if (!states.contains(state)) {
            throw new MalformedAutomatonException(role + " " + state + " is not a state of the automaton");
        }
    }

    public Set<StateSet<S>> getStates() {
        return states;
    }

    public int size() {
        return states.size();
    }

    public Alphabet<I> getInputAlphabet() {
        return alphabet;
    }

    public Map<StateSet<S>, Map<I, StateSet<S>>> getTransitions() {
        return transitions;
    }

    /**
     * @return - successor of the state under the symbol, or null if the table has no such entry
     */
    public StateSet<S> getSuccessor(StateSet<S> state, I symbol) {
        final Map<I, StateSet<S>> bySymbol = transitions.get(state);
        return bySymbol == null ? null : bySymbol.get(symbol);
    }

    public StateSet<S> getStartState() {
        return startState;
    }

    public Set<StateSet<S>> getAcceptingStates() {
        return acceptingStates;
    }

    public boolean isAccepting(StateSet<S> state) {
        return acceptingStates.contains(state);
    }

    /**
     * Whether every state has a successor for every symbol.
     */
    public boolean isTotal() {
        for (StateSet<S> s : states) {
            final Map<I, StateSet<S>> bySymbol = transitions.get(s);
            if (bySymbol == null || !bySymbol.keySet().containsAll(alphabet)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        sb.append("States: ").append(states).append(System.lineSeparator());
        sb.append("Alphabet: ").append(new ArrayList<>(alphabet)).append(System.lineSeparator());
        sb.append("Transitions:").append(System.lineSeparator());
        for (Map.Entry<StateSet<S>, Map<I, StateSet<S>>> e : transitions.entrySet()) {
            for (Map.Entry<I, StateSet<S>> t : e.getValue().entrySet()) {
                sb.append("  (").append(e.getKey()).append(", ").append(t.getKey()).append(") -> ")
                  .append(t.getValue()).append(System.lineSeparator());
            }
        }
        sb.append("Start state: ").append(startState).append(System.lineSeparator());
        sb.append("Accepting states: ").append(acceptingStates);
        return sb.toString();
    }
}
