package Powerset.Model;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;

/**
 * Immutable non-deterministic finite automaton with epsilon transitions.
 * <p>
 * Epsilon transitions are kept apart from symbol transitions, so epsilon is never a member of the alphabet.
 * Every state gets a dense integer id (its position in {@link #getStates()}), which the powerset construction
 * uses to represent sets of states as {@link BitSet}s.
 * <p>
 * All structural invariants are checked on construction, see {@link MalformedAutomatonException}.
 *
 * @param <S> - state type, e.g., String
 * @param <I> - input symbol type, e.g., String
 */
public final class NFA<S, I> {
    /** Epsilon marker of the string-keyed table format, see {@link #fromTable}; never an alphabet symbol. */
    public static final String EPSILON = "";
    public static final int MISSING_STATE = -1;

    private final List<S> stateList;
    private final Set<S> states;
    private final Object2IntMap<S> stateIds;
    private final Alphabet<I> alphabet;
    private final Map<S, Map<I, Set<S>>> transitions;
    private final Map<S, Set<S>> epsilonTransitions;
    private final S startState;
    private final Set<S> acceptingStates;

    // index structures, by state id
    private final IntList[] epsilonTargetIds;
    private final List<Map<I, BitSet>> symbolTargetIds;
    private final BitSet acceptingIds;

    private NFA(Builder<S, I> builder) {
        this.stateList = new ArrayList<>(builder.states.size());
        this.stateIds = new Object2IntOpenHashMap<>(builder.states.size());
        this.stateIds.defaultReturnValue(MISSING_STATE);
        for (S s : builder.states) {
            if (s == null) {
                throw new MalformedAutomatonException("Null state");
            }
            if (stateIds.containsKey(s)) {
                throw new MalformedAutomatonException("Duplicate state: " + s);
            }
            stateIds.put(s, stateList.size());
            stateList.add(s);
        }
        this.states = Collections.unmodifiableSet(new LinkedHashSet<>(stateList));

        final Set<I> symbols = new LinkedHashSet<>();
        for (I i : builder.alphabet) {
            if (i == null) {
                throw new MalformedAutomatonException("Null alphabet symbol");
            }
            if (EPSILON.equals(i)) {
                throw new MalformedAutomatonException("Epsilon marker \"\" must not be part of the alphabet");
            }
            symbols.add(i);
        }
        this.alphabet = Alphabets.fromCollection(symbols);

        if (builder.startState == null) {
            throw new MalformedAutomatonException("No start state");
        }
        requireState(builder.startState, "Start state");
        this.startState = builder.startState;

        final Set<S> accepting = new LinkedHashSet<>();
        this.acceptingIds = new BitSet();
        for (S s : builder.acceptingStates) {
            requireState(s, "Accepting state");
            accepting.add(s);
            acceptingIds.set(stateIds.getInt(s));
        }
        this.acceptingStates = Collections.unmodifiableSet(accepting);

        final int size = stateList.size();
        this.epsilonTargetIds = new IntList[size];
        this.symbolTargetIds = new ArrayList<>(size);
        final IntList[] epsilonIds = new IntList[size];
        for (int id = 0; id < size; id++) {
            epsilonIds[id] = new IntArrayList();
            symbolTargetIds.add(new HashMap<>());
        }

        final Map<S, Map<I, Set<S>>> symbolTransitions = new LinkedHashMap<>();
        for (Map.Entry<S, Map<I, Set<S>>> e : builder.transitions.entrySet()) {
            final S source = e.getKey();
            requireState(source, "Transition source");
            final int sourceId = stateIds.getInt(source);
            final Map<I, Set<S>> bySymbol = new LinkedHashMap<>();
            for (Map.Entry<I, Set<S>> t : e.getValue().entrySet()) {
                final I symbol = t.getKey();
                if (symbol == null) {
                    throw new MalformedAutomatonException("Null transition symbol (from " + source + ")");
                }
                if (!alphabet.contains(symbol)) {
                    throw new MalformedAutomatonException("Transition symbol '" + symbol + "' (from " + source
                                                          + ") is not in the alphabet " + new ArrayList<>(alphabet));
                }
                final BitSet targetIds = new BitSet();
                for (S target : t.getValue()) {
                    requireState(target, "Transition target (from " + source + " on '" + symbol + "')");
                    targetIds.set(stateIds.getInt(target));
                }
                bySymbol.put(symbol, Collections.unmodifiableSet(new LinkedHashSet<>(t.getValue())));
                symbolTargetIds.get(sourceId).put(symbol, targetIds);
            }
            symbolTransitions.put(source, Collections.unmodifiableMap(bySymbol));
        }
        this.transitions = Collections.unmodifiableMap(symbolTransitions);

        final Map<S, Set<S>> epsilon = new LinkedHashMap<>();
        for (Map.Entry<S, Set<S>> e : builder.epsilonTransitions.entrySet()) {
            final S source = e.getKey();
            requireState(source, "Epsilon transition source");
            final int sourceId = stateIds.getInt(source);
            for (S target : e.getValue()) {
                requireState(target, "Epsilon transition target (from " + source + ")");
                final int targetId = stateIds.getInt(target);
                if (!epsilonIds[sourceId].contains(targetId)) {
                    epsilonIds[sourceId].add(targetId);
                }
            }
            epsilon.put(source, Collections.unmodifiableSet(new LinkedHashSet<>(e.getValue())));
        }
        this.epsilonTransitions = Collections.unmodifiableMap(epsilon);
        for (int id = 0; id < size; id++) {
            epsilonTargetIds[id] = IntLists.unmodifiable(epsilonIds[id]);
        }
    }

    private void requireState(S state, String role) {
        if (state == null) {
            throw new MalformedAutomatonException(role + " is null");
        }
        if (!stateIds.containsKey(state)) {
            throw new MalformedAutomatonException(role + " " + state + " is not a state of the automaton");
        }
    }

    /**
     * Start building an NFA.
     * @param states - all states, without duplicates
     * @param alphabet - input symbols
     * @return - builder; the automaton is validated by {@link Builder#build()}
     */
    public static <S, I> Builder<S, I> builder(Collection<? extends S> states, Collection<? extends I> alphabet) {
        return new Builder<>(states, alphabet);
    }

    /**
     * Build an NFA from a transition table keyed by strings, where the {@link #EPSILON} key ({@code ""})
     * denotes epsilon transitions.
     * @param states - all states
     * @param alphabet - input symbols, must not contain {@link #EPSILON}
     * @param table - state -> symbol-or-epsilon -> target states
     * @param startState - start state
     * @param acceptingStates - accepting states
     * @return - validated NFA
     */
    public static <S> NFA<S, String> fromTable(Collection<? extends S> states,
                                               Collection<String> alphabet,
                                               Map<? extends S, ? extends Map<String, ? extends Collection<? extends S>>> table,
                                               S startState,
                                               Collection<? extends S> acceptingStates) {
        final Builder<S, String> builder = builder(states, alphabet);
        for (Map.Entry<? extends S, ? extends Map<String, ? extends Collection<? extends S>>> row : table.entrySet()) {
            for (Map.Entry<String, ? extends Collection<? extends S>> cell : row.getValue().entrySet()) {
                if (EPSILON.equals(cell.getKey())) {
                    builder.addEpsilonTransitions(row.getKey(), cell.getValue());
                } else {
                    builder.addTransitions(row.getKey(), cell.getKey(), cell.getValue());
                }
            }
        }
        return builder.setStartState(startState).setAccepting(acceptingStates).build();
    }

    public Set<S> getStates() {
        return states;
    }

    public int size() {
        return stateList.size();
    }

    public Alphabet<I> getInputAlphabet() {
        return alphabet;
    }

    /**
     * @return - symbol transitions, state -> symbol -> targets. States without symbol transitions are absent.
     */
    public Map<S, Map<I, Set<S>>> getTransitions() {
        return transitions;
    }

    /**
     * @return - epsilon transitions, state -> targets. States without epsilon transitions are absent.
     */
    public Map<S, Set<S>> getEpsilonTransitions() {
        return epsilonTransitions;
    }

    public Set<S> getSuccessors(S state, I symbol) {
        final Map<I, Set<S>> bySymbol = transitions.get(state);
        if (bySymbol == null) {
            return Collections.emptySet();
        }
        return bySymbol.getOrDefault(symbol, Collections.emptySet());
    }

    public Set<S> getEpsilonSuccessors(S state) {
        return epsilonTransitions.getOrDefault(state, Collections.emptySet());
    }

    public S getStartState() {
        return startState;
    }

    public Set<S> getAcceptingStates() {
        return acceptingStates;
    }

    public boolean isAccepting(S state) {
        return acceptingStates.contains(state);
    }

    /**
     * @return - dense id of the state, or {@link #MISSING_STATE}
     */
    public int getStateId(Object state) {
        return stateIds.getInt(state);
    }

    public S getState(int id) {
        return stateList.get(id);
    }

    /**
     * @return - ids of the epsilon successors of a state, unmodifiable
     */
    public IntList getEpsilonTargetIds(int id) {
        return epsilonTargetIds[id];
    }

    /**
     * Add the ids of the successors of a state under a symbol to a set.
     * @param id - source state id
     * @param symbol - input symbol
     * @param into - receives the successor ids
     */
    public void collectTargetIds(int id, I symbol, BitSet into) {
        final BitSet targets = symbolTargetIds.get(id).get(symbol);
        if (targets != null) {
            into.or(targets);
        }
    }

    /**
     * Whether a set of state ids contains an accepting state.
     */
    public boolean containsAccepting(BitSet ids) {
        return acceptingIds.intersects(ids);
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        sb.append("States: ").append(states).append(System.lineSeparator());
        sb.append("Alphabet: ").append(new ArrayList<>(alphabet)).append(System.lineSeparator());
        sb.append("Transitions:").append(System.lineSeparator());
        for (S s : stateList) {
            for (S t : getEpsilonSuccessors(s)) {
                sb.append("  (").append(s).append(", ε) -> ").append(t).append(System.lineSeparator());
            }
            final Map<I, Set<S>> bySymbol = transitions.getOrDefault(s, Collections.emptyMap());
            for (Map.Entry<I, Set<S>> e : bySymbol.entrySet()) {
                for (S t : e.getValue()) {
                    sb.append("  (").append(s).append(", ").append(e.getKey()).append(") -> ").append(t)
                      .append(System.lineSeparator());
                }
            }
        }
        sb.append("Start state: ").append(startState).append(System.lineSeparator());
        sb.append("Accepting states: ").append(acceptingStates);
        return sb.toString();
    }

    /**
     * Collects an NFA definition; nothing is checked until {@link #build()}.
     */
    public static final class Builder<S, I> {
        private final List<S> states;
        private final List<I> alphabet;
        private final Map<S, Map<I, Set<S>>> transitions = new LinkedHashMap<>();
        private final Map<S, Set<S>> epsilonTransitions = new LinkedHashMap<>();
        private final List<S> acceptingStates = new ArrayList<>();
        private S startState;

        private Builder(Collection<? extends S> states, Collection<? extends I> alphabet) {
            this.states = new ArrayList<>(states);
            this.alphabet = new ArrayList<>(alphabet);
        }

        public Builder<S, I> addTransition(S source, I symbol, S target) {
            transitions.computeIfAbsent(source, k -> new LinkedHashMap<>())
                       .computeIfAbsent(symbol, k -> new LinkedHashSet<>())
                       .add(target);
            return this;
        }

        public Builder<S, I> addTransitions(S source, I symbol, Collection<? extends S> targets) {
            // an empty target set still declares the source and symbol, so both get validated
            final Set<S> existing = transitions.computeIfAbsent(source, k -> new LinkedHashMap<>())
                                               .computeIfAbsent(symbol, k -> new LinkedHashSet<>());
            existing.addAll(targets);
            return this;
        }

        public Builder<S, I> addEpsilonTransition(S source, S target) {
            epsilonTransitions.computeIfAbsent(source, k -> new LinkedHashSet<>()).add(target);
            return this;
        }

        public Builder<S, I> addEpsilonTransitions(S source, Collection<? extends S> targets) {
            epsilonTransitions.computeIfAbsent(source, k -> new LinkedHashSet<>()).addAll(targets);
            return this;
        }

        public Builder<S, I> setStartState(S startState) {
            this.startState = startState;
            return this;
        }

        public Builder<S, I> addAccepting(S state) {
            acceptingStates.add(state);
            return this;
        }

        public Builder<S, I> setAccepting(Collection<? extends S> accepting) {
            acceptingStates.clear();
            acceptingStates.addAll(accepting);
            return this;
        }

        public NFA<S, I> build() {
            return new NFA<>(this);
        }
    }
}
