package Powerset;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import Powerset.Model.DFA;
import Powerset.Model.NFA;
import Powerset.Model.StateSet;
import Powerset.Trace.TraceEvent;
import Powerset.Trace.TraceSink;
import net.automatalib.alphabet.Alphabet;

/**
 * Subset construction of an epsilon-NFA into an equivalent DFA.
 */
public class SubsetConstruction {
    public static boolean DEBUG = false;
    private static final long STATES_EXPLORED_PERIOD = 10000L;

    public static <S, I> DFA<S, I> convert(NFA<S, I> nfa) {
        return convert(nfa, TraceSink.noop());
    }

    /**
     * Convert an NFA into a DFA accepting the same language.
     * @param nfa - original NFA
     * @param trace - observer of the construction steps
     * @return - DFA over the reachable epsilon-closed sets of NFA states; total, including the empty (sink) set
     * if it is reachable
     * @param <S> - NFA state type
     * @param <I> - input symbol type
     */
    public static <S, I> DFA<S, I> convert(NFA<S, I> nfa, TraceSink<S, I> trace) {
        Objects.requireNonNull(nfa, "nfa");
        Objects.requireNonNull(trace, "trace");
        return doConvert(new EpsilonPowersetView<>(nfa), nfa.getInputAlphabet(), trace);
    }

    private static <S, I> DFA<S, I> doConvert(EpsilonPowersetView<S, I> powerset,
                                              Alphabet<I> inputs,
                                              TraceSink<S, I> trace) {
        final NFA<S, I> nfa = powerset.getNFA();
        final boolean tracing = trace.isEnabled();

        // discovery order; a state is registered when it is pushed, not when it is expanded
        final Map<BitSet, StateSet<S>> outStateMap = new LinkedHashMap<>();
        final Map<StateSet<S>, Map<I, StateSet<S>>> transitions = new LinkedHashMap<>();
        final Deque<DeterminizeRecord<S>> stack = new ArrayDeque<>();

        final BitSet init = powerset.getInitialState();
        final StateSet<S> initOut = BitSetUtils.toStateSet(nfa, init);
        outStateMap.put(init, initOut);
        stack.push(new DeterminizeRecord<>(init, initOut));
        if (tracing) {
            trace.accept(TraceEvent.discovered(initOut));
        }

        long statesExplored = 0;
        while (!stack.isEmpty()) {
            final DeterminizeRecord<S> curr = stack.pop();
            final BitSet inState = curr.inputState();
            final StateSet<S> outState = curr.outputState();
            if (tracing) {
                trace.accept(TraceEvent.expanded(outState));
            }

            final Map<I, StateSet<S>> row = new LinkedHashMap<>();
            for (I sym : inputs) {
                if (tracing) {
                    trace.accept(TraceEvent.symbolProcessed(outState, sym));
                }
                final BitSet succ = powerset.getSuccessor(inState, sym);

                StateSet<S> outSucc = outStateMap.get(succ);
                if (outSucc == null) {
                    // add new state to DFA and to stack
                    outSucc = BitSetUtils.toStateSet(nfa, succ);
                    outStateMap.put(succ, outSucc);
                    stack.push(new DeterminizeRecord<>(succ, outSucc));
                    if (tracing) {
                        trace.accept(TraceEvent.discovered(outSucc));
                    }
                }
                row.put(sym, outSucc);
                if (tracing) {
                    trace.accept(TraceEvent.transition(outState, sym, outSucc));
                }
            }
            transitions.put(outState, row);
            statesExplored++;

            if (DEBUG && statesExplored % STATES_EXPLORED_PERIOD == 0) {
                System.out.println("DEBUG: Explored " + statesExplored + " states - "
                + stack.size() + " states left in worklist - " + outStateMap.size() + " states discovered");
            }
        }

        final List<StateSet<S>> accepting = new ArrayList<>();
        for (Map.Entry<BitSet, StateSet<S>> e : outStateMap.entrySet()) {
            if (powerset.isAccepting(e.getKey())) {
                accepting.add(e.getValue());
                if (tracing) {
                    trace.accept(TraceEvent.accepting(e.getValue()));
                }
            }
        }
        if (tracing) {
            trace.accept(TraceEvent.finished(initOut));
        }
        if (DEBUG) {
            System.out.println("DEBUG: Subset construction done - " + outStateMap.size() + " states, "
            + accepting.size() + " accepting");
        }

        return new DFA<>(outStateMap.values(), inputs, transitions, initOut, accepting);
    }

    private record DeterminizeRecord<S>(BitSet inputState, StateSet<S> outputState) { }
}
