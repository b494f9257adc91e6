package Powerset.Trace;

import Powerset.Model.StateSet;

/**
 * One step of the subset construction.
 * @param kind - what happened
 * @param state - the DFA state the step is about; the source state for transitions
 * @param symbol - input symbol, for {@link Kind#SYMBOL_PROCESSED} and {@link Kind#TRANSITION_RECORDED}, else null
 * @param target - successor, for {@link Kind#TRANSITION_RECORDED}, else null
 * @param <S> - NFA state type
 * @param <I> - input symbol type
 */
public record TraceEvent<S, I>(Kind kind, StateSet<S> state, I symbol, StateSet<S> target) {

    public enum Kind {
        /** A set of NFA states was seen for the first time and put on the worklist. */
        STATE_DISCOVERED,
        /** A state was taken off the worklist. */
        STATE_EXPANDED,
        /** The successor of a state under a symbol is being computed. */
        SYMBOL_PROCESSED,
        /** A transition was added to the DFA. */
        TRANSITION_RECORDED,
        /** A state contains an accepting NFA state. */
        STATE_ACCEPTING,
        /** The worklist is empty; {@code state} is the DFA start state. */
        FINISHED
    }

    public static <S, I> TraceEvent<S, I> discovered(StateSet<S> state) {
        return new TraceEvent<>(Kind.STATE_DISCOVERED, state, null, null);
    }

    public static <S, I> TraceEvent<S, I> expanded(StateSet<S> state) {
        return new TraceEvent<>(Kind.STATE_EXPANDED, state, null, null);
    }

    public static <S, I> TraceEvent<S, I> symbolProcessed(StateSet<S> state, I symbol) {
        return new TraceEvent<>(Kind.SYMBOL_PROCESSED, state, symbol, null);
    }

    public static <S, I> TraceEvent<S, I> transition(StateSet<S> source, I symbol, StateSet<S> target) {
        return new TraceEvent<>(Kind.TRANSITION_RECORDED, source, symbol, target);
    }

    public static <S, I> TraceEvent<S, I> accepting(StateSet<S> state) {
        return new TraceEvent<>(Kind.STATE_ACCEPTING, state, null, null);
    }

    public static <S, I> TraceEvent<S, I> finished(StateSet<S> startState) {
        return new TraceEvent<>(Kind.FINISHED, startState, null, null);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case STATE_DISCOVERED -> "Discovered state " + state + ", adding it to the worklist";
            case STATE_EXPANDED -> "Processing state: " + state;
            case SYMBOL_PROCESSED -> "Processing symbol '" + symbol + "' from " + state;
            case TRANSITION_RECORDED -> "Transition: (" + state + ", " + symbol + ") -> " + target;
            case STATE_ACCEPTING -> "State " + state + " contains an accepting state of the NFA";
            case FINISHED -> "Construction finished, start state " + state;
        };
    }
}
