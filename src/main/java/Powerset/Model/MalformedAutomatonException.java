package Powerset.Model;

/**
 * Thrown when an automaton definition violates its structural invariants,
 * e.g. a transition refers to a state that was never declared.
 */
public class MalformedAutomatonException extends IllegalArgumentException {

    public MalformedAutomatonException(String message) {
        super(message);
    }
}
