package Powerset.Trace;

import java.io.PrintStream;

/**
 * Receives the steps of a subset construction. A sink only observes; it cannot influence the result.
 */
@FunctionalInterface
public interface TraceSink<S, I> {

    void accept(TraceEvent<S, I> event);

    /**
     * Whether the construction should build events at all.
     */
    default boolean isEnabled() {
        return true;
    }

    static <S, I> TraceSink<S, I> noop() {
        return new TraceSink<>() {
            @Override
            public void accept(TraceEvent<S, I> event) {}

            @Override
            public boolean isEnabled() {
                return false;
            }
        };
    }

    /**
     * Print one line per event.
     * @param out - destination, e.g. System.out
     */
    static <S, I> TraceSink<S, I> printing(PrintStream out) {
        return event -> out.println(event);
    }
}
