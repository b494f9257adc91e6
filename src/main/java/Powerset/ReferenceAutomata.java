package Powerset;

import java.util.List;
import java.util.Map;
import java.util.Set;

import Powerset.Model.NFA;

/**
 * Example automata.
 */
public class ReferenceAutomata {

    /**
     * NFA over {0, 1} accepting the words that contain a 0:
     * q0 moves to q1 on epsilon, q1 loops on 1 and moves to q2 on 0, q2 loops on both symbols and accepts.
     */
    public static NFA<String, String> containsZero() {
        return NFA.fromTable(
            List.of("q0", "q1", "q2"),
            List.of("0", "1"),
            Map.of(
                "q0", Map.of(NFA.EPSILON, Set.of("q1")),
                "q1", Map.of("0", Set.of("q2"), "1", Set.of("q1")),
                "q2", Map.of("0", Set.of("q2"), "1", Set.of("q2"))),
            "q0",
            Set.of("q2"));
    }
}
