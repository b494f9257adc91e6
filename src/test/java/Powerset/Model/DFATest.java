package Powerset.Model;

import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertThrows;

public class DFATest {
  private static final StateSet<String> A = StateSet.of("a");
  private static final StateSet<String> B = StateSet.of("b");
  private static final Alphabet<String> AB = Alphabets.fromCollection(List.of("x", "y"));

  @Test
  void testPartialDFA() {
    DFA<String, String> dfa = new DFA<>(List.of(A, B), AB, Map.of(A, Map.of("x", B)), A, List.of(B));
    Assertions.assertEquals(2, dfa.size());
    Assertions.assertEquals(B, dfa.getSuccessor(A, "x"));
    Assertions.assertNull(dfa.getSuccessor(A, "y"));
    Assertions.assertNull(dfa.getSuccessor(B, "x"));
    Assertions.assertTrue(dfa.isAccepting(B));
    Assertions.assertFalse(dfa.isAccepting(A));
    Assertions.assertFalse(dfa.isTotal());
    Assertions.assertEquals(Set.of(B), dfa.getAcceptingStates());
  }

  @Test
  void testTotalDFA() {
    DFA<String, String> dfa = new DFA<>(List.of(A, B), AB,
        Map.of(A, Map.of("x", B, "y", A), B, Map.of("x", B, "y", B)), A, List.of());
    Assertions.assertTrue(dfa.isTotal());
    Assertions.assertTrue(dfa.toString().contains("({a}, x) -> {b}"));
  }

  @Test
  void testMalformed() {
    StateSet<String> c = StateSet.of("c");
    assertThrows(MalformedAutomatonException.class, () ->
        new DFA<>(List.of(A), AB, Map.of(), c, List.of()));
    assertThrows(MalformedAutomatonException.class, () ->
        new DFA<>(List.of(A), AB, Map.of(), A, List.of(c)));
    assertThrows(MalformedAutomatonException.class, () ->
        new DFA<>(List.of(A), AB, Map.of(A, Map.of("x", c)), A, List.of()));
    assertThrows(MalformedAutomatonException.class, () ->
        new DFA<>(List.of(A), AB, Map.of(c, Map.of("x", A)), A, List.of()));
    MalformedAutomatonException e = assertThrows(MalformedAutomatonException.class, () ->
        new DFA<>(List.of(A), AB, Map.of(A, Map.of("z", A)), A, List.of()));
    Assertions.assertTrue(e.getMessage().contains("'z'"));
  }
}
