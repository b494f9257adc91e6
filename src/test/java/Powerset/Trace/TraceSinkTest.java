package Powerset.Trace;

import Powerset.Model.DFA;
import Powerset.Model.NFA;
import Powerset.Model.StateSet;
import Powerset.ReferenceAutomata;
import Powerset.SubsetConstruction;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

public class TraceSinkTest {
  @Test
  void testEventsOfReferenceConstruction() {
    NFA<String, String> nfa = ReferenceAutomata.containsZero();
    List<TraceEvent<String, String>> events = new ArrayList<>();
    DFA<String, String> dfa = SubsetConstruction.convert(nfa, events::add);

    Assertions.assertEquals(TraceEvent.discovered(StateSet.of("q0", "q1")), events.get(0));
    Assertions.assertEquals(TraceEvent.Kind.STATE_EXPANDED, events.get(1).kind());
    Assertions.assertEquals(TraceEvent.finished(dfa.getStartState()), events.get(events.size() - 1));

    Assertions.assertEquals(dfa.size(), count(events, TraceEvent.Kind.STATE_DISCOVERED));
    Assertions.assertEquals(dfa.size(), count(events, TraceEvent.Kind.STATE_EXPANDED));
    Assertions.assertEquals(dfa.size() * 2, count(events, TraceEvent.Kind.SYMBOL_PROCESSED));
    Assertions.assertEquals(dfa.size() * 2, count(events, TraceEvent.Kind.TRANSITION_RECORDED));
    Assertions.assertEquals(List.of(TraceEvent.accepting(StateSet.of("q2"))),
        events.stream().filter(e -> e.kind() == TraceEvent.Kind.STATE_ACCEPTING).collect(Collectors.toList()));

    // every recorded transition is in the table
    for (TraceEvent<String, String> e : events) {
      if (e.kind() == TraceEvent.Kind.TRANSITION_RECORDED) {
        Assertions.assertEquals(e.target(), dfa.getSuccessor(e.state(), e.symbol()));
      }
    }
  }

  @Test
  void testTracingDoesNotChangeResult() {
    NFA<String, String> nfa = ReferenceAutomata.containsZero();
    DFA<String, String> plain = SubsetConstruction.convert(nfa);
    DFA<String, String> traced = SubsetConstruction.convert(nfa, event -> { });
    Assertions.assertEquals(plain.getStates(), traced.getStates());
    Assertions.assertEquals(plain.getTransitions(), traced.getTransitions());
    Assertions.assertEquals(plain.getAcceptingStates(), traced.getAcceptingStates());
  }

  @Test
  void testPrintingSink() {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8);
    SubsetConstruction.convert(ReferenceAutomata.containsZero(), TraceSink.printing(out));
    String text = bytes.toString(StandardCharsets.UTF_8);
    Assertions.assertTrue(text.contains("Processing state: {q0, q1}"));
    Assertions.assertTrue(text.contains("Transition: ({q0, q1}, 0) -> {q2}"));
    Assertions.assertTrue(text.contains("State {q2} contains an accepting state of the NFA"));
  }

  @Test
  void testNoopSink() {
    TraceSink<String, String> noop = TraceSink.noop();
    Assertions.assertFalse(noop.isEnabled());
    noop.accept(TraceEvent.finished(StateSet.empty()));
    Assertions.assertTrue(TraceSink.<String, String>printing(System.out).isEnabled());
  }

  private static long count(List<TraceEvent<String, String>> events, TraceEvent.Kind kind) {
    return events.stream().filter(e -> e.kind() == kind).count();
  }
}
