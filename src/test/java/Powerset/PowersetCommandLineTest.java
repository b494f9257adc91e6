package Powerset;

import Powerset.Simulation.SimulationResult;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

class PowersetCommandLineTest {
  private static String run(List<String> inputs, boolean trace, List<SimulationResult<String>> results) {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8);
    results.addAll(PowersetCommandLine.run(inputs, trace, out));
    return bytes.toString(StandardCharsets.UTF_8);
  }

  @Test
  void testExampleInputs() {
    List<SimulationResult<String>> results = new ArrayList<>();
    String text = run(PowersetCommandLine.EXAMPLE_INPUTS, false, results);
    Assertions.assertEquals(List.of(SimulationResult.of(true), SimulationResult.of(false)), results);
    Assertions.assertTrue(text.contains("Our NFA is defined as follows:"));
    Assertions.assertTrue(text.contains("(q0, ε) -> q1"));
    Assertions.assertTrue(text.contains("Input: 0111, is accepted"));
    Assertions.assertTrue(text.contains("Input: 1, is rejected"));
    Assertions.assertFalse(text.contains("Processing state"));
  }

  @Test
  void testTrace() {
    String text = run(List.of("0"), true, new ArrayList<>());
    Assertions.assertTrue(text.contains("Processing state: {q0, q1}"));
    Assertions.assertTrue(text.contains("Input: 0, is accepted"));
  }

  @Test
  void testForeignSymbolIsReported() {
    List<SimulationResult<String>> results = new ArrayList<>();
    String text = run(List.of("012"), false, results);
    Assertions.assertTrue(results.get(0).isError());
    Assertions.assertTrue(text.contains("Input: 012, Symbol '2' not in alphabet"));
  }
}
