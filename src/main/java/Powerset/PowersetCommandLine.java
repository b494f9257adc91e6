package Powerset;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

import Powerset.Model.DFA;
import Powerset.Model.NFA;
import Powerset.Simulation.DFASimulator;
import Powerset.Simulation.SimulationResult;
import Powerset.Trace.TraceSink;

public class PowersetCommandLine {
  static final List<String> EXAMPLE_INPUTS = List.of("0111", "1");

  public static void main(String[] args) {
    boolean trace = false;
    List<String> positional = new ArrayList<>(1);

    for (String arg : args) {
      if ("--trace".equalsIgnoreCase(arg)) {
        trace = true;
      } else if ("--debug".equalsIgnoreCase(arg)) {
        SubsetConstruction.DEBUG = true;
      } else if (arg.startsWith("-")) {
        // Unknown flag
        printUsageAndExit();
      } else {
        positional.add(arg);
      }
    }

    if (positional.size() > 1) {
      printUsageAndExit();
    }

    run(positional.isEmpty() ? EXAMPLE_INPUTS : positional, trace, System.out);
  }

  private static void printUsageAndExit() {
    System.out.println("Powerset [--trace] [--debug] [<input>]");
    System.out.println("[--trace] : Print every step of the subset construction");
    System.out.println("[--debug] : Additional debug/progress output");
    System.out.println();
    System.out.println("<input> : word over the alphabet {0, 1} to run through the DFA.");
    System.out.println("  Without an input, the examples " + EXAMPLE_INPUTS + " are run.");
    System.exit(0);
  }

  /**
   * Convert the reference NFA and run the inputs through the resulting DFA.
   * @param inputs - words to simulate, one at a time
   * @param trace - whether to print the construction steps
   * @param out - destination of all output
   * @return - one result per input
   */
  static List<SimulationResult<String>> run(List<String> inputs, boolean trace, PrintStream out) {
    final NFA<String, String> nfa = ReferenceAutomata.containsZero();
    out.println("Our NFA is defined as follows:");
    out.println(nfa);
    out.println("*".repeat(50));

    final TraceSink<String, String> sink = trace ? TraceSink.printing(out) : TraceSink.noop();
    long before = System.currentTimeMillis();
    final DFA<String, String> dfa = SubsetConstruction.convert(nfa, sink);
    long after = System.currentTimeMillis();
    out.println("Resulting DFA:");
    out.println(dfa);
    if (SubsetConstruction.DEBUG) {
      out.println("DEBUG: conversion duration: " + ((after - before) / 1000f) + "s");
    }

    final List<SimulationResult<String>> results = new ArrayList<>(inputs.size());
    for (String input : inputs) {
      out.println("*".repeat(50));
      out.println("Example Input: " + input);
      final SimulationResult<String> result = DFASimulator.simulate(dfa, input);
      if (result.isError()) {
        out.println("Input: " + input + ", " + result);
      } else {
        out.println("Input: " + input + ", is " + (result.isAccepted() ? "accepted" : "rejected"));
      }
      results.add(result);
    }
    return results;
  }
}
