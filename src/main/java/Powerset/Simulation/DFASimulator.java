package Powerset.Simulation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import Powerset.Model.DFA;
import Powerset.Model.StateSet;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.word.Word;

/**
 * Runs a DFA on an input, left to right.
 */
public class DFASimulator {

    /**
     * @param dfa - automaton
     * @param input - symbols, e.g. a {@link Word}
     * @return - accepted or rejected, or the first symbol outside the alphabet
     * @throws IllegalStateException if the DFA has no transition for an alphabet symbol, i.e. it is not total
     */
    public static <S, I> SimulationResult<I> simulate(DFA<S, I> dfa, Iterable<? extends I> input) {
        Objects.requireNonNull(dfa, "dfa");
        Objects.requireNonNull(input, "input");
        final Alphabet<I> alphabet = dfa.getInputAlphabet();

        StateSet<S> current = dfa.getStartState();
        int position = 0;
        for (I sym : input) {
            if (sym == null || !alphabet.contains(sym)) {
                return SimulationResult.failed(new SymbolNotInAlphabet<>(sym, position, alphabet));
            }
            final StateSet<S> next = dfa.getSuccessor(current, sym);
            if (next == null) {
                throw new IllegalStateException("No transition from " + current + " on symbol '" + sym
                                                + "'; the DFA transition table is not total");
            }
            current = next;
            position++;
        }
        return SimulationResult.of(dfa.isAccepting(current));
    }

    /**
     * Simulate a DFA over single-character symbols on a string.
     * @param dfa - automaton whose symbols are strings of one character each
     * @param input - each code point is one symbol
     */
    public static <S> SimulationResult<String> simulate(DFA<S, String> dfa, String input) {
        return simulate(dfa, toSymbols(input));
    }

    /**
     * @return - one symbol per code point of the input
     */
    public static Word<String> toSymbols(String input) {
        final List<String> symbols = new ArrayList<>(input.length());
        input.codePoints().forEach(cp -> symbols.add(new String(Character.toChars(cp))));
        return Word.fromList(symbols);
    }
}
