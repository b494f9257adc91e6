package Powerset.Simulation;

import java.util.ArrayList;
import java.util.List;

import net.automatalib.alphabet.Alphabet;

/**
 * An input symbol the DFA has no transitions for, because it is not in the alphabet.
 * @param symbol - offending symbol
 * @param position - zero-based position of the symbol in the input
 * @param alphabet - alphabet of the DFA
 */
public record SymbolNotInAlphabet<I>(I symbol, int position, Alphabet<I> alphabet) {

    public String getMessage() {
        final List<I> symbols = new ArrayList<>(alphabet);
        return "Symbol '" + symbol + "' not in alphabet " + symbols;
    }
}
