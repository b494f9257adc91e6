package Powerset.Simulation;

/**
 * Raised when the outcome of a simulation that stopped at a foreign symbol is read as accept/reject.
 */
public class SymbolNotInAlphabetException extends RuntimeException {
    private final SymbolNotInAlphabet<?> error;

    public SymbolNotInAlphabetException(SymbolNotInAlphabet<?> error) {
        super(error.getMessage());
        this.error = error;
    }

    public SymbolNotInAlphabet<?> getError() {
        return error;
    }

    public Object getSymbol() {
        return error.symbol();
    }
}
