package Powerset.Simulation;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of running a DFA on an input: accepted, rejected, or stopped at a symbol outside the alphabet.
 * @param <I> - input symbol type
 */
public final class SimulationResult<I> {
    private final boolean accepted;
    private final SymbolNotInAlphabet<I> error;

    private SimulationResult(boolean accepted, SymbolNotInAlphabet<I> error) {
        this.accepted = accepted;
        this.error = error;
    }

    public static <I> SimulationResult<I> of(boolean accepted) {
        return new SimulationResult<>(accepted, null);
    }

    public static <I> SimulationResult<I> failed(SymbolNotInAlphabet<I> error) {
        return new SimulationResult<>(false, Objects.requireNonNull(error));
    }

    public boolean isError() {
        return error != null;
    }

    public Optional<SymbolNotInAlphabet<I>> getError() {
        return Optional.ofNullable(error);
    }

    /**
     * @return - whether the input was accepted
     * @throws SymbolNotInAlphabetException if the input contained a symbol outside the alphabet
     */
    public boolean isAccepted() {
        if (error != null) {
            throw new SymbolNotInAlphabetException(error);
        }
        return accepted;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SimulationResult)) {
            return false;
        }
        final SimulationResult<?> that = (SimulationResult<?>) o;
        return accepted == that.accepted && Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(accepted, error);
    }

    @Override
    public String toString() {
        if (error != null) {
            return error.getMessage();
        }
        return accepted ? "accepted" : "rejected";
    }
}
