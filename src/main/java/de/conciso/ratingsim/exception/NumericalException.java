package de.conciso.ratingsim.exception;

/**
 * NaN or infinity showed up where the inputs guarantee a finite result.
 */
public class NumericalException extends SimulationException {

    public NumericalException(String message) {
        super(message);
    }
}
