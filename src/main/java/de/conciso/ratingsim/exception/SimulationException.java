package de.conciso.ratingsim.exception;

/**
 * Base class for fatal simulation errors. A run that raises one of these is aborted.
 */
public class SimulationException extends RuntimeException {

    public SimulationException(String message) {
        super(message);
    }
}
