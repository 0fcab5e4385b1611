package de.conciso.ratingsim.exception;

/**
 * A parameter, attribute or rating value violates the strictly-positive, finite
 * domain the log-scale model requires. Usually a configuration bug.
 */
public class InvalidParameterException extends SimulationException {

    public InvalidParameterException(String message) {
        super(message);
    }

    public static InvalidParameterException of(String paramName, Object value, String expected) {
        return new InvalidParameterException(
                String.format("Invalid parameter '%s': got '%s', expected %s", paramName, value, expected));
    }
}
