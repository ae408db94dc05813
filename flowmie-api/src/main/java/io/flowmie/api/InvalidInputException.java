package io.flowmie.api;

/**
 * Thrown when a particle, detector, amplitude set, calibration table or integration
 * setting violates its construction invariants.
 *
 * Raised at the point of detection, before any computation starts.
 */
public class InvalidInputException extends FlowMieException {

    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Invalid parameter with the offending value and the accepted domain. */
    public static InvalidInputException invalidParameter(String name, Object value, String expected) {
        return new InvalidInputException(
            String.format("Invalid parameter '%s': got '%s', expected %s", name, value, expected));
    }
}
