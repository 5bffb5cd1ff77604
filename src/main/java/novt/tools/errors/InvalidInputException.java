package novt.tools.errors;

/**
 * Raised for caller input that cannot be processed: empty or malformed catalogs, unknown aperture names,
 * and date ranges that are out of order or outside the ephemeris coverage.
 */
public class InvalidInputException extends IllegalArgumentException {

    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
