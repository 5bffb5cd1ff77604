package novt.tools.errors;

/**
 * Raised when the ephemeris service fails while computing a timeline. Not retried.
 */
public class EphemerisUnavailableException extends RuntimeException {

    public EphemerisUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
