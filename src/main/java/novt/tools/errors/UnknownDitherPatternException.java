package novt.tools.errors;

import java.util.Collection;

/**
 * Raised when a dither pattern name is not present in the dither offset table.
 */
public class UnknownDitherPatternException extends IllegalArgumentException {

    private final String pattern;

    public UnknownDitherPatternException(String pattern, Collection<String> options) {
        super("Dither pattern " + pattern + " not recognized. Options are: " + options + ".");
        this.pattern = pattern;
    }

    public String getPattern() {
        return pattern;
    }
}
