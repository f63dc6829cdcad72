package co.fanki.markupgraph.analysis.domain;

import co.fanki.markupgraph.shared.DomainException;

/**
 * Raised when the markup document cannot be turned into a tree at all.
 *
 * <p>This is the only failure that aborts an analysis run; no partial
 * graph is produced.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class InvalidMarkupException extends DomainException {

    private static final long serialVersionUID = 1L;

    /** Error code reported to callers for unusable input. */
    public static final String ERROR_CODE = "INVALID_INPUT";

    /**
     * Creates a new exception.
     *
     * @param message the human-readable reason
     */
    public InvalidMarkupException(final String message) {
        super(message, ERROR_CODE);
    }

    /**
     * Creates a new exception wrapping the parser failure.
     *
     * @param message the human-readable reason
     * @param cause the parser failure
     */
    public InvalidMarkupException(final String message,
            final Throwable cause) {
        super(message, ERROR_CODE, cause);
    }

}
