package co.fanki.reexportmap.analysis.domain;

import co.fanki.reexportmap.shared.DomainException;

import java.nio.file.Path;

/**
 * Thrown when a package source tree cannot be found at all.
 *
 * <p>This is the only failure that aborts a run; everything below the
 * source root is recovered per module.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class SourceUnavailableException extends DomainException {

    private static final long serialVersionUID = 1L;

    /** Error code reported by this exception. */
    public static final String ERROR_CODE = "SOURCE_UNAVAILABLE";

    /**
     * Creates a new exception for a missing source root.
     *
     * @param description what the root was expected to hold
     * @param root the missing directory
     */
    public SourceUnavailableException(final String description,
            final Path root) {
        super(description + " not found at " + root, ERROR_CODE);
    }

    /**
     * Creates a new exception for a source root that cannot be read.
     *
     * @param description what the root was expected to hold
     * @param root the unreadable directory
     * @param cause the underlying failure
     */
    public SourceUnavailableException(final String description,
            final Path root, final Throwable cause) {
        super(description + " cannot be read at " + root + ": "
                + cause.getMessage(), ERROR_CODE, cause);
    }

}
