package co.fanki.reexportmap.shared;

/**
 * Base exception for analysis failures.
 *
 * <p>The error code names the failure kind ({@code SOURCE_UNAVAILABLE},
 * {@code PARSE_FAILURE}, ...) so the runner can log it and decide the exit
 * code without inspecting messages.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DomainException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String errorCode;

    /**
     * Creates a new exception with a message and error code.
     *
     * @param message the error message
     * @param theErrorCode the failure kind, never blank
     */
    public DomainException(final String message, final String theErrorCode) {
        this(message, theErrorCode, null);
    }

    /**
     * Creates a new exception with a message, error code and cause.
     *
     * @param message the error message
     * @param theErrorCode the failure kind, never blank
     * @param cause the underlying cause, may be null
     */
    public DomainException(final String message, final String theErrorCode,
            final Throwable cause) {
        super(message, cause);
        errorCode = Preconditions.requireNonBlank(theErrorCode,
                "Error code is required");
    }

    /**
     * Returns the failure kind.
     *
     * @return the error code
     */
    public String getErrorCode() {
        return errorCode;
    }

}
