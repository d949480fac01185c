package co.fanki.reexportmap.analysis.domain;

import co.fanki.reexportmap.shared.DomainException;

/**
 * Thrown when a module's source text is not syntactically valid.
 *
 * <p>Recovered per module: the module is reported with this exception's
 * message as its error and the run continues.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class SourceSyntaxException extends DomainException {

    private static final long serialVersionUID = 1L;

    /** Error code reported by this exception. */
    public static final String ERROR_CODE = "PARSE_FAILURE";

    private final String reason;

    private final int line;

    private final int column;

    /**
     * Creates a new syntax exception.
     *
     * @param theReason what is wrong, e.g. "invalid syntax"
     * @param theLine the 1-based line of the offending token
     * @param theColumn the 1-based column of the offending token
     */
    public SourceSyntaxException(final String theReason, final int theLine,
            final int theColumn) {
        super(theReason + " (line " + theLine + ", column " + theColumn + ")",
                ERROR_CODE);
        reason = theReason;
        line = theLine;
        column = theColumn;
    }

    /**
     * Returns the description of the error without its position.
     *
     * @return the reason
     */
    public String reason() {
        return reason;
    }

    /**
     * Returns the 1-based line where the error was detected.
     *
     * @return the line number
     */
    public int line() {
        return line;
    }

    /**
     * Returns the 1-based column where the error was detected.
     *
     * @return the column number
     */
    public int column() {
        return column;
    }

}
