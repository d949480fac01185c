package co.fanki.reexportmap.analysis.domain;

/**
 * Decides which binding is kept when a module imports the same local name
 * more than once from the upstream package.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum DuplicateBindingPolicy {

    /** The last import in source order shadows the earlier ones. */
    LAST_WINS,

    /** The first import in source order is kept. */
    FIRST_WINS,

    /**
     * Re-binding a name to a different origin marks the module as failed.
     * Repeating an identical import is not a conflict.
     */
    FAIL;

    /**
     * Parses a policy name, ignoring case and surrounding whitespace.
     *
     * @param value the policy name, e.g. "last_wins"
     * @return the matching policy
     * @throws IllegalArgumentException if the name is unknown
     */
    public static DuplicateBindingPolicy fromString(final String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(
                    "Duplicate binding policy is required");
        }
        try {
            return valueOf(value.trim().toUpperCase().replace('-', '_'));
        } catch (final IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unknown duplicate binding policy: " + value
                            + ". Valid values: last_wins, first_wins, fail",
                    e);
        }
    }

}
