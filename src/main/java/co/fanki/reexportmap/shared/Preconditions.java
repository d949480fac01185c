package co.fanki.reexportmap.shared;

/**
 * Argument validation helpers shared by the analysis components.
 *
 * <p>Every check fails with an {@link IllegalArgumentException} so that a
 * misconfigured run stops before any file is read.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Preconditions {

    private Preconditions() {
        // Utility class, not instantiable
    }

    /**
     * Ensures that an object reference is not null.
     *
     * @param reference the object reference to check
     * @param message the exception message if null
     * @param <T> the type of the reference
     * @return the non-null reference
     * @throws IllegalArgumentException if reference is null
     */
    public static <T> T requireNonNull(final T reference, final String message) {
        if (reference == null) {
            throw new IllegalArgumentException(message);
        }
        return reference;
    }

    /**
     * Ensures that a string is not null or blank.
     *
     * @param value the string to check
     * @param message the exception message if null or blank
     * @return the non-blank string
     * @throws IllegalArgumentException if value is null or blank
     */
    public static String requireNonBlank(final String value,
            final String message) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }

    /**
     * Ensures that a number is positive.
     *
     * @param value the number to check
     * @param message the exception message if not positive
     * @return the positive number
     * @throws IllegalArgumentException if value is not positive
     */
    public static int requirePositive(final int value, final String message) {
        if (value <= 0) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }

    /**
     * Returns the value if it is not blank, the fallback otherwise.
     *
     * @param value the candidate value, may be null
     * @param fallback the value used when the candidate is null or blank
     * @return the candidate or the fallback
     */
    public static String defaultIfBlank(final String value,
            final String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value;
    }

}
