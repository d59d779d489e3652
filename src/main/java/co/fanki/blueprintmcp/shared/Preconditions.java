package co.fanki.blueprintmcp.shared;

/**
 * Argument and input guards shared by every layer.
 *
 * <p>Programming errors raise {@link IllegalArgumentException}; rejected
 * user input raises {@link DomainException} carrying an error code that
 * the REST and MCP layers hand back to the caller.</p>
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
    public static <T> T requireNonNull(final T reference,
            final String message) {
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
     * Ensures that a condition is true.
     *
     * @param condition the condition to check
     * @param message the exception message if false
     * @throws IllegalArgumentException if condition is false
     */
    public static void require(final boolean condition,
            final String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Ensures that user supplied input satisfies a condition.
     *
     * @param condition the condition to check
     * @param message the exception message if false
     * @param errorCode the code reported to the caller
     * @throws DomainException if condition is false
     */
    public static void requireInput(final boolean condition,
            final String message, final String errorCode) {
        if (!condition) {
            throw new DomainException(message, errorCode);
        }
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

}
