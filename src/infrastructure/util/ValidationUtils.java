package infrastructure.util;

/**
 * Input validation utilities used at system boundaries (CLI argument parsing,
 * configuration building).
 *
 * <p>All methods throw {@link IllegalArgumentException} with a descriptive message
 * on invalid input so callers can propagate or display the reason to the user.
 * Expected no-result outcomes inside the search are not validated here; they are
 * signalled through {@link java.util.OptionalLong}.
 */
public final class ValidationUtils {

    private ValidationUtils() {
        // Prevent instantiation: static methods only
    }

    /**
     * Validates that an integer value is strictly positive (greater than zero).
     *
     * @param value     the integer value to check
     * @param paramName parameter name used in the error message
     * @throws IllegalArgumentException if {@code value <= 0}
     */
    public static void validatePositive(int value, String paramName) {
        if (value <= 0) {
            throw new IllegalArgumentException(
                paramName + " must be positive, got: " + value);
        }
    }

    /**
     * Validates that an integer value is zero or greater.
     *
     * @param value     the integer value to check
     * @param paramName parameter name used in the error message
     * @throws IllegalArgumentException if {@code value < 0}
     */
    public static void validateNonNegative(int value, String paramName) {
        if (value < 0) {
            throw new IllegalArgumentException(
                paramName + " must be non-negative, got: " + value);
        }
    }

    /**
     * Validates that a reference is present.
     *
     * @param value     the reference to check
     * @param paramName parameter name used in the error message
     * @param <T>       reference type
     * @return {@code value}
     * @throws IllegalArgumentException if {@code value == null}
     */
    public static <T> T validateNotNull(T value, String paramName) {
        if (value == null) {
            throw new IllegalArgumentException(paramName + " cannot be null");
        }
        return value;
    }
}
