package net.deckadvisor.util;

import java.util.Collection;
import java.util.Map;

/**
 * Utility helpers for common null/blank/empty validation checks.
 */
public final class ValidationUtils {
    private ValidationUtils() {
    }

    public static boolean isNullOrEmpty(Collection<?> collection) {
        return collection == null || collection.isEmpty();
    }

    public static boolean isNullOrEmpty(Map<?, ?> map) {
        return map == null || map.isEmpty();
    }

    public static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    /**
     * Returns the trimmed value, or {@code fallback} when the value is null or blank.
     */
    public static String textOrDefault(String value, String fallback) {
        return hasText(value) ? value.trim() : fallback;
    }

    /**
     * Fails with {@link IllegalArgumentException} when {@code count} is not strictly positive.
     */
    public static int requirePositive(int count, String name) {
        if (count <= 0) {
            throw new IllegalArgumentException(name + " must be positive but was " + count);
        }
        return count;
    }
}
