package io.consul.util;

import org.jspecify.annotations.Nullable;

/**
 * Argument checks shared by all modules.
 */
public final class Assert {

    private Assert() {
    }

    /**
     * Check that the named parameter is not {@code null}.
     *
     * @param name the parameter name
     * @param value the parameter value
     * @param <T> the value type
     * @return the value, never {@code null}
     * @throws IllegalArgumentException if the value is {@code null}
     */
    public static <T> T checkNotNullParam(String name, @Nullable T value) throws IllegalArgumentException {
        if (value == null) {
            throw new IllegalArgumentException("Parameter '" + name + "' may not be null");
        }
        return value;
    }

    /**
     * Check that the named string parameter is neither {@code null} nor empty.
     *
     * @param name the parameter name
     * @param value the parameter value
     * @return the value
     * @throws IllegalArgumentException if the value is {@code null} or empty
     */
    public static String checkNotEmptyParam(String name, @Nullable String value) throws IllegalArgumentException {
        checkNotNullParam(name, value);
        if (value.isEmpty()) {
            throw new IllegalArgumentException("Parameter '" + name + "' may not be empty");
        }
        return value;
    }

    public static boolean isNullOrEmpty(@Nullable String value) {
        return value == null || value.isEmpty();
    }
}
