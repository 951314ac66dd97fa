package com.umitunal.egserial.coercion;

/**
 * Parse and format rules for a value type that has no unambiguous structural
 * JSON mapping. The JSON form is always a single scalar.
 *
 * Implementations must be stateless so one instance can serve every thread.
 *
 * @param <T> the coerced type
 */
public interface Coercion<T> {

    /**
     * The exact type this coercion handles.
     */
    Class<T> type();

    /**
     * Format a non-null value to its scalar text.
     */
    String format(T value);

    /**
     * Parse scalar text back to a value.
     *
     * @throws IllegalArgumentException if the text is not a valid representation
     */
    T parse(String text);

    /**
     * Whether the scalar is a JSON number rather than a JSON string.
     */
    default boolean numeric() {
        return false;
    }
}
