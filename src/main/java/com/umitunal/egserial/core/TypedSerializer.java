package com.umitunal.egserial.core;

import com.fasterxml.jackson.core.type.TypeReference;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.List;

/**
 * Converts typed values to canonical JSON text and back.
 *
 * Content failures are reported as subclasses of
 * {@link com.umitunal.egserial.exception.SerializationException}:
 * <ul>
 *   <li>{@code MalformedJsonException} - the text is not JSON</li>
 *   <li>{@code UnsupportedTypeException} - a type has no structural or registered mapping</li>
 *   <li>{@code DocumentMappingException} - valid JSON that does not fit the target type</li>
 * </ul>
 * Unknown JSON fields are ignored unless configured otherwise.
 */
public interface TypedSerializer {

    /**
     * Serialize a value to indented JSON text.
     */
    String toRaw(Object value);

    /**
     * Write the same text as {@link #toRaw(Object)} to a writer.
     */
    void toWriter(Object value, Writer writer) throws IOException;

    /**
     * Deserialize JSON text as the given type.
     */
    <T> T fromRaw(Class<T> type, String raw);

    /**
     * Deserialize JSON text as a generic type, e.g. {@code new TypeReference<List<Foo>>() {}}.
     */
    <T> T fromRaw(TypeReference<T> type, String raw);

    /**
     * Deserialize the whole content of a reader as the given type.
     */
    <T> T fromReader(Class<T> type, Reader reader) throws IOException;

    /**
     * Deserialize a top-level JSON array, mapping each element to the given type.
     */
    <T> List<T> listFromReader(Class<T> elementType, Reader reader) throws IOException;
}
