package com.umitunal.egserial.serialization;

import com.umitunal.egserial.core.TypedSerializer;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Payload codec carrying the JSON document of a value as encoded text.
 *
 * @param <T> the type to serialize
 */
public class JsonCodec<T> implements PayloadCodec<T> {
    private final TypedSerializer serializer;
    private final Class<T> type;
    private final Charset charset;

    public JsonCodec(Class<T> type) {
        this(type, new JacksonTypedSerializer());
    }

    public JsonCodec(Class<T> type, TypedSerializer serializer) {
        this(type, serializer, StandardCharsets.UTF_8);
    }

    public JsonCodec(Class<T> type, TypedSerializer serializer, Charset charset) {
        this.type = type;
        this.serializer = serializer;
        this.charset = charset;
    }

    @Override
    public byte[] encode(T value) {
        return serializer.toRaw(value).getBytes(charset);
    }

    @Override
    public T decode(byte[] bytes) {
        return serializer.fromRaw(type, new String(bytes, charset));
    }
}
