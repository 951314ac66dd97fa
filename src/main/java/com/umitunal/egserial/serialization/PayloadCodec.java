package com.umitunal.egserial.serialization;

/**
 * Converts values to and from the byte strings stored in padded blocks.
 *
 * @param <T> the value type
 */
public interface PayloadCodec<T> {

    /**
     * Encode a value to bytes.
     */
    byte[] encode(T value);

    /**
     * Decode bytes produced by {@link #encode(Object)}.
     */
    T decode(byte[] bytes);
}
