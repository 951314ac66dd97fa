package com.umitunal.egserial.serialization;

import java.util.Arrays;

/**
 * Codec for payloads that are already bytes. Copies on the way in and out so
 * callers cannot alias a stored block.
 */
public class ByteArrayCodec implements PayloadCodec<byte[]> {

    @Override
    public byte[] encode(byte[] value) {
        return Arrays.copyOf(value, value.length);
    }

    @Override
    public byte[] decode(byte[] bytes) {
        return Arrays.copyOf(bytes, bytes.length);
    }
}
