package com.umitunal.egserial.serialization;

import com.umitunal.egserial.padding.PaddedDataSize;
import com.umitunal.egserial.padding.PaddingCodec;

/**
 * Wraps another codec so every encoded value is a fixed-size padded block.
 * Wrapping a {@link JsonCodec} stores a value's JSON document in the block.
 *
 * @param <T> the value type
 */
public class PaddedCodec<T> implements PayloadCodec<T> {
    private final PayloadCodec<T> inner;
    private final PaddedDataSize size;
    private final boolean allowTruncation;

    public PaddedCodec(PayloadCodec<T> inner, PaddedDataSize size) {
        this(inner, size, false);
    }

    /**
     * @param allowTruncation cut oversize payloads to the block capacity instead of
     *                        failing; a truncated block usually no longer decodes
     */
    public PaddedCodec(PayloadCodec<T> inner, PaddedDataSize size, boolean allowTruncation) {
        this.inner = inner;
        this.size = size;
        this.allowTruncation = allowTruncation;
    }

    @Override
    public byte[] encode(T value) {
        return PaddingCodec.encode(inner.encode(value), size, allowTruncation);
    }

    @Override
    public T decode(byte[] block) {
        return inner.decode(PaddingCodec.decode(block, size));
    }

    public PaddedDataSize getSize() { return size; }
}
