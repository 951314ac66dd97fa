package com.umitunal.egserial.padding;

import com.umitunal.egserial.exception.MalformedBlockException;
import com.umitunal.egserial.exception.TruncationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * Reversible mapping between a byte string and a fixed-size block.
 *
 * Block format:
 * - padding length (2 bytes, big-endian unsigned)
 * - payload bytes
 * - padding length bytes of 0x00
 *
 * The indicator stores the filler length rather than the payload length, so
 * an empty payload and a full payload decode through the same arithmetic:
 * the payload ends at {@code totalSize - paddingLength}.
 */
public final class PaddingCodec {
    private static final Logger log = LoggerFactory.getLogger(PaddingCodec.class);

    public static final int INDICATOR_SIZE = 2;
    public static final byte PAD_BYTE = 0x00;

    private PaddingCodec() {
    }

    /**
     * Encode a payload that must fit the block.
     *
     * @throws TruncationException if the payload is longer than the capacity
     */
    public static byte[] encode(byte[] payload, PaddedDataSize size) {
        return encode(payload, size, false);
    }

    /**
     * Encode a payload into a block of exactly {@code size.totalSize()} bytes.
     *
     * @param payload the bytes to store
     * @param size the block size class
     * @param allowTruncation keep only the first {@code size.capacity()} bytes of an
     *                        oversize payload instead of failing; the dropped bytes
     *                        cannot be recovered
     * @return the padded block
     * @throws TruncationException if the payload does not fit and truncation is not allowed
     */
    public static byte[] encode(byte[] payload, PaddedDataSize size, boolean allowTruncation) {
        int capacity = size.capacity();
        int messageLength = payload.length;

        if (messageLength > capacity) {
            if (!allowTruncation) {
                throw new TruncationException(messageLength, capacity);
            }
            log.warn("Truncating payload of {} bytes to {} bytes, {} bytes dropped",
                    messageLength, capacity, messageLength - capacity);
            messageLength = capacity;
        }

        int paddingLength = capacity - messageLength;

        ByteBuffer buffer = ByteBuffer.allocate(size.totalSize());
        buffer.putShort((short) paddingLength);
        buffer.put(payload, 0, messageLength);
        while (buffer.hasRemaining()) {
            buffer.put(PAD_BYTE);
        }

        return buffer.array();
    }

    /**
     * Recover the payload of a padded block.
     *
     * @throws MalformedBlockException if the block length does not match the size class
     *                                 or the indicator exceeds the capacity
     */
    public static byte[] decode(byte[] block, PaddedDataSize size) {
        if (block.length != size.totalSize()) {
            throw new MalformedBlockException("Padded block has " + block.length
                    + " bytes, expected " + size.totalSize());
        }

        int paddingLength = ByteBuffer.wrap(block, 0, INDICATOR_SIZE).getShort() & 0xFFFF;
        if (paddingLength > size.capacity()) {
            throw new MalformedBlockException("Padding indicator " + paddingLength
                    + " exceeds block capacity of " + size.capacity());
        }

        int messageEnd = size.totalSize() - paddingLength;
        return Arrays.copyOfRange(block, INDICATOR_SIZE, messageEnd);
    }
}
