package com.umitunal.egserial.exception;

/**
 * Thrown when a payload does not fit the capacity of the requested block size
 * and truncation was not allowed.
 */
public class TruncationException extends SerializationException {
    private final int payloadLength;
    private final int capacity;

    public TruncationException(int payloadLength, int capacity) {
        super("Padded data of " + payloadLength
                + " bytes exceeds allowed padded data size of " + capacity);
        this.payloadLength = payloadLength;
        this.capacity = capacity;
    }

    public int getPayloadLength() { return payloadLength; }
    public int getCapacity() { return capacity; }
}
