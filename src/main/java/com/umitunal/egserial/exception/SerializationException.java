package com.umitunal.egserial.exception;

/**
 * Base type for every failure raised while encoding or decoding
 * padded blocks and JSON documents.
 */
public class SerializationException extends RuntimeException {

    public SerializationException(String message) {
        super(message);
    }

    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
