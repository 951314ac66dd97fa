package com.umitunal.egserial.exception;

/**
 * A type has neither a structural JSON mapping nor a registered coercion.
 * This is a programming error, not a data error.
 */
public class UnsupportedTypeException extends SerializationException {

    public UnsupportedTypeException(String message, Throwable cause) {
        super(message, cause);
    }
}
