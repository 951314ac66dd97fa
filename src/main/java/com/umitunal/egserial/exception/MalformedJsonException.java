package com.umitunal.egserial.exception;

/**
 * Input text is not valid JSON.
 */
public class MalformedJsonException extends SerializationException {

    public MalformedJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
