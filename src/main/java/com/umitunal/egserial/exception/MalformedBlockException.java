package com.umitunal.egserial.exception;

/**
 * Thrown when a padded block has the wrong length or carries a padding
 * indicator that cannot belong to its size class.
 */
public class MalformedBlockException extends SerializationException {

    public MalformedBlockException(String message) {
        super(message);
    }
}
