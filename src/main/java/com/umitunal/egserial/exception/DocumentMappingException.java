package com.umitunal.egserial.exception;

/**
 * Well-formed JSON whose shape or values do not fit the requested type.
 */
public class DocumentMappingException extends SerializationException {

    public DocumentMappingException(String message) {
        super(message);
    }

    public DocumentMappingException(String message, Throwable cause) {
        super(message, cause);
    }
}
