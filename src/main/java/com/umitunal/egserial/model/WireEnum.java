package com.umitunal.egserial.model;

/**
 * An enumeration whose serialized form is a fixed wire value rather than
 * its Java constant name.
 */
public interface WireEnum {

    /**
     * The text written to JSON documents for this constant.
     */
    String wireValue();

    /**
     * Whether the wire value is written as a JSON number instead of a string.
     */
    default boolean numeric() {
        return false;
    }
}
