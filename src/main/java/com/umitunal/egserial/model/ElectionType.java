package com.umitunal.egserial.model;

/**
 * Type of election, after the NIST election results common data format.
 */
public enum ElectionType implements WireEnum {
    UNKNOWN("unknown"),
    GENERAL("general"),
    PARTISAN_PRIMARY_CLOSED("partisan_primary_closed"),
    PARTISAN_PRIMARY_OPEN("partisan_primary_open"),
    PRIMARY("primary"),
    RUNOFF("runoff"),
    SPECIAL("special"),
    OTHER("other");

    private final String wireValue;

    ElectionType(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }
}
