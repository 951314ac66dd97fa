package com.umitunal.egserial.model;

/**
 * Reason a contest on a ballot is invalid.
 */
public enum ContestErrorType implements WireEnum {
    UNKNOWN("unknown"),
    OVER_VOTE("overvote"),
    UNDER_VOTE("undervote"),
    NULL_VOTE("nullvote");

    private final String wireValue;

    ContestErrorType(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }
}
