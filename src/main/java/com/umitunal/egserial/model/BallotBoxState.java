package com.umitunal.egserial.model;

/**
 * State of a ballot once it has been submitted to the ballot box.
 * Written as its integer code.
 */
public enum BallotBoxState implements WireEnum {
    CAST(1),
    SPOILED(2),
    UNKNOWN(999);

    private final int code;

    BallotBoxState(int code) {
        this.code = code;
    }

    public int getCode() { return code; }

    @Override
    public String wireValue() {
        return Integer.toString(code);
    }

    @Override
    public boolean numeric() {
        return true;
    }
}
