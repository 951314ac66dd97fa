package com.umitunal.egserial.model;

/**
 * Vote counting method of a contest.
 */
public enum VoteVariationType implements WireEnum {
    UNKNOWN("unknown"),
    ONE_OF_M("one_of_m"),
    APPROVAL("approval"),
    BORDA("borda"),
    CUMULATIVE("cumulative"),
    MAJORITY("majority"),
    N_OF_M("n_of_m"),
    PLURALITY("plurality"),
    PROPORTIONAL("proportional"),
    RANGE("range"),
    RCV("rcv"),
    SUPER_MAJORITY("super_majority"),
    OTHER("other");

    private final String wireValue;

    VoteVariationType(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }
}
