package com.umitunal.egserial.model;

/**
 * Version of the election record specification a document follows.
 */
public enum SpecVersion implements WireEnum {
    EG0_95("v0.95"),
    EG1_0("v1.0");

    private final String wireValue;

    SpecVersion(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }
}
