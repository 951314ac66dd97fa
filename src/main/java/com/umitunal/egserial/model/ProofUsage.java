package com.umitunal.egserial.model;

/**
 * What a zero-knowledge proof attests to.
 */
public enum ProofUsage implements WireEnum {
    UNKNOWN("Unknown"),
    SECRET_VALUE("Prove knowledge of secret value"),
    SELECTION_LIMIT("Prove value within selection's limit"),
    SELECTION_VALUE("Prove selection's value (0 or 1)");

    private final String wireValue;

    ProofUsage(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }
}
