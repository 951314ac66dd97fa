package com.umitunal.egserial.model;

import java.math.BigInteger;
import java.util.Objects;

/**
 * A non-negative integer of at most 4096 bits, the carrier for values of the
 * group Z_p. Only sign and width are checked; reduction modulo p and
 * subgroup membership are the caller's concern.
 */
public final class ElementModP implements Comparable<ElementModP> {
    public static final int MAX_BITS = 4096;

    private final BigInteger value;

    private ElementModP(BigInteger value) {
        this.value = value;
    }

    public static ElementModP of(BigInteger value) {
        Objects.requireNonNull(value, "value");
        if (value.signum() < 0 || value.bitLength() > MAX_BITS) {
            throw new IllegalArgumentException("Value is negative or wider than " + MAX_BITS + " bits: " + value.toString(16));
        }
        return new ElementModP(value);
    }

    public static ElementModP of(long value) {
        return of(BigInteger.valueOf(value));
    }

    public BigInteger getValue() { return value; }

    @Override
    public int compareTo(ElementModP other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ElementModP)) return false;
        return value.equals(((ElementModP) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "ElementModP{" + value.toString(16) + "}";
    }
}
