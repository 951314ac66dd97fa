package com.umitunal.egserial.model;

import java.math.BigInteger;
import java.util.Objects;

/**
 * An element of the exponent group Z_q, where q is the 256-bit prime
 * {@code 2^256 - 189}.
 */
public final class ElementModQ implements Comparable<ElementModQ> {
    public static final BigInteger Q = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.valueOf(189));

    private final BigInteger value;

    private ElementModQ(BigInteger value) {
        this.value = value;
    }

    /**
     * @throws IllegalArgumentException if the value is outside {@code [0, Q)}
     */
    public static ElementModQ of(BigInteger value) {
        Objects.requireNonNull(value, "value");
        if (value.signum() < 0 || value.compareTo(Q) >= 0) {
            throw new IllegalArgumentException("Value is not an element of Z_q: " + value);
        }
        return new ElementModQ(value);
    }

    public static ElementModQ of(long value) {
        return of(BigInteger.valueOf(value));
    }

    public BigInteger getValue() { return value; }

    @Override
    public int compareTo(ElementModQ other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ElementModQ)) return false;
        return value.equals(((ElementModQ) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "ElementModQ{" + value.toString(16) + "}";
    }
}
