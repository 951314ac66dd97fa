package com.umitunal.egserial.coercion;

import java.math.BigInteger;

/**
 * Writes arbitrary-size integers as signed hex strings so they survive JSON
 * readers limited to double precision.
 */
public class BigIntegerCoercion extends HexCoercion<BigInteger> {

    @Override
    public Class<BigInteger> type() {
        return BigInteger.class;
    }

    @Override
    protected BigInteger toBigInteger(BigInteger value) {
        return value;
    }

    @Override
    protected BigInteger fromBigInteger(BigInteger value) {
        return value;
    }
}
