package com.umitunal.egserial.coercion;

import com.umitunal.egserial.model.ElementModP;

import java.math.BigInteger;

public class ElementModPCoercion extends HexCoercion<ElementModP> {

    @Override
    public Class<ElementModP> type() {
        return ElementModP.class;
    }

    @Override
    protected BigInteger toBigInteger(ElementModP value) {
        return value.getValue();
    }

    @Override
    protected ElementModP fromBigInteger(BigInteger value) {
        return ElementModP.of(value);
    }
}
