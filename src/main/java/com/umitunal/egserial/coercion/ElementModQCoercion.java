package com.umitunal.egserial.coercion;

import com.umitunal.egserial.model.ElementModQ;

import java.math.BigInteger;

public class ElementModQCoercion extends HexCoercion<ElementModQ> {

    @Override
    public Class<ElementModQ> type() {
        return ElementModQ.class;
    }

    @Override
    protected BigInteger toBigInteger(ElementModQ value) {
        return value.getValue();
    }

    @Override
    protected ElementModQ fromBigInteger(BigInteger value) {
        return ElementModQ.of(value);
    }
}
