package com.umitunal.egserial.coercion;

import com.umitunal.egserial.model.WireEnum;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Maps enum constants to and from their wire values.
 *
 * @param <E> the enum type
 */
public class WireEnumCoercion<E extends Enum<E> & WireEnum> implements Coercion<E> {
    private final Class<E> type;
    private final Map<String, E> byWireValue;
    private final boolean numeric;

    public WireEnumCoercion(Class<E> type) {
        E[] constants = type.getEnumConstants();
        if (constants.length == 0) {
            throw new IllegalArgumentException("Enum has no constants: " + type.getName());
        }

        Map<String, E> values = new HashMap<>();
        for (E constant : constants) {
            E previous = values.put(constant.wireValue(), constant);
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate wire value '" + constant.wireValue()
                        + "' in " + type.getName());
            }
        }

        this.type = type;
        this.byWireValue = Collections.unmodifiableMap(values);
        this.numeric = constants[0].numeric();
    }

    @Override
    public Class<E> type() {
        return type;
    }

    @Override
    public String format(E value) {
        return value.wireValue();
    }

    @Override
    public E parse(String text) {
        E value = byWireValue.get(text);
        if (value == null) {
            throw new IllegalArgumentException("Unknown " + type.getSimpleName() + " value: " + text);
        }
        return value;
    }

    @Override
    public boolean numeric() {
        return numeric;
    }
}
