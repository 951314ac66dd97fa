package com.umitunal.egserial.coercion;

import java.math.BigInteger;
import java.util.Locale;

/**
 * Base for values carried as big integers and written as upper-case hex,
 * left-padded to an even number of digits. Negative values keep a leading
 * minus sign in front of the padded magnitude.
 *
 * @param <T> the coerced type
 */
public abstract class HexCoercion<T> implements Coercion<T> {

    protected abstract BigInteger toBigInteger(T value);

    protected abstract T fromBigInteger(BigInteger value);

    @Override
    public String format(T value) {
        return toHex(toBigInteger(value));
    }

    @Override
    public T parse(String text) {
        return fromBigInteger(fromHex(text));
    }

    static String toHex(BigInteger value) {
        if (value.signum() < 0) {
            return "-" + toHex(value.negate());
        }
        String hex = value.toString(16).toUpperCase(Locale.ROOT);
        return hex.length() % 2 == 0 ? hex : "0" + hex;
    }

    static BigInteger fromHex(String text) {
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("Empty hex string");
        }
        int start = text.charAt(0) == '-' ? 1 : 0;
        if (start == text.length()) {
            throw new IllegalArgumentException("Not a hex string: " + text);
        }
        for (int i = start; i < text.length(); i++) {
            if (Character.digit(text.charAt(i), 16) < 0) {
                throw new IllegalArgumentException("Not a hex string: " + text);
            }
        }
        return new BigInteger(text, 16);
    }
}
