package com.umitunal.egserial.coercion;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.KeyDeserializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdScalarDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;

/**
 * Jackson module exposing every coercion of a registry as a serializer and
 * deserializer pair, for values and for map keys alike. Registered types take
 * precedence over Jackson's own handling, so {@code BigInteger} is written as
 * hex and enums by wire value.
 */
public class CoercionModule extends SimpleModule {

    public CoercionModule(CoercionRegistry registry) {
        super("egserial-coercions");
        for (Coercion<?> coercion : registry.coercions()) {
            add(coercion);
        }
    }

    private <T> void add(Coercion<T> coercion) {
        addSerializer(coercion.type(), new CoercionSerializer<>(coercion));
        addDeserializer(coercion.type(), new CoercionDeserializer<>(coercion));
        addKeySerializer(coercion.type(), new CoercionKeySerializer<>(coercion));
        addKeyDeserializer(coercion.type(), new CoercionKeyDeserializer<>(coercion));
    }

    static final class CoercionSerializer<T> extends StdSerializer<T> {
        private final transient Coercion<T> coercion;

        CoercionSerializer(Coercion<T> coercion) {
            super(coercion.type());
            this.coercion = coercion;
        }

        @Override
        public void serialize(T value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            String text = coercion.format(value);
            if (coercion.numeric()) {
                gen.writeNumber(text);
            } else {
                gen.writeString(text);
            }
        }
    }

    static final class CoercionDeserializer<T> extends StdScalarDeserializer<T> {
        private final transient Coercion<T> coercion;

        CoercionDeserializer(Coercion<T> coercion) {
            super(coercion.type());
            this.coercion = coercion;
        }

        @Override
        @SuppressWarnings("unchecked")
        public T deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonToken token = p.currentToken();
            boolean accepted = token == JsonToken.VALUE_STRING
                    || (coercion.numeric() && token == JsonToken.VALUE_NUMBER_INT);
            if (!accepted) {
                return (T) ctxt.handleUnexpectedToken(handledType(), p);
            }

            String text = p.getText();
            try {
                return coercion.parse(text);
            } catch (IllegalArgumentException e) {
                return (T) ctxt.handleWeirdStringValue(handledType(), text, "%s", e.getMessage());
            }
        }
    }

    static final class CoercionKeySerializer<T> extends StdSerializer<T> {
        private final transient Coercion<T> coercion;

        CoercionKeySerializer(Coercion<T> coercion) {
            super(coercion.type());
            this.coercion = coercion;
        }

        @Override
        public void serialize(T value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeFieldName(coercion.format(value));
        }
    }

    static final class CoercionKeyDeserializer<T> extends KeyDeserializer {
        private final Coercion<T> coercion;

        CoercionKeyDeserializer(Coercion<T> coercion) {
            this.coercion = coercion;
        }

        @Override
        public Object deserializeKey(String key, DeserializationContext ctxt) throws IOException {
            try {
                return coercion.parse(key);
            } catch (IllegalArgumentException e) {
                return ctxt.handleWeirdKey(coercion.type(), key, "%s", e.getMessage());
            }
        }
    }
}
