package com.umitunal.egserial.coercion;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.Serializer;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;

/**
 * Kryo serializer that writes a coerced value as the same scalar text the
 * coercion produces for JSON.
 *
 * @param <T> the coerced type
 */
public final class CoercionKryoSerializer<T> extends Serializer<T> {
    private final Coercion<T> coercion;

    public CoercionKryoSerializer(Coercion<T> coercion) {
        super(false, true);
        this.coercion = coercion;
    }

    /**
     * Register every coercion of the registry with the given Kryo instance.
     */
    public static void registerAll(Kryo kryo, CoercionRegistry registry) {
        for (Coercion<?> coercion : registry.coercions()) {
            register(kryo, coercion);
        }
    }

    private static <T> void register(Kryo kryo, Coercion<T> coercion) {
        kryo.register(coercion.type(), new CoercionKryoSerializer<>(coercion));
    }

    @Override
    public void write(Kryo kryo, Output output, T value) {
        output.writeString(coercion.format(value));
    }

    @Override
    public T read(Kryo kryo, Input input, Class<? extends T> type) {
        return coercion.parse(input.readString());
    }
}
