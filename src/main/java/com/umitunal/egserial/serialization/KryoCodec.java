package com.umitunal.egserial.serialization;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.KryoException;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;
import com.umitunal.egserial.coercion.CoercionKryoSerializer;
import com.umitunal.egserial.coercion.CoercionRegistry;
import com.umitunal.egserial.exception.SerializationException;

/**
 * Binary codec using Kryo, registering every registry coercion as a Kryo
 * serializer.
 *
 * Coerced types are written through their registry coercion, so an element
 * or enum has the same textual representation here as in JSON. Kryo instances
 * are not thread-safe; each thread gets its own.
 *
 * Classes of serialized values need a no-arg constructor (it may be private).
 *
 * @param <T> the type to serialize
 */
public class KryoCodec<T> implements PayloadCodec<T> {
    private final ThreadLocal<Kryo> kryoThreadLocal;
    private final Class<T> type;

    public KryoCodec(Class<T> type) {
        this(type, CoercionRegistry.standard());
    }

    public KryoCodec(Class<T> type, CoercionRegistry registry) {
        this(type, () -> Factories.defaultFactory(registry));
    }

    /**
     * Create a codec with a custom Kryo configuration.
     */
    public KryoCodec(Class<T> type, KryoFactory factory) {
        this.type = type;
        this.kryoThreadLocal = ThreadLocal.withInitial(factory::create);
    }

    @Override
    public byte[] encode(T value) {
        Kryo kryo = kryoThreadLocal.get();

        try (Output output = new Output(256, -1)) {
            kryo.writeObject(output, value);
            return output.toBytes();
        } catch (KryoException | IllegalArgumentException e) {
            throw new SerializationException("Failed to encode " + type.getSimpleName() + " with Kryo", e);
        }
    }

    @Override
    public T decode(byte[] bytes) {
        Kryo kryo = kryoThreadLocal.get();

        try (Input input = new Input(bytes)) {
            return kryo.readObject(input, type);
        } catch (KryoException | IllegalArgumentException e) {
            throw new SerializationException("Failed to decode " + type.getSimpleName() + " with Kryo", e);
        }
    }

    /**
     * Factory for per-thread Kryo instances.
     */
    @FunctionalInterface
    public interface KryoFactory {
        Kryo create();
    }

    public static final class Factories {

        private Factories() {
        }

        /**
         * Unregistered classes allowed, no reference tracking, coercions registered.
         */
        public static Kryo defaultFactory(CoercionRegistry registry) {
            Kryo kryo = new Kryo();
            kryo.setRegistrationRequired(false);
            kryo.setReferences(false);
            CoercionKryoSerializer.registerAll(kryo, registry);
            return kryo;
        }

        /**
         * Only the given classes and the coerced types may be written.
         * Both sides must register the same classes in the same order.
         */
        public static Kryo strictFactory(CoercionRegistry registry, Class<?>... classes) {
            Kryo kryo = new Kryo();
            kryo.setRegistrationRequired(true);
            kryo.setReferences(false);
            CoercionKryoSerializer.registerAll(kryo, registry);
            for (Class<?> type : classes) {
                kryo.register(type);
            }
            return kryo;
        }
    }
}
