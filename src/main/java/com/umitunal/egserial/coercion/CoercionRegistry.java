package com.umitunal.egserial.coercion;

import com.umitunal.egserial.model.BallotBoxState;
import com.umitunal.egserial.model.ContestErrorType;
import com.umitunal.egserial.model.ElectionType;
import com.umitunal.egserial.model.ProofUsage;
import com.umitunal.egserial.model.ReportingUnitType;
import com.umitunal.egserial.model.SpecVersion;
import com.umitunal.egserial.model.VoteVariationType;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable set of coercions keyed by the exact type they handle.
 *
 * A registry is built once, before any concurrent use, and then handed to
 * every serializer and codec that needs it. Lookups never mutate it.
 */
public final class CoercionRegistry {
    private static final CoercionRegistry STANDARD = newBuilder()
            .register(new BigIntegerCoercion())
            .register(new ElementModPCoercion())
            .register(new ElementModQCoercion())
            .register(new DateTimeCoercion())
            .register(new WireEnumCoercion<>(BallotBoxState.class))
            .register(new WireEnumCoercion<>(ContestErrorType.class))
            .register(new WireEnumCoercion<>(ElectionType.class))
            .register(new WireEnumCoercion<>(ProofUsage.class))
            .register(new WireEnumCoercion<>(ReportingUnitType.class))
            .register(new WireEnumCoercion<>(SpecVersion.class))
            .register(new WireEnumCoercion<>(VoteVariationType.class))
            .build();

    private final Map<Class<?>, Coercion<?>> coercions;

    private CoercionRegistry(Builder builder) {
        this.coercions = Collections.unmodifiableMap(new LinkedHashMap<>(builder.coercions));
    }

    /**
     * The registry covering every election record type with an ambiguous JSON form.
     */
    public static CoercionRegistry standard() {
        return STANDARD;
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    /**
     * Find the coercion registered for exactly this type.
     */
    @SuppressWarnings("unchecked")
    public <T> Optional<Coercion<T>> find(Class<T> type) {
        return Optional.ofNullable((Coercion<T>) coercions.get(type));
    }

    public boolean contains(Class<?> type) {
        return coercions.containsKey(type);
    }

    /**
     * All coercions in registration order.
     */
    public Collection<Coercion<?>> coercions() {
        return coercions.values();
    }

    public int size() {
        return coercions.size();
    }

    public static class Builder {
        private final Map<Class<?>, Coercion<?>> coercions = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Add a coercion. A type can be registered only once.
         */
        public Builder register(Coercion<?> coercion) {
            Coercion<?> previous = coercions.putIfAbsent(coercion.type(), coercion);
            if (previous != null) {
                throw new IllegalStateException("Coercion already registered for " + coercion.type().getName());
            }
            return this;
        }

        /**
         * Copy every coercion of another registry into this builder.
         */
        public Builder registerAll(CoercionRegistry registry) {
            for (Coercion<?> coercion : registry.coercions()) {
                register(coercion);
            }
            return this;
        }

        public CoercionRegistry build() {
            return new CoercionRegistry(this);
        }
    }
}
