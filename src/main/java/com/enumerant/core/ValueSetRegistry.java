package com.enumerant.core;

import com.enumerant.types.IntegralType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Keyed registry of lazily built value sets. Each registered factory runs at most once to
 * completion, even when many threads ask for the same set at the same time; every caller
 * then sees the same instance.
 * <p>
 * {@link #global()} is the process-wide instance. Separate instances can be created for
 * isolated scopes such as tests.
 */
public final class ValueSetRegistry {
    private static final Logger log = LoggerFactory.getLogger(ValueSetRegistry.class);
    private static final ValueSetRegistry GLOBAL = new ValueSetRegistry();

    private final ConcurrentHashMap<String, Slot> slots = new ConcurrentHashMap<>();

    public static ValueSetRegistry global() {
        return GLOBAL;
    }

    /**
     * @throws IllegalStateException if {@code id} is already registered
     */
    public void register(String id, Supplier<? extends ValueSet<?>> factory) {
        Objects.requireNonNull(id, "Id cannot be null");
        Objects.requireNonNull(factory, "Factory cannot be null");
        if (slots.putIfAbsent(id, new Slot(id, factory)) != null)
            throw new IllegalStateException("Value set '" + id + "' is already registered");
    }

    /**
     * The set registered under {@code id}, building it on first use.
     */
    public Optional<ValueSet<?>> get(String id) {
        Objects.requireNonNull(id, "Id cannot be null");
        var slot = slots.get(id);
        return slot == null ? Optional.empty() : Optional.of(slot.get());
    }

    /**
     * Typed variant of {@link #get(String)}.
     *
     * @throws IllegalArgumentException if the registered set uses a different integral type
     */
    @SuppressWarnings("unchecked")
    public <T extends Number> Optional<ValueSet<T>> get(String id, IntegralType<T> type) {
        Objects.requireNonNull(type, "Integral type cannot be null");
        var valueSet = get(id);
        if (valueSet.isEmpty())
            return Optional.empty();
        if (valueSet.get().getType() != type)
            throw new IllegalArgumentException("Value set '" + id + "' is " + valueSet.get().getType() + ", not " + type);
        return Optional.of((ValueSet<T>) valueSet.get());
    }

    public boolean contains(String id) {
        return slots.containsKey(id);
    }

    public Set<String> ids() {
        return Collections.unmodifiableSet(slots.keySet());
    }

    private static final class Slot {
        private final String id;
        private final Supplier<? extends ValueSet<?>> factory;
        private volatile ValueSet<?> valueSet;

        Slot(String id, Supplier<? extends ValueSet<?>> factory) {
            this.id = id;
            this.factory = factory;
        }

        ValueSet<?> get() {
            var built = valueSet;
            if (built != null)
                return built;
            synchronized (this) {
                built = valueSet;
                if (built == null) {
                    built = Objects.requireNonNull(factory.get(), "Factory for '" + id + "' returned null");
                    valueSet = built;
                    log.debug("Built value set '{}' as {}", id, built);
                }
            }
            return built;
        }
    }
}
