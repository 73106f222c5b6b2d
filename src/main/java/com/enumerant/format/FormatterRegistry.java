package com.enumerant.format;

import com.enumerant.Constants;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Append-only table of custom formatter functions for one scope, with ids starting at {@code base}.
 * <p>
 * Lifecycle
 * - The slot array is created on first registration and never replaced
 * - Registration claims the next slot with an atomic increment, then fills it
 * - Readers that see a claimed but still empty slot spin until the registering thread fills it
 * <p>
 * The spin is bounded by the time between the claim and the store in {@link #register}, and
 * registration happens a handful of times per process.
 */
public final class FormatterRegistry<F> {
    private static final Logger log = LoggerFactory.getLogger(FormatterRegistry.class);

    @Getter
    private final String scope;
    @Getter
    private final int base;
    private final int capacity;
    private final AtomicInteger lastIndex = new AtomicInteger(-1);
    private volatile AtomicReferenceArray<F> slots;

    public FormatterRegistry(String scope, int base) {
        this(scope, base, Constants.MAX_CUSTOM_SELECTORS);
    }

    public FormatterRegistry(String scope, int base, int capacity) {
        this.scope = Objects.requireNonNull(scope, "Scope cannot be null");
        if (base < Constants.GLOBAL_SELECTOR_BASE)
            throw new IllegalArgumentException("Custom selector base must be at least " + Constants.GLOBAL_SELECTOR_BASE + ", got: " + base);
        if (capacity <= 0)
            throw new IllegalArgumentException("Capacity must be positive, got: " + capacity);
        this.base = base;
        this.capacity = capacity;
    }

    /**
     * Append a formatter and return the selector that names it.
     *
     * @throws IllegalStateException if every slot of this scope has been claimed
     */
    public Selector register(F formatter) {
        Objects.requireNonNull(formatter, "Formatter cannot be null");
        var table = slots();
        int index = lastIndex.incrementAndGet();
        if (index >= capacity)
            throw new IllegalStateException("Custom selector registry '" + scope + "' is full (" + capacity + " slots)");
        table.set(index, formatter);
        var selector = Selector.custom(this, index);
        log.info("Registered custom selector {} in scope '{}'", selector.getId(), scope);
        return selector;
    }

    /**
     * True if {@code id} names a slot this registry has handed out.
     */
    public boolean owns(int id) {
        int index = id - base;
        return index >= 0 && index < capacity && index <= lastIndex.get();
    }

    /**
     * True if {@code selector} was returned by this registry's {@link #register}.
     */
    public boolean issued(Selector selector) {
        return selector.issuer() == this && owns(selector.getId());
    }

    /**
     * Formatter for {@code id}, or null if this registry never issued that id.
     */
    public F lookup(int id) {
        if (!owns(id))
            return null;
        var table = slots;
        int index = id - base;
        F formatter;
        while ((formatter = table.get(index)) == null) {
            Thread.onSpinWait();
        }
        return formatter;
    }

    public int size() {
        return Math.min(lastIndex.get() + 1, capacity);
    }

    private AtomicReferenceArray<F> slots() {
        var table = slots;
        if (table == null) {
            synchronized (this) {
                table = slots;
                if (table == null) {
                    table = new AtomicReferenceArray<>(capacity);
                    slots = table;
                }
            }
        }
        return table;
    }
}
