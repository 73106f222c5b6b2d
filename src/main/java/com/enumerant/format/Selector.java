package com.enumerant.format;

import com.enumerant.Constants;
import lombok.AccessLevel;
import lombok.Getter;

/**
 * Names one text resolution strategy. Callers pass selectors as an ordered preference list;
 * the first selector that resolves a value wins.
 * <p>
 * Ids below {@link Constants#GLOBAL_SELECTOR_BASE} are built in. Custom ids are handed out by
 * {@link FormatterRegistry} and are only meaningful for the registry that issued them; a selector
 * remembers its issuer so that another value set rejects it instead of running its own slot.
 */
@Getter
public final class Selector {
    public static final Selector DECIMAL = new Selector(0, "Decimal");
    public static final Selector HEX = new Selector(1, "Hex");
    public static final Selector NAME = new Selector(2, "Name");
    public static final Selector DESCRIPTION = new Selector(3, "Description");
    public static final Selector MEMBER_VALUE = new Selector(4, "MemberValue");

    private static final Selector[] BUILT_IN = {DECIMAL, HEX, NAME, DESCRIPTION, MEMBER_VALUE};

    private final int id;
    private final String label;
    // Null for built-ins and for raw ids from of(int)
    @Getter(AccessLevel.NONE)
    private final FormatterRegistry<?> issuer;

    private Selector(int id, String label) {
        this(id, label, null);
    }

    private Selector(int id, String label, FormatterRegistry<?> issuer) {
        this.id = id;
        this.label = label;
        this.issuer = issuer;
    }

    static Selector custom(FormatterRegistry<?> issuer, int index) {
        int id = issuer.getBase() + index;
        return new Selector(id, issuer.getScope() + "#" + id, issuer);
    }

    FormatterRegistry<?> issuer() {
        return issuer;
    }

    /**
     * Selector for a raw id: a built-in constant or a custom id of the process-wide registry.
     * Per value set ids only resolve through the selector their registry returned.
     */
    public static Selector of(int id) {
        if (id >= 0 && id < BUILT_IN.length)
            return BUILT_IN[id];
        if (id < Constants.GLOBAL_SELECTOR_BASE)
            throw new IllegalArgumentException("Unknown built-in selector id: " + id);
        return new Selector(id, "custom#" + id);
    }

    public boolean isCustom() {
        return id >= Constants.GLOBAL_SELECTOR_BASE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Selector)) return false;
        var other = (Selector) o;
        return id == other.id && issuer == other.issuer;
    }

    @Override
    public int hashCode() {
        return 31 * Integer.hashCode(id) + System.identityHashCode(issuer);
    }

    @Override
    public String toString() {
        return label;
    }
}
