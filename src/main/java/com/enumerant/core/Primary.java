package com.enumerant.core;

/**
 * Marks the member that should be canonical when several names share one value.
 */
public final class Primary {
    public static final Primary INSTANCE = new Primary();

    private Primary() {}

    @Override
    public String toString() {
        return "Primary";
    }
}
