package com.enumerant.util;

import it.unimi.dsi.fastutil.Hash;

/**
 * Case-insensitive string equivalence, consistent with {@link String#equalsIgnoreCase(String)}.
 * Null-safe because fastutil custom maps call the strategy with null keys.
 */
public final class IgnoreCaseStrategy implements Hash.Strategy<String> {
    public static final IgnoreCaseStrategy INSTANCE = new IgnoreCaseStrategy();

    private IgnoreCaseStrategy() {}

    @Override
    public int hashCode(String text) {
        if (text == null)
            return 0;
        int hash = 0;
        // Folds whole code points, as equalsIgnoreCase does for surrogate pairs
        for (int i = 0; i < text.length(); ) {
            int codePoint = text.codePointAt(i);
            hash = 31 * hash + Character.toLowerCase(Character.toUpperCase(codePoint));
            i += Character.charCount(codePoint);
        }
        return hash;
    }

    @Override
    public boolean equals(String left, String right) {
        if (left == null)
            return right == null;
        return right != null && left.equalsIgnoreCase(right);
    }
}
