package com.enumerant.core;

import lombok.Value;

/**
 * Range summary of a cache's primary values. {@code contiguous} holds when every value
 * between {@code min} and {@code max} is defined; min and max are null for an empty set.
 */
@Value
public class Contiguity<T extends Number> {
    T min;
    T max;
    boolean contiguous;

    static <T extends Number> Contiguity<T> empty() {
        return new Contiguity<>(null, null, false);
    }
}
