package com.enumerant.core;

/**
 * Domain-specific validity rule that replaces the built-in check under {@link Validation#DEFAULT}.
 */
@FunctionalInterface
public interface ValueValidator<T extends Number> {

    boolean isValid(T value);
}
