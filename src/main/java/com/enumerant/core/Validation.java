package com.enumerant.core;

/**
 * How strictly {@link ValueSet#isValid(Number, Validation)} judges a value.
 */
public enum Validation {
    /** Every value of the integral type is accepted. */
    NONE,
    /**
     * The set's {@link ValueValidator} when one was given to the builder; otherwise a declared value,
     * or for flag domains any combination of declared flags.
     */
    DEFAULT,
    /** Only declared values. */
    IS_DEFINED,
    /** Any combination of declared flags; flag domains only. */
    IS_VALID_FLAG_COMBINATION
}
