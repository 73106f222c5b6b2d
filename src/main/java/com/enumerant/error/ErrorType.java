package com.enumerant.error;

/**
 * Classified failures of value-set operations.
 */
public enum ErrorType {
    INVALID_FLAG_COMBINATION,
    OUT_OF_RANGE,
    PARSE_FAILURE,
    INVALID_VALUE
}
