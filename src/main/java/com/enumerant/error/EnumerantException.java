package com.enumerant.error;

import lombok.Getter;

/**
 * Exception thrown by value-set parse, validation and flag operations.
 */
@Getter
public class EnumerantException extends Exception {
    private final ErrorType errorType;

    public EnumerantException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public EnumerantException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    @Override
    public String toString() {
        return String.format("EnumerantException{type=%s, message='%s'}", errorType, getMessage());
    }
}
