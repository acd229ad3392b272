package com.conductor.core.error;

/**
 * Base type for orchestration failures.
 */
public class ConductorException extends RuntimeException {
    public ConductorException(String message) {
        super(message);
    }

    public ConductorException(String message, Throwable cause) {
        super(message, cause);
    }
}
