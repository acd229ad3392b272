package com.conductor.core.error;

/**
 * Thrown when the process supervisor call fails or returns something unusable.
 */
public class SupervisorException extends ConductorException {
    public SupervisorException(String message) {
        super(message);
    }

    public SupervisorException(String message, Throwable cause) {
        super(message, cause);
    }
}
