package com.conductor.core.error;

/**
 * Thrown when a manifest is rejected at registration (missing id or version).
 */
public class ManifestValidationException extends ConductorException {
    public ManifestValidationException(String message) {
        super(message);
    }
}
