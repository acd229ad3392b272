package com.conductor.catalog;

import com.conductor.core.error.ConductorException;

/**
 * The service catalog could not be read or is malformed.
 */
public class CatalogException extends ConductorException {

    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
