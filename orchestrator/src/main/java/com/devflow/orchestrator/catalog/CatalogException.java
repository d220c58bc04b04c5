package com.devflow.orchestrator.catalog;

/**
 * Thrown when the workflow catalog cannot be loaded (missing or malformed
 * resource). Fatal at startup.
 */
public class CatalogException extends RuntimeException {

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
