package com.csd.leadscore.exception;

/**
 * The pattern catalog could not be loaded or failed validation. Fatal at startup.
 */
public class PatternCatalogException extends RuntimeException {

    public PatternCatalogException(String message) {
        super(message);
    }

    public PatternCatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
