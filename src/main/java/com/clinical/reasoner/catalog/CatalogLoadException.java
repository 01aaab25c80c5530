package com.clinical.reasoner.catalog;

/**
 * Raised when the rule catalog is missing or cannot be parsed. The engine must not run
 * with a partially loaded catalog, so this is fatal at startup.
 */
public class CatalogLoadException extends RuntimeException {

    public CatalogLoadException(String message) {
        super(message);
    }

    public CatalogLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
