package com.sentinel.classifier.engine;

/**
 * Raised when a rule catalog source is malformed or inconsistent.
 * A catalog that fails to load is never published.
 */
public class CatalogConfigException extends RuntimeException {

    public CatalogConfigException(String message) {
        super(message);
    }

    public CatalogConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
