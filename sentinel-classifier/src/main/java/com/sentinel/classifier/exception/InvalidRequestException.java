package com.sentinel.classifier.exception;

/**
 * Request binds cleanly but breaks a service rule, e.g. batch size or an unknown category filter.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
