package com.z254.prism.exception;

/**
 * Raised when a named resource, such as a stored baseline, does not exist.
 */
public class NotFoundException extends PrismException {

    public static final String CODE = "NOT_FOUND";

    public NotFoundException(String message, String suggestion) {
        super(message, CODE, suggestion);
    }
}
