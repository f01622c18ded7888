package com.z254.prism.exception;

/**
 * Raised for malformed numeric input (mismatched lengths, too few points) or
 * request parameters outside their accepted range.
 */
public class InvalidInputException extends PrismException {

    public static final String CODE = "INVALID_INPUT";

    public InvalidInputException(String message) {
        super(message, CODE, "Check the supplied values and retry.");
    }
}
