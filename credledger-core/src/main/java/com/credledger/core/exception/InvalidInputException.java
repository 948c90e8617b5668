package com.credledger.core.exception;

/**
 * Thrown when a required field is empty or a duration is negative.
 */
public class InvalidInputException extends RegistryException {

    public InvalidInputException(String message) {
        super(ErrorCode.INVALID_INPUT, message);
    }
}
