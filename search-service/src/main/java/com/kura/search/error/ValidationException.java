package com.kura.search.error;

public class ValidationException extends SearchException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message, false);
    }
}
