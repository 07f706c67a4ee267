package com.kura.search.error;

public enum ErrorCode {
    VALIDATION_ERROR,
    SERVICE_UNAVAILABLE,
    REQUEST_CANCELLED,
    INTERNAL_ERROR
}
