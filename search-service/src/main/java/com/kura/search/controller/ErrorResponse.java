package com.kura.search.controller;

import java.time.Instant;

public record ErrorResponse(
        String error,
        String code,
        String message,
        boolean retryable,
        Instant timestamp,
        String path
) {
}
