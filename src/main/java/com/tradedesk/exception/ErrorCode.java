package com.tradedesk.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Machine-readable error codes with their HTTP status. Retryable codes mark conditions that
 * clear on their own: a later price tick, or the competing transition finishing.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400, false),
    BAD_REQUEST("BAD_REQUEST", 400, false),
    NOT_FOUND("NOT_FOUND", 404, false),
    INVALID_STATE("INVALID_STATE", 409, false),
    PRICE_UNAVAILABLE("PRICE_UNAVAILABLE", 409, true),
    CONCURRENCY_CONFLICT("CONCURRENCY_CONFLICT", 409, true),
    INSUFFICIENT_LOTS("INSUFFICIENT_LOTS", 422, false),
    RISK_LIMIT_EXCEEDED("RISK_LIMIT_EXCEEDED", 422, false),
    INTERNAL_ERROR("INTERNAL_ERROR", 500, false),
    PERSISTENCE_ERROR("PERSISTENCE_ERROR", 500, false);

    private final String code;
    private final int httpStatus;
    private final boolean retryable;
}
