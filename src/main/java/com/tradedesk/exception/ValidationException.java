package com.tradedesk.exception;

import java.util.Map;

/** Malformed order input: non-positive quantity, missing or non-positive price fields. */
public class ValidationException extends BaseException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public ValidationException(String field, String message) {
        super(ErrorCode.VALIDATION_ERROR, message, Map.of("field", field));
    }
}
