package com.tradedesk.exception;

import java.util.Map;

/** Durable write failed. The in-memory mutation of the attempt has been rolled back. */
public class PersistenceException extends BaseException {

    public PersistenceException(String message, Throwable cause) {
        super(ErrorCode.PERSISTENCE_ERROR, message, Map.of(), cause);
    }

    public PersistenceException(String message, Map<String, Object> details, Throwable cause) {
        super(ErrorCode.PERSISTENCE_ERROR, message, details, cause);
    }
}
