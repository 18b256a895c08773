package com.arth.workq.common.exception;

/**
 * Error categories surfaced to callers of the broker.
 */
public enum ErrorCode {

    NOT_FOUND(404, "Queue, consumer or in-flight delivery does not exist"),
    CONFLICT(409, "Operation conflicts with the current queue state"),
    CAPACITY_EXCEEDED(429, "Queue is at its configured maximum length"),
    STORE_FAILURE(503, "Durable message store failed");

    private final int code;
    private final String message;

    ErrorCode(int code, String message) {
        this.code = code;
        this.message = message;
    }

    public int getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
