package com.arth.workq.common.exception;

public abstract class MessageQueueException extends RuntimeException {

    private final ErrorCode errorCode;

    public MessageQueueException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public MessageQueueException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
