package com.arth.workq.common.exception;

public class QueueNotFoundException extends MessageQueueException {

    public QueueNotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }

    public QueueNotFoundException(String message, Throwable cause) {
        super(ErrorCode.NOT_FOUND, message, cause);
    }
}
