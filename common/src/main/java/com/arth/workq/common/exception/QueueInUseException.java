package com.arth.workq.common.exception;

public class QueueInUseException extends MessageQueueException {

    public QueueInUseException(String message) {
        super(ErrorCode.CONFLICT, message);
    }

    public QueueInUseException(String message, Throwable cause) {
        super(ErrorCode.CONFLICT, message, cause);
    }
}
