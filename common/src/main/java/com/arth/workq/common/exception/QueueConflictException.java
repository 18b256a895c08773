package com.arth.workq.common.exception;

/**
 * Redeclaration with attributes that differ from the existing queue.
 */
public class QueueConflictException extends MessageQueueException {

    public QueueConflictException(String message) {
        super(ErrorCode.CONFLICT, message);
    }

    public QueueConflictException(String message, Throwable cause) {
        super(ErrorCode.CONFLICT, message, cause);
    }
}
