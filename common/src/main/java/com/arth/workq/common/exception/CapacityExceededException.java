package com.arth.workq.common.exception;

public class CapacityExceededException extends MessageQueueException {

    public CapacityExceededException(String message) {
        super(ErrorCode.CAPACITY_EXCEEDED, message);
    }

    public CapacityExceededException(String message, Throwable cause) {
        super(ErrorCode.CAPACITY_EXCEEDED, message, cause);
    }
}
