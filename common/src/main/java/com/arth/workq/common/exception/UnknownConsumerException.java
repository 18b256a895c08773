package com.arth.workq.common.exception;

public class UnknownConsumerException extends MessageQueueException {

    public UnknownConsumerException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }

    public UnknownConsumerException(String message, Throwable cause) {
        super(ErrorCode.NOT_FOUND, message, cause);
    }
}
