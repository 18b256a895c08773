package com.arth.workq.common.exception;

/**
 * The consumer holds no in-flight delivery with the given message id.
 * Raised for double acks, acks after cancellation and acks after a delivery timeout.
 */
public class UnknownDeliveryException extends MessageQueueException {

    public UnknownDeliveryException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }

    public UnknownDeliveryException(String message, Throwable cause) {
        super(ErrorCode.NOT_FOUND, message, cause);
    }
}
