package com.arth.workq.common.exception;

/**
 * The durable store could not complete a write. On publish the message is not enqueued.
 */
public class StoreFailureException extends MessageQueueException {

    public StoreFailureException(String message) {
        super(ErrorCode.STORE_FAILURE, message);
    }

    public StoreFailureException(String message, Throwable cause) {
        super(ErrorCode.STORE_FAILURE, message, cause);
    }
}
