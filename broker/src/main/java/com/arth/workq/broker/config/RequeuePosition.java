package com.arth.workq.broker.config;

/**
 * Where a nacked, timed-out or orphaned message re-enters the pending sequence.
 */
public enum RequeuePosition {
    HEAD,
    TAIL
}
