package com.arth.workq.broker.config;

/**
 * What a bounded queue does with a publish that would exceed its maximum length.
 */
public enum OverflowPolicy {
    /** Fail the publish with a capacity error. */
    REJECT_PUBLISH,
    /** Evict the oldest pending message to make room. */
    DROP_HEAD,
    /** Wait for room up to the configured publish block timeout, then fail. */
    BLOCK_PUBLISH
}
