package com.arth.workq.broker.delivery;

public enum ConsumerState {
    ACTIVE,
    CANCELLED,
    DISCONNECTED
}
