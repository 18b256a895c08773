package com.arth.workq.common.constant;

public class LoggerName {

    public static final String CONFIG = "WorkqConfig";
    public static final String MESSAGE = "WorkqMessage";
    public static final String BROKER = "WorkqBroker";
    public static final String STORE = "WorkqStore";
    public static final String DELIVERY = "WorkqDelivery";
    public static final String CONSUMER = "WorkqConsumer";
}
