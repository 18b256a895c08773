package com.arth.workq.broker.config;

import com.arth.workq.common.constant.LoggerName;
import com.arth.workq.common.utils.YamlParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Collections;
import java.util.Map;

/**
 * Broker-level configuration loaded from YAML.
 */
public class BrokerConfig {

    private static final String DEFAULT_CONFIG_FILE = "config/broker.yml";

    private static final String DEFAULT_STORE_DIR = "data/store";
    private static final boolean DEFAULT_SYNC_ON_WRITE = true;
    private static final int DEFAULT_COMPACTION_THRESHOLD = 1000;
    private static final int DEFAULT_PREFETCH = 1;
    private static final int DEFAULT_MAX_LENGTH = 0; // unbounded
    private static final long DEFAULT_DELIVERY_TIMEOUT_MS = 0; // disabled
    private static final long DEFAULT_PUBLISH_BLOCK_TIMEOUT_MS = 5000;
    private static final int DEFAULT_ACK_MAX_RETRIES = 2; // equals 3 attempts total
    private static final long DEFAULT_ACK_RETRY_DELAY_MS = 100;

    private final String storeDir;
    private final boolean syncOnWrite;
    private final int compactionThreshold;
    private final int defaultPrefetch;
    private final long publishBlockTimeoutMs;
    private final int ackMaxRetries;
    private final long ackRetryDelayMs;
    private final QueueConfig defaultQueueConfig;

    private static final Logger log = LoggerFactory.getLogger(LoggerName.CONFIG);
    private static volatile BrokerConfig INSTANCE;

    public BrokerConfig(Map<String, String> configMap) {
        storeDir = YamlParser.getStringValue(configMap, "store.dir", DEFAULT_STORE_DIR);
        syncOnWrite = YamlParser.getBooleanValue(configMap, "store.syncOnWrite", DEFAULT_SYNC_ON_WRITE);
        compactionThreshold = YamlParser.getIntValue(configMap, "store.compactionThreshold", DEFAULT_COMPACTION_THRESHOLD);
        defaultPrefetch = YamlParser.getIntValue(configMap, "consumer.defaultPrefetch", DEFAULT_PREFETCH);
        publishBlockTimeoutMs = YamlParser.getLongValue(configMap, "queue.publishBlockTimeoutMs", DEFAULT_PUBLISH_BLOCK_TIMEOUT_MS);
        ackMaxRetries = YamlParser.getIntValue(configMap, "ack.maxRetries", DEFAULT_ACK_MAX_RETRIES);
        ackRetryDelayMs = YamlParser.getLongValue(configMap, "ack.retryDelayMs", DEFAULT_ACK_RETRY_DELAY_MS);
        defaultQueueConfig = QueueConfig.builder()
                .maxLength(YamlParser.getIntValue(configMap, "queue.maxLength", DEFAULT_MAX_LENGTH))
                .overflowPolicy(YamlParser.getEnumValue(configMap, "queue.overflowPolicy", OverflowPolicy.REJECT_PUBLISH))
                .requeuePosition(YamlParser.getEnumValue(configMap, "queue.requeuePosition", RequeuePosition.HEAD))
                .deliveryTimeoutMs(YamlParser.getLongValue(configMap, "queue.deliveryTimeoutMs", DEFAULT_DELIVERY_TIMEOUT_MS))
                .build();
        if (defaultPrefetch < 1) {
            throw new IllegalArgumentException("consumer.defaultPrefetch must be >= 1, got " + defaultPrefetch);
        }
    }

    /**
     * Load from a YAML file, falling back to defaults when the file cannot be read.
     */
    public static BrokerConfig load(String configFile) {
        try {
            return new BrokerConfig(YamlParser.parseYaml(configFile));
        } catch (IOException e) {
            log.warn("Failed to load broker config file: {}. Using default values.", configFile);
            return defaults();
        }
    }

    public static BrokerConfig defaults() {
        return new BrokerConfig(Collections.emptyMap());
    }

    public static BrokerConfig getConfig() {
        if (INSTANCE == null) {
            synchronized (BrokerConfig.class) {
                if (INSTANCE == null) {
                    INSTANCE = load(DEFAULT_CONFIG_FILE);
                }
            }
        }
        return INSTANCE;
    }

    public String getStoreDir() {
        return storeDir;
    }

    public boolean isSyncOnWrite() {
        return syncOnWrite;
    }

    public int getCompactionThreshold() {
        return compactionThreshold;
    }

    public int getDefaultPrefetch() {
        return defaultPrefetch;
    }

    public long getPublishBlockTimeoutMs() {
        return publishBlockTimeoutMs;
    }

    public int getAckMaxRetries() {
        return ackMaxRetries;
    }

    public long getAckRetryDelayMs() {
        return ackRetryDelayMs;
    }

    /**
     * Options applied to queues declared without explicit {@link QueueConfig}.
     */
    public QueueConfig getDefaultQueueConfig() {
        return defaultQueueConfig;
    }
}
