package com.arth.workq.broker.store;

import com.arth.workq.broker.config.BrokerConfig;
import com.arth.workq.broker.config.OverflowPolicy;
import com.arth.workq.broker.config.QueueConfig;
import com.arth.workq.broker.config.RequeuePosition;
import com.arth.workq.common.constant.LoggerName;
import com.arth.workq.common.message.Message;
import com.arth.workq.protocol.OverflowMode;
import com.arth.workq.protocol.QueueDeclaration;
import com.arth.workq.protocol.RequeueMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * File-backed store: one directory per durable queue holding {@code queue.meta} and an
 * append-only {@code messages.log}.
 */
public class FileMessageStore implements MessageStore {

    private static final Logger log = LoggerFactory.getLogger(LoggerName.STORE);
    private static final String META_FILE = "queue.meta";

    private final Path storeDir;
    private final boolean syncOnWrite;
    private final int compactionThreshold;
    private final ConcurrentHashMap<String, QueueLog> logs = new ConcurrentHashMap<>();
    private volatile boolean started = false;

    public FileMessageStore(String storeDir) {
        this(Paths.get(storeDir), true, 0);
    }

    public FileMessageStore(BrokerConfig config) {
        this(Paths.get(config.getStoreDir()), config.isSyncOnWrite(), config.getCompactionThreshold());
    }

    public FileMessageStore(Path storeDir, boolean syncOnWrite, int compactionThreshold) {
        this.storeDir = storeDir;
        this.syncOnWrite = syncOnWrite;
        this.compactionThreshold = compactionThreshold;
    }

    @Override
    public synchronized void start() throws IOException {
        Files.createDirectories(storeDir);
        started = true;
        log.info("FileMessageStore started at {}, syncOnWrite: {}, compactionThreshold: {}",
                storeDir.toAbsolutePath(), syncOnWrite, compactionThreshold);
    }

    @Override
    public synchronized void declare(String queueName, QueueConfig config) throws IOException {
        ensureStarted();
        Path queueDir = queueDir(queueName);
        Files.createDirectories(queueDir);

        Path meta = queueDir.resolve(META_FILE);
        Path tmp = queueDir.resolve(META_FILE + ".tmp");
        try (OutputStream out = Files.newOutputStream(tmp)) {
            toDeclaration(queueName, config).writeTo(out);
        }
        Files.move(tmp, meta, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);

        if (!logs.containsKey(queueName)) {
            QueueLog queueLog = new QueueLog(queueName, queueDir, syncOnWrite, compactionThreshold);
            queueLog.open();
            logs.put(queueName, queueLog);
        }
        log.info("Durable queue {} declared in store with {}", queueName, config);
    }

    @Override
    public synchronized Map<String, QueueConfig> recoverDeclarations() throws IOException {
        ensureStarted();
        Map<String, QueueConfig> declarations = new TreeMap<>();
        try (DirectoryStream<Path> dirs = Files.newDirectoryStream(storeDir, Files::isDirectory)) {
            for (Path queueDir : dirs) {
                Path meta = queueDir.resolve(META_FILE);
                if (!Files.exists(meta)) {
                    log.warn("Skipping {}: no {}", queueDir, META_FILE);
                    continue;
                }
                QueueDeclaration declaration;
                try (InputStream in = Files.newInputStream(meta)) {
                    declaration = QueueDeclaration.parseFrom(in);
                }
                String queueName = declaration.getName();
                if (!queueDir.getFileName().toString().equals(queueName)) {
                    log.warn("Skipping {}: declaration names queue {}", queueDir, queueName);
                    continue;
                }
                if (!logs.containsKey(queueName)) {
                    QueueLog queueLog = new QueueLog(queueName, queueDir, syncOnWrite, compactionThreshold);
                    queueLog.open();
                    logs.put(queueName, queueLog);
                }
                declarations.put(queueName, fromDeclaration(declaration));
            }
        }
        log.info("Recovered {} durable queue declarations from {}", declarations.size(), storeDir);
        return declarations;
    }

    @Override
    public StoreReceipt append(String queueName, Message message) throws IOException {
        return queueLog(queueName).append(message);
    }

    @Override
    public List<Message> loadAll(String queueName) throws IOException {
        return queueLog(queueName).loadAll();
    }

    @Override
    public long lastMessageId(String queueName) throws IOException {
        return queueLog(queueName).getLastMessageId();
    }

    @Override
    public void remove(String queueName, long messageId) throws IOException {
        queueLog(queueName).remove(messageId);
    }

    /**
     * Force a compaction of the queue's log regardless of the tombstone threshold.
     */
    public void compact(String queueName) throws IOException {
        queueLog(queueName).compact();
    }

    @Override
    public synchronized void deleteQueue(String queueName) throws IOException {
        QueueLog queueLog = logs.remove(queueName);
        if (queueLog != null) {
            queueLog.close();
        }
        Path queueDir = queueDir(queueName);
        if (Files.exists(queueDir)) {
            try (Stream<Path> paths = Files.walk(queueDir)) {
                for (Path path : (Iterable<Path>) paths.sorted(Comparator.reverseOrder())::iterator) {
                    Files.delete(path);
                }
            }
        }
        log.info("Durable queue {} deleted from store", queueName);
    }

    @Override
    public synchronized void shutdown() throws IOException {
        IOException failure = null;
        for (Map.Entry<String, QueueLog> entry : logs.entrySet()) {
            try {
                entry.getValue().close();
            } catch (IOException e) {
                log.error("Failed to close log of queue {}", entry.getKey(), e);
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        logs.clear();
        started = false;
        log.info("FileMessageStore at {} shut down", storeDir);
        if (failure != null) {
            throw failure;
        }
    }

    Path queueDir(String queueName) {
        return storeDir.resolve(queueName);
    }

    private QueueLog queueLog(String queueName) throws IOException {
        QueueLog queueLog = logs.get(queueName);
        if (queueLog == null) {
            throw new IOException("Queue " + queueName + " is not declared in the store");
        }
        return queueLog;
    }

    private void ensureStarted() throws IOException {
        if (!started) {
            throw new IOException("Store not started");
        }
    }

    private static QueueDeclaration toDeclaration(String queueName, QueueConfig config) {
        return QueueDeclaration.newBuilder()
                .setName(queueName)
                .setDurable(true)
                .setMaxLength(config.getMaxLength())
                .setOverflow(OverflowMode.valueOf(config.getOverflowPolicy().name()))
                .setRequeue(RequeueMode.valueOf(config.getRequeuePosition().name()))
                .setDeliveryTimeoutMs(config.getDeliveryTimeoutMs())
                .build();
    }

    private static QueueConfig fromDeclaration(QueueDeclaration declaration) {
        QueueConfig.Builder builder = QueueConfig.builder()
                .maxLength(declaration.getMaxLength())
                .deliveryTimeoutMs(declaration.getDeliveryTimeoutMs());
        switch (declaration.getOverflow()) {
            case DROP_HEAD -> builder.overflowPolicy(OverflowPolicy.DROP_HEAD);
            case BLOCK_PUBLISH -> builder.overflowPolicy(OverflowPolicy.BLOCK_PUBLISH);
            default -> builder.overflowPolicy(OverflowPolicy.REJECT_PUBLISH);
        }
        builder.requeuePosition(declaration.getRequeue() == RequeueMode.TAIL ? RequeuePosition.TAIL : RequeuePosition.HEAD);
        return builder.build();
    }
}
