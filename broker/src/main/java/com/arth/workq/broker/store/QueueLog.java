package com.arth.workq.broker.store;

import com.arth.workq.common.constant.LoggerName;
import com.arth.workq.common.message.Message;
import com.arth.workq.protocol.LogRecord;
import com.arth.workq.protocol.RecordType;
import com.arth.workq.protocol.StoredMessage;
import com.google.protobuf.ByteString;
import com.google.protobuf.CodedOutputStream;
import com.google.protobuf.InvalidProtocolBufferException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Append-only log of one durable queue: APPEND records for published messages and
 * REMOVE tombstones for acknowledged ones. The pending set is the appends minus the
 * tombstones. All methods are synchronized, giving each queue a single writer.
 */
class QueueLog implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(LoggerName.STORE);

    static final String LOG_FILE = "messages.log";
    private static final String COMPACT_FILE = "messages.log.compact";

    private final String queueName;
    private final Path logFile;
    private final Path compactFile;
    private final boolean syncOnWrite;
    private final int compactionThreshold;

    private FileOutputStream fileOutputStream;
    private BufferedOutputStream outputStream;
    private long currentOffset = 0;
    private int tombstones = 0;
    private long lastMessageId = 0;

    QueueLog(String queueName, Path queueDir, boolean syncOnWrite, int compactionThreshold) {
        this.queueName = queueName;
        this.logFile = queueDir.resolve(LOG_FILE);
        this.compactFile = queueDir.resolve(COMPACT_FILE);
        this.syncOnWrite = syncOnWrite;
        this.compactionThreshold = compactionThreshold;
    }

    /**
     * Scan the existing log, cut off a torn trailing record and open for appending.
     */
    synchronized void open() throws IOException {
        Files.createDirectories(logFile.getParent());
        // A leftover compaction file means the compaction never reached its rename
        Files.deleteIfExists(compactFile);
        if (!Files.exists(logFile)) {
            Files.createFile(logFile);
        }

        tombstones = 0;
        lastMessageId = 0;
        long validLength = replay(record -> {
            switch (record.getType()) {
                case APPEND -> lastMessageId = Math.max(lastMessageId, record.getMessage().getMessageId());
                case REMOVE -> tombstones++;
                case CHECKPOINT -> lastMessageId = Math.max(lastMessageId, record.getNextMessageId() - 1);
                default -> {
                }
            }
        });

        long fileSize = Files.size(logFile);
        if (validLength < fileSize) {
            log.warn("Queue {}: discarding {} bytes of torn tail in {}", queueName, fileSize - validLength, logFile);
            truncate(validLength);
        }
        currentOffset = validLength;
        openStream();
        log.info("Queue log {} opened, size: {}, tombstones: {}, last message id: {}",
                logFile, currentOffset, tombstones, lastMessageId);
    }

    synchronized StoreReceipt append(Message message) throws IOException {
        LogRecord record = LogRecord.newBuilder()
                .setType(RecordType.APPEND)
                .setMessage(StoredMessage.newBuilder()
                        .setMessageId(message.getMessageId())
                        .setPayload(ByteString.copyFrom(message.getPayload()))
                        .setPersistent(message.isPersistent())
                        .setEnqueueTimestamp(message.getEnqueueTimestamp())
                        .build())
                .build();
        long offset = write(record);
        lastMessageId = Math.max(lastMessageId, message.getMessageId());
        return new StoreReceipt(queueName, message.getMessageId(), offset);
    }

    synchronized void remove(long messageId) throws IOException {
        write(LogRecord.newBuilder()
                .setType(RecordType.REMOVE)
                .setMessageId(messageId)
                .build());
        tombstones++;
        if (compactionThreshold > 0 && tombstones >= compactionThreshold) {
            try {
                compact();
            } catch (IOException e) {
                // The tombstone itself is durable; the old log stays valid
                log.warn("Queue {}: compaction failed, keeping uncompacted log", queueName, e);
            }
        }
    }

    synchronized List<Message> loadAll() throws IOException {
        Map<Long, StoredMessage> live = liveMessages();
        List<Message> messages = new ArrayList<>(live.size());
        for (StoredMessage stored : live.values()) {
            messages.add(new Message(
                    stored.getMessageId(),
                    queueName,
                    stored.getPayload().toByteArray(),
                    stored.getPersistent(),
                    stored.getEnqueueTimestamp()));
        }
        messages.sort((a, b) -> Long.compare(a.getMessageId(), b.getMessageId()));
        return messages;
    }

    synchronized long getLastMessageId() {
        return lastMessageId;
    }

    synchronized int getTombstones() {
        return tombstones;
    }

    synchronized long size() {
        return currentOffset;
    }

    /**
     * Rewrite the log as a checkpoint followed by the live appends, then swap it in atomically.
     */
    synchronized void compact() throws IOException {
        Map<Long, StoredMessage> live = liveMessages();
        LogRecord checkpoint = LogRecord.newBuilder()
                .setType(RecordType.CHECKPOINT)
                .setNextMessageId(lastMessageId + 1)
                .build();

        try (FileOutputStream fos = new FileOutputStream(compactFile.toFile(), false);
             BufferedOutputStream out = new BufferedOutputStream(fos)) {
            checkpoint.writeDelimitedTo(out);
            for (StoredMessage stored : live.values()) {
                LogRecord.newBuilder()
                        .setType(RecordType.APPEND)
                        .setMessage(stored)
                        .build()
                        .writeDelimitedTo(out);
            }
            out.flush();
            fos.getFD().sync();
        } catch (IOException e) {
            Files.deleteIfExists(compactFile);
            throw e;
        }

        closeStream();
        try {
            Files.move(compactFile, logFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            currentOffset = Files.size(logFile);
            openStream();
        }
        int dropped = tombstones;
        tombstones = 0;
        log.info("Queue {} compacted: {} live messages, {} tombstones dropped, new size: {}",
                queueName, live.size(), dropped, currentOffset);
    }

    @Override
    public synchronized void close() throws IOException {
        closeStream();
    }

    private Map<Long, StoredMessage> liveMessages() throws IOException {
        if (outputStream != null) {
            outputStream.flush();
        }
        Map<Long, StoredMessage> live = new LinkedHashMap<>();
        replay(record -> {
            if (record.getType() == RecordType.APPEND) {
                live.put(record.getMessage().getMessageId(), record.getMessage());
            } else if (record.getType() == RecordType.REMOVE) {
                live.remove(record.getMessageId());
            }
        });
        return live;
    }

    /**
     * Feed every complete record to the visitor.
     *
     * @return length of the valid prefix of the log
     */
    private long replay(Consumer<LogRecord> visitor) throws IOException {
        long readOffset = 0;
        try (InputStream in = new BufferedInputStream(Files.newInputStream(logFile))) {
            while (true) {
                LogRecord record;
                try {
                    record = LogRecord.parseDelimitedFrom(in);
                } catch (InvalidProtocolBufferException e) {
                    log.warn("Queue {}: incomplete record at offset {}: {}", queueName, readOffset, e.getMessage());
                    break;
                }
                if (record == null) {
                    break;
                }
                RecordType type = record.getType();
                if (type != RecordType.APPEND && type != RecordType.REMOVE && type != RecordType.CHECKPOINT) {
                    log.warn("Queue {}: unreadable record type {} at offset {}", queueName, type, readOffset);
                    break;
                }
                visitor.accept(record);
                readOffset += sizeOf(record);
            }
        }
        return readOffset;
    }

    private long write(LogRecord record) throws IOException {
        if (outputStream == null) {
            throw new IOException("Queue log " + logFile + " is not open");
        }
        long writeOffset = currentOffset;
        try {
            record.writeDelimitedTo(outputStream);
            outputStream.flush();
            if (syncOnWrite) {
                fileOutputStream.getFD().sync();
            }
        } catch (IOException e) {
            rollback(writeOffset, e);
            throw e;
        }
        currentOffset += sizeOf(record);
        return writeOffset;
    }

    /**
     * Drop whatever a failed write left behind so later records are not appended after garbage.
     */
    private void rollback(long offset, IOException cause) {
        outputStream = null;
        try {
            // Close the raw stream: closing the buffered one would flush the partial record
            fileOutputStream.close();
            truncate(offset);
            openStream();
        } catch (IOException e) {
            cause.addSuppressed(e);
            log.error("Queue {}: could not roll back failed write at offset {}, log closed", queueName, offset, e);
        }
    }

    private void truncate(long length) throws IOException {
        try (FileChannel channel = FileChannel.open(logFile, StandardOpenOption.WRITE)) {
            channel.truncate(length);
            channel.force(true);
        }
    }

    private void openStream() throws IOException {
        // Append mode
        fileOutputStream = new FileOutputStream(logFile.toFile(), true);
        outputStream = new BufferedOutputStream(fileOutputStream);
    }

    private void closeStream() throws IOException {
        if (outputStream != null) {
            outputStream.flush();
            outputStream.close();
            outputStream = null;
        }
    }

    private static long sizeOf(LogRecord record) {
        int serializedSize = record.getSerializedSize();
        return (long) CodedOutputStream.computeUInt32SizeNoTag(serializedSize) + serializedSize;
    }
}
