package io.github.lukaszsamson.spark.pushsource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.Objects;
import java.util.Set;

/**
 * Durable store for consumed records, keyed by ledger offset.
 *
 * <p>Records are encoded with {@link LedgerRecordCodec} and stored in a
 * {@link MessagePersistence} under the decimal offset. Keys that are not
 * positive integers are ignored, so the persistence may be shared with other
 * state.
 *
 * <p>Thread-safe as long as the underlying persistence is.
 */
public class LocalMessageStore implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(LocalMessageStore.class);

    private final MessagePersistence persistence;
    private volatile boolean closed;

    /**
     * @param persistence the persistence backend; opened by this constructor
     * @throws IllegalStateException if the persistence cannot be opened
     */
    public LocalMessageStore(MessagePersistence persistence) {
        this.persistence = Objects.requireNonNull(persistence, "persistence");
        try {
            persistence.open();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to open message persistence", e);
        }
    }

    /**
     * Write {@code record} under {@code offset}, replacing any previous value.
     *
     * @throws PersistFailureException if the write fails
     */
    public void persist(long offset, LedgerRecord record) {
        checkOffset(offset);
        Objects.requireNonNull(record, "record");
        try {
            persistence.put(key(offset), LedgerRecordCodec.encode(record));
        } catch (IOException | RuntimeException e) {
            throw new PersistFailureException(offset, e);
        }
    }

    /**
     * Read the record previously persisted under {@code offset}.
     *
     * @throws RecordNotFoundException if nothing was persisted at that offset
     * @throws StoreException if the store cannot be read
     */
    public LedgerRecord fetch(long offset) {
        checkOffset(offset);
        byte[] data;
        try {
            data = persistence.get(key(offset));
        } catch (IOException | RuntimeException e) {
            throw new StoreException("Failed to read record at offset " + offset, offset, e);
        }
        if (data == null) {
            throw new RecordNotFoundException(offset);
        }
        try {
            return LedgerRecordCodec.decode(data);
        } catch (IllegalArgumentException e) {
            throw new StoreException("Stored record at offset " + offset + " is corrupt",
                    offset, e);
        }
    }

    /**
     * Scan the store for the highest persisted offset.
     *
     * @return the highest offset found, or 0 if the store is empty or unreadable
     */
    public long recoverMaxOffset() {
        Set<String> keys;
        try {
            keys = persistence.keys();
        } catch (IOException | RuntimeException e) {
            LOG.warn("Unable to scan message persistence; assuming no prior state", e);
            return 0L;
        }
        long max = 0L;
        for (String key : keys) {
            long offset = parseOffset(key);
            if (offset > max) {
                max = offset;
            }
        }
        return max;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            persistence.close();
        } catch (IOException e) {
            LOG.warn("Error closing message persistence", e);
        }
    }

    static String key(long offset) {
        return Long.toString(offset);
    }

    /** Returns the offset encoded by {@code key}, or -1 if it is not a positive offset. */
    static long parseOffset(String key) {
        if (key == null || key.isEmpty()) {
            return -1L;
        }
        for (int i = 0; i < key.length(); i++) {
            if (!Character.isDigit(key.charAt(i))) {
                return -1L;
            }
        }
        try {
            long offset = Long.parseLong(key);
            return offset > 0 ? offset : -1L;
        } catch (NumberFormatException e) {
            return -1L;
        }
    }

    private static void checkOffset(long offset) {
        if (offset <= 0) {
            throw new IllegalArgumentException("Offset must be > 0, got: " + offset);
        }
    }
}
