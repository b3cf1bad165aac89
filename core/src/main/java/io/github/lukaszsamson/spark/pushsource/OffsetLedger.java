package io.github.lukaszsamson.spark.pushsource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Push-to-pull bridge that numbers pushed messages with contiguous offsets
 * and serves them back as replayable, offset-addressed batches.
 *
 * <p>Transports deliver payloads through {@link #onArrival(byte[])} from any
 * thread at any time. Each arrival gets the next offset and is buffered in
 * memory. A batch read ({@link #readRange(long, long)}) resolves every offset
 * in its range from the buffer or, once migrated, from the durable
 * {@link LocalMessageStore}, writes it through to the store and only then
 * drops it from the buffer. Offset {@code 0} means "nothing produced yet".
 *
 * <p>Arrivals suspend until {@link #recover()} has restored the offset
 * counter from the store. The barrier opens once and is never re-armed.
 *
 * <p>{@code currentOffset}, the buffer and the state are guarded by one lock.
 * Batch reads take it per buffer access only, never across store I/O.
 *
 * <p>Records buffered but not yet read when the process dies are lost: on
 * restart numbering resumes after the highest <em>persisted</em> offset.
 */
public class OffsetLedger {

    private static final Logger LOG = LoggerFactory.getLogger(OffsetLedger.class);

    private final LocalMessageStore store;
    private final MessageParser parser;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition initialized = lock.newCondition();
    private final Map<Long, LedgerRecord> buffer = new HashMap<>();
    private long currentOffset;
    private LedgerState state = LedgerState.INITIALIZING;
    private MessageTransport transport;

    public OffsetLedger(LocalMessageStore store, MessageParser parser) {
        this.store = Objects.requireNonNull(store, "store");
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    // ---- Lifecycle ----

    /**
     * Subscribe {@code transport} to this ledger and then recover. Messages
     * delivered while recovery runs wait on the initialization barrier.
     *
     * @throws IllegalStateException if the ledger already left initialization
     *         or already has a transport
     */
    public void start(MessageTransport transport) {
        Objects.requireNonNull(transport, "transport");
        lock.lock();
        try {
            if (state != LedgerState.INITIALIZING) {
                throw new IllegalStateException("Cannot start ledger in state " + state);
            }
            if (this.transport != null) {
                throw new IllegalStateException("Ledger already has a transport");
            }
            this.transport = transport;
        } finally {
            lock.unlock();
        }
        transport.subscribe(this::onArrival);
        recover();
    }

    /**
     * Restore {@code currentOffset} from the highest persisted offset and open
     * the initialization barrier. A failed scan counts as a cold start.
     *
     * @return the recovered offset
     * @throws IllegalStateException if called more than once or after stop
     */
    public long recover() {
        long recovered;
        try {
            recovered = Math.max(0L, store.recoverMaxOffset());
        } catch (RuntimeException e) {
            LOG.warn("Failed to recover last stored offset; starting from offset 0", e);
            recovered = 0L;
        }
        lock.lock();
        try {
            if (state != LedgerState.INITIALIZING) {
                throw new IllegalStateException("Ledger already recovered (state " + state + ")");
            }
            currentOffset = recovered;
            state = LedgerState.READY;
            initialized.signalAll();
        } finally {
            lock.unlock();
        }
        LOG.info("Recovering from last stored offset {}", recovered);
        return recovered;
    }

    /**
     * Disconnect the transport and close the store. Arrivals still waiting on
     * the barrier, or arriving afterwards, are dropped. Records that were
     * buffered but never read are discarded. Idempotent.
     */
    public void stop() {
        MessageTransport attached;
        long offset;
        int unread;
        lock.lock();
        try {
            if (state == LedgerState.STOPPED) {
                return;
            }
            state = LedgerState.STOPPED;
            initialized.signalAll();
            attached = transport;
            offset = currentOffset;
            unread = buffer.size();
            buffer.clear();
        } finally {
            lock.unlock();
        }
        if (attached != null) {
            try {
                attached.close();
            } catch (RuntimeException e) {
                LOG.warn("Error disconnecting transport", e);
            }
        }
        try {
            store.close();
        } catch (RuntimeException e) {
            LOG.warn("Error closing message store", e);
        }
        if (unread > 0) {
            LOG.warn("Ledger stopped at offset {} with {} unread buffered records; " +
                    "they were never persisted and will not be recovered", offset, unread);
        } else {
            LOG.info("Ledger stopped at offset {}", offset);
        }
    }

    // ---- Arrivals ----

    /**
     * Number and buffer one pushed message. Blocks until the ledger has been
     * recovered.
     *
     * @param payload raw message bytes
     * @return the assigned offset, or 0 if the message was dropped because the
     *         ledger stopped or the caller was interrupted while waiting
     * @throws RuntimeException whatever the parser throws for this payload
     */
    public long onArrival(byte[] payload) {
        LedgerRecord record = parser.parse(payload);
        lock.lock();
        try {
            while (state == LedgerState.INITIALIZING) {
                initialized.await();
            }
            if (state == LedgerState.STOPPED) {
                LOG.debug("Ledger stopped; dropping arrived message");
                return 0L;
            }
            long offset = currentOffset + 1;
            buffer.put(offset, record);
            currentOffset = offset;
            LOG.trace("Message arrived, assigned offset {}", offset);
            return offset;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for ledger recovery; dropping arrived message");
            return 0L;
        } finally {
            lock.unlock();
        }
    }

    // ---- Queries ----

    /**
     * Latest available position.
     *
     * @return the highest assigned offset, or empty if nothing has ever arrived
     *         (including recovered history)
     */
    public OptionalLong latestOffset() {
        lock.lock();
        try {
            return currentOffset == 0L ? OptionalLong.empty() : OptionalLong.of(currentOffset);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Same as {@link #readRange(long, long)}; an empty start reads from the
     * beginning of recorded history.
     */
    public List<LedgerRecord> readRange(OptionalLong startExclusive, long endInclusive) {
        Objects.requireNonNull(startExclusive, "startExclusive");
        return readRange(startExclusive.orElse(0L), endInclusive);
    }

    /**
     * Return the records at offsets {@code (startExclusive, endInclusive]} in
     * ascending offset order, migrating each one to the durable store.
     *
     * <p>Every record is written to the store, whether it came from the buffer
     * or from the store itself, before it is removed from the buffer. Reading
     * the same range again returns equal records.
     *
     * @throws RangeOutOfBoundsException if {@code startExclusive < 0},
     *         {@code endInclusive < startExclusive} or {@code endInclusive}
     *         is past the current offset
     * @throws RecordMissingException if an offset is in neither the buffer nor
     *         the store
     * @throws PersistFailureException if writing a record to the store fails;
     *         that record stays buffered and the read can be retried
     * @throws StoreException if the store cannot be read
     * @throws IllegalStateException if the ledger has been stopped
     */
    public List<LedgerRecord> readRange(long startExclusive, long endInclusive) {
        lock.lock();
        try {
            if (state == LedgerState.STOPPED) {
                throw new IllegalStateException("Ledger has been stopped");
            }
            if (startExclusive < 0 || endInclusive < startExclusive
                    || endInclusive > currentOffset) {
                throw new RangeOutOfBoundsException(startExclusive, endInclusive, currentOffset);
            }
        } finally {
            lock.unlock();
        }

        long count = endInclusive - startExclusive;
        List<LedgerRecord> batch = new ArrayList<>((int) Math.min(count, 4096L));
        for (long offset = startExclusive + 1; offset <= endInclusive; offset++) {
            LedgerRecord record = resolve(offset);
            batch.add(record);
            store.persist(offset, record);
            removeBuffered(offset, record);
        }
        LOG.trace("Read range ({}, {}]: {} records", startExclusive, endInclusive, batch.size());
        return Collections.unmodifiableList(batch);
    }

    /** Number of records buffered in memory and not yet migrated to the store. */
    public int bufferedCount() {
        lock.lock();
        try {
            return buffer.size();
        } finally {
            lock.unlock();
        }
    }

    public LedgerState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    boolean isBuffered(long offset) {
        lock.lock();
        try {
            return buffer.containsKey(offset);
        } finally {
            lock.unlock();
        }
    }

    // ---- Internals ----

    private LedgerRecord resolve(long offset) {
        LedgerRecord buffered;
        lock.lock();
        try {
            buffered = buffer.get(offset);
        } finally {
            lock.unlock();
        }
        if (buffered != null) {
            return buffered;
        }
        // Not buffered: an earlier read must have persisted it before removing it.
        try {
            return store.fetch(offset);
        } catch (RecordNotFoundException e) {
            throw new RecordMissingException(offset, e);
        }
    }

    private void removeBuffered(long offset, LedgerRecord record) {
        lock.lock();
        try {
            buffer.remove(offset, record);
        } finally {
            lock.unlock();
        }
    }
}
