package io.github.lukaszsamson.spark.pushsource;

import org.apache.spark.sql.catalyst.InternalRow;
import org.apache.spark.sql.catalyst.expressions.GenericInternalRow;
import org.apache.spark.sql.connector.read.PartitionReader;
import org.apache.spark.unsafe.types.UTF8String;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Iterator;

/**
 * Emits the records of a {@link LedgerInputPartition} as rows of
 * {@link PushSourceTable#SCHEMA}.
 */
final class LedgerPartitionReader implements PartitionReader<InternalRow> {

    private static final Logger LOG = LoggerFactory.getLogger(LedgerPartitionReader.class);

    private final LedgerInputPartition partition;
    private final Iterator<LedgerRecord> records;
    private InternalRow currentRow;
    private long rowsEmitted;

    LedgerPartitionReader(LedgerInputPartition partition) {
        this.partition = partition;
        this.records = partition.getRecords().iterator();
    }

    @Override
    public boolean next() {
        if (!records.hasNext()) {
            currentRow = null;
            return false;
        }
        currentRow = toRow(records.next());
        rowsEmitted++;
        return true;
    }

    @Override
    public InternalRow get() {
        return currentRow;
    }

    @Override
    public void close() {
        currentRow = null;
        LOG.debug("Emitted {} rows for offsets ({}, {}]", rowsEmitted,
                partition.getStartOffset(), partition.getEndOffset());
    }

    static InternalRow toRow(LedgerRecord record) {
        return new GenericInternalRow(new Object[]{
                UTF8String.fromString(record.getValue()),
                instantToMicros(record.getTimestamp())
        });
    }

    /** Spark stores timestamps as microseconds since the epoch. */
    static long instantToMicros(Instant instant) {
        return Math.addExact(Math.multiplyExact(instant.getEpochSecond(), 1_000_000L),
                instant.getNano() / 1_000L);
    }
}
