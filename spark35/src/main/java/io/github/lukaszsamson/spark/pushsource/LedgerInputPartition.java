package io.github.lukaszsamson.spark.pushsource;

import org.apache.spark.sql.connector.read.InputPartition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A serializable input partition carrying the records of one ledger range.
 *
 * <p>The ledger lives on the driver, so the records resolved there travel to
 * the executor inside the partition itself.
 */
public final class LedgerInputPartition implements InputPartition {
    private static final long serialVersionUID = 1L;

    private final long startOffset;
    private final long endOffset;
    private final ArrayList<LedgerRecord> records;

    /**
     * @param startOffset exclusive start offset
     * @param endOffset inclusive end offset
     * @param records the records at {@code (startOffset, endOffset]}, in offset order
     */
    public LedgerInputPartition(long startOffset, long endOffset, List<LedgerRecord> records) {
        this.startOffset = startOffset;
        this.endOffset = endOffset;
        this.records = new ArrayList<>(records);
    }

    public long getStartOffset() {
        return startOffset;
    }

    public long getEndOffset() {
        return endOffset;
    }

    public List<LedgerRecord> getRecords() {
        return Collections.unmodifiableList(records);
    }

    @Override
    public String toString() {
        return "LedgerInputPartition{offsets=(" + startOffset + ", " + endOffset +
                "], records=" + records.size() + "}";
    }
}
