package io.github.lukaszsamson.spark.pushsource;

import org.apache.spark.sql.catalyst.InternalRow;
import org.apache.spark.sql.connector.read.InputPartition;
import org.apache.spark.sql.connector.read.PartitionReader;
import org.apache.spark.sql.connector.read.PartitionReaderFactory;

/**
 * Creates {@link LedgerPartitionReader}s on executors.
 */
final class LedgerPartitionReaderFactory implements PartitionReaderFactory {
    private static final long serialVersionUID = 1L;

    @Override
    public PartitionReader<InternalRow> createReader(InputPartition partition) {
        if (!(partition instanceof LedgerInputPartition ledgerPartition)) {
            throw new IllegalArgumentException(
                    "Unexpected partition type: " + partition.getClass().getName());
        }
        return new LedgerPartitionReader(ledgerPartition);
    }
}
