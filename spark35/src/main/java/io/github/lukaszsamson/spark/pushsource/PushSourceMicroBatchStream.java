package io.github.lukaszsamson.spark.pushsource;

import org.apache.spark.sql.connector.read.InputPartition;
import org.apache.spark.sql.connector.read.PartitionReaderFactory;
import org.apache.spark.sql.connector.read.streaming.MicroBatchStream;
import org.apache.spark.sql.connector.read.streaming.Offset;
import org.apache.spark.sql.connector.read.streaming.ReportsSourceMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * {@link MicroBatchStream} serving pushed RabbitMQ messages through an
 * {@link OffsetLedger}.
 *
 * <p>The subscription delivers messages on the driver, where the ledger numbers
 * and buffers them. Each planned batch is read from the ledger on the driver,
 * which also migrates the records to the local store, and ships to an executor
 * as a single {@link LedgerInputPartition}.
 */
public class PushSourceMicroBatchStream implements MicroBatchStream, ReportsSourceMetrics {

    private static final Logger LOG = LoggerFactory.getLogger(PushSourceMicroBatchStream.class);

    private final ConnectorOptions options;
    private final OffsetLedger ledger;

    PushSourceMicroBatchStream(ConnectorOptions options, String checkpointLocation) {
        this(options, LedgerFactory.createLedger(options, checkpointLocation),
                new RabbitMQSubscription(options));
    }

    PushSourceMicroBatchStream(ConnectorOptions options, OffsetLedger ledger,
                               MessageTransport transport) {
        this.options = options;
        this.ledger = ledger;
        try {
            ledger.start(transport);
        } catch (RuntimeException e) {
            ledger.stop();
            throw e;
        }
        LOG.info("Started push source for stream '{}'", options.getStream());
    }

    @Override
    public Offset initialOffset() {
        return LedgerOffset.ZERO;
    }

    /** @return the newest offset, or {@code null} while nothing has arrived */
    @Override
    public Offset latestOffset() {
        OptionalLong latest = ledger.latestOffset();
        return latest.isPresent() ? new LedgerOffset(latest.getAsLong()) : null;
    }

    @Override
    public Offset deserializeOffset(String json) {
        return LedgerOffset.fromJson(json);
    }

    @Override
    public InputPartition[] planInputPartitions(Offset start, Offset end) {
        long startOffset = LedgerOffset.of(start).getOffset();
        long endOffset = LedgerOffset.of(end).getOffset();
        List<LedgerRecord> records = ledger.readRange(startOffset, endOffset);
        LOG.debug("Planned batch ({}, {}] of stream '{}' with {} records",
                startOffset, endOffset, options.getStream(), records.size());
        return new InputPartition[]{new LedgerInputPartition(startOffset, endOffset, records)};
    }

    @Override
    public PartitionReaderFactory createReaderFactory() {
        return new LedgerPartitionReaderFactory();
    }

    /** Committed records are already durable; nothing to acknowledge upstream. */
    @Override
    public void commit(Offset end) {
        LOG.debug("Committed offset {} of stream '{}'", end, options.getStream());
    }

    @Override
    public void stop() {
        LOG.info("Stopping push source for stream '{}'", options.getStream());
        ledger.stop();
    }

    // ---- ReportsSourceMetrics ----

    @Override
    public Map<String, String> metrics(Optional<Offset> latestConsumedOffset) {
        Map<String, String> metrics = new LinkedHashMap<>();
        long latest = ledger.latestOffset().orElse(0L);
        long consumed = latestConsumedOffset.map(o -> LedgerOffset.of(o).getOffset()).orElse(0L);
        metrics.put("bufferedRecords", String.valueOf(ledger.bufferedCount()));
        metrics.put("latestOffset", String.valueOf(latest));
        metrics.put("offsetsBehindLatest", String.valueOf(Math.max(0L, latest - consumed)));
        return metrics;
    }

    @Override
    public String toString() {
        return "PushSourceMicroBatchStream[stream=" + options.getStream() + "]";
    }
}
