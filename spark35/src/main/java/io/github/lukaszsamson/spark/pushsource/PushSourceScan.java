package io.github.lukaszsamson.spark.pushsource;

import org.apache.spark.sql.connector.read.Scan;
import org.apache.spark.sql.connector.read.streaming.MicroBatchStream;
import org.apache.spark.sql.types.StructType;

/**
 * Logical scan of the push source. Only streaming micro-batch reads are
 * supported: the subscription has no history to read in batch mode.
 */
final class PushSourceScan implements Scan {

    private final ConnectorOptions options;

    PushSourceScan(ConnectorOptions options) {
        this.options = options;
    }

    @Override
    public StructType readSchema() {
        return PushSourceTable.SCHEMA;
    }

    @Override
    public String description() {
        return "RabbitMQPushSource[stream=" + options.getStream() + "]";
    }

    @Override
    public MicroBatchStream toMicroBatchStream(String checkpointLocation) {
        return new PushSourceMicroBatchStream(options, checkpointLocation);
    }
}
