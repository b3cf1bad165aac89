package io.github.lukaszsamson.spark.pushsource;

import org.apache.spark.sql.connector.read.Scan;
import org.apache.spark.sql.connector.read.ScanBuilder;

/**
 * Builds a {@link PushSourceScan}; validates source options on construction.
 */
final class PushSourceScanBuilder implements ScanBuilder {

    private final ConnectorOptions options;

    PushSourceScanBuilder(ConnectorOptions options) {
        this.options = options;
        options.validateForSource();
    }

    @Override
    public Scan build() {
        return new PushSourceScan(options);
    }
}
