package io.github.lukaszsamson.spark.pushsource;

import org.apache.spark.sql.connector.catalog.SupportsRead;
import org.apache.spark.sql.connector.catalog.Table;
import org.apache.spark.sql.connector.catalog.TableCapability;
import org.apache.spark.sql.connector.read.ScanBuilder;
import org.apache.spark.sql.types.DataTypes;
import org.apache.spark.sql.types.Metadata;
import org.apache.spark.sql.types.StructField;
import org.apache.spark.sql.types.StructType;
import org.apache.spark.sql.util.CaseInsensitiveStringMap;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Spark {@link Table} over a RabbitMQ stream subscription. Micro-batch read only.
 */
public class PushSourceTable implements Table, SupportsRead {

    /** Fixed source schema: the parsed message text and its arrival timestamp. */
    public static final StructType SCHEMA = new StructType(new StructField[]{
            new StructField("value", DataTypes.StringType, false, Metadata.empty()),
            new StructField("timestamp", DataTypes.TimestampType, false, Metadata.empty()),
    });

    private static final Set<TableCapability> CAPABILITIES = Set.of(
            TableCapability.MICRO_BATCH_READ
    );

    private final ConnectorOptions options;
    private final Map<String, String> tableOptions;

    public PushSourceTable(ConnectorOptions options) {
        this(options, Map.of());
    }

    public PushSourceTable(ConnectorOptions options, Map<String, String> tableOptions) {
        this.options = options;
        this.tableOptions = tableOptions == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(tableOptions));
    }

    @Override
    public String name() {
        return options.getStream();
    }

    @Override
    public StructType schema() {
        return SCHEMA;
    }

    @Override
    public Set<TableCapability> capabilities() {
        return CAPABILITIES;
    }

    @Override
    public ScanBuilder newScanBuilder(CaseInsensitiveStringMap sparkOptions) {
        // Per-operation options override table options.
        ConnectorOptions scanOptions = sparkOptions.isEmpty()
                ? options
                : mergeOptions(tableOptions, sparkOptions.asCaseSensitiveMap());
        return new PushSourceScanBuilder(scanOptions);
    }

    public ConnectorOptions getOptions() {
        return options;
    }

    private static ConnectorOptions mergeOptions(Map<String, String> tableOptions,
                                                 Map<String, String> operationOptions) {
        Map<String, String> merged = new LinkedHashMap<>();
        putNormalizedKeys(merged, tableOptions);
        putNormalizedKeys(merged, operationOptions);
        return new ConnectorOptions(merged);
    }

    private static void putNormalizedKeys(Map<String, String> target, Map<String, String> source) {
        for (Map.Entry<String, String> entry : source.entrySet()) {
            if (entry.getKey() != null) {
                target.put(entry.getKey().toLowerCase(Locale.ROOT), entry.getValue());
            }
        }
    }
}
