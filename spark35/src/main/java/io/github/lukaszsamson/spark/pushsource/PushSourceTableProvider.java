package io.github.lukaszsamson.spark.pushsource;

import org.apache.spark.sql.connector.catalog.Table;
import org.apache.spark.sql.connector.catalog.TableProvider;
import org.apache.spark.sql.connector.expressions.Transform;
import org.apache.spark.sql.sources.DataSourceRegister;
import org.apache.spark.sql.types.StructType;
import org.apache.spark.sql.util.CaseInsensitiveStringMap;

import java.util.Map;

/**
 * Spark DataSource V2 {@link TableProvider} for the RabbitMQ push source.
 *
 * <p>Registered as {@code rabbitmq_push} via {@link DataSourceRegister}.
 * The schema is fixed: {@code value STRING, timestamp TIMESTAMP}.
 */
public class PushSourceTableProvider implements TableProvider, DataSourceRegister {

    public static final String SHORT_NAME = "rabbitmq_push";

    @Override
    public String shortName() {
        return SHORT_NAME;
    }

    @Override
    public StructType inferSchema(CaseInsensitiveStringMap options) {
        return PushSourceTable.SCHEMA;
    }

    @Override
    public Table getTable(StructType schema, Transform[] partitioning,
                          Map<String, String> properties) {
        ConnectorOptions options = new ConnectorOptions(properties);
        options.validateCommon();
        return new PushSourceTable(options, properties);
    }
}
