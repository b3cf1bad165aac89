package io.github.lukaszsamson.spark.pushsource;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * A parsed message: its text value and the instant it was observed.
 *
 * <p>Immutable. Created once at arrival, then owned by the ledger buffer
 * and later by the durable store.
 */
public final class LedgerRecord implements Serializable {
    private static final long serialVersionUID = 1L;

    private final String value;
    private final Instant timestamp;

    public LedgerRecord(String value, Instant timestamp) {
        this.value = Objects.requireNonNull(value, "value");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
    }

    public String getValue() {
        return value;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LedgerRecord that)) return false;
        return value.equals(that.value) && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, timestamp);
    }

    @Override
    public String toString() {
        return "LedgerRecord{value='" + value + "', timestamp=" + timestamp + "}";
    }
}
