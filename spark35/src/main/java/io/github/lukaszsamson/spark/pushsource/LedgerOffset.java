package io.github.lukaszsamson.spark.pushsource;

import org.apache.spark.sql.connector.read.streaming.Offset;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Spark {@link Offset} holding a ledger offset: the highest offset included
 * in a batch. {@code 0} means "before the first record".
 *
 * <p>The JSON format is {@code {"offset":42}}. A bare number such as
 * {@code 42} is also accepted when deserializing.
 */
public final class LedgerOffset extends Offset {

    public static final LedgerOffset ZERO = new LedgerOffset(0L);

    private static final Pattern OBJECT_PATTERN =
            Pattern.compile("\\{\\s*\"offset\"\\s*:\\s*(\\d+)\\s*}");
    private static final Pattern NUMBER_PATTERN = Pattern.compile("\\d+");

    private final long offset;

    public LedgerOffset(long offset) {
        if (offset < 0) {
            throw new IllegalArgumentException("Ledger offset must be >= 0, got: " + offset);
        }
        this.offset = offset;
    }

    public long getOffset() {
        return offset;
    }

    @Override
    public String json() {
        return "{\"offset\":" + offset + "}";
    }

    /**
     * @throws IllegalArgumentException if the JSON is null, blank or malformed
     */
    public static LedgerOffset fromJson(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("Offset JSON must not be null or blank");
        }
        String trimmed = json.trim();
        try {
            Matcher matcher = OBJECT_PATTERN.matcher(trimmed);
            if (matcher.matches()) {
                return new LedgerOffset(Long.parseLong(matcher.group(1)));
            }
            if (NUMBER_PATTERN.matcher(trimmed).matches()) {
                return new LedgerOffset(Long.parseLong(trimmed));
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Offset out of range: " + json, e);
        }
        throw new IllegalArgumentException("Malformed offset JSON: " + json);
    }

    /** Converts an offset handed back by Spark; {@code null} maps to {@link #ZERO}. */
    static LedgerOffset of(Offset offset) {
        if (offset == null) {
            return ZERO;
        }
        if (offset instanceof LedgerOffset ledgerOffset) {
            return ledgerOffset;
        }
        return fromJson(offset.json());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LedgerOffset that)) return false;
        return offset == that.offset;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(offset);
    }

    @Override
    public String toString() {
        return "LedgerOffset" + json();
    }
}
