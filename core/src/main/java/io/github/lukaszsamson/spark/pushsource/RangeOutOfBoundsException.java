package io.github.lukaszsamson.spark.pushsource;

/**
 * A batch read asked for offsets outside {@code [0, currentOffset]} or with
 * an end before its start. This is a caller error.
 */
public class RangeOutOfBoundsException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final long startExclusive;
    private final long endInclusive;
    private final long currentOffset;

    public RangeOutOfBoundsException(long startExclusive, long endInclusive, long currentOffset) {
        super("Invalid read range (" + startExclusive + ", " + endInclusive +
                "]; current offset is " + currentOffset);
        this.startExclusive = startExclusive;
        this.endInclusive = endInclusive;
        this.currentOffset = currentOffset;
    }

    public long getStartExclusive() {
        return startExclusive;
    }

    public long getEndInclusive() {
        return endInclusive;
    }

    public long getCurrentOffset() {
        return currentOffset;
    }
}
