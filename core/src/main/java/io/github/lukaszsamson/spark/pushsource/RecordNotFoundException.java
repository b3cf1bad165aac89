package io.github.lukaszsamson.spark.pushsource;

/**
 * No record was ever persisted at the requested offset.
 */
public class RecordNotFoundException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final long offset;

    public RecordNotFoundException(long offset) {
        super("No record persisted at offset " + offset);
        this.offset = offset;
    }

    public long getOffset() {
        return offset;
    }
}
