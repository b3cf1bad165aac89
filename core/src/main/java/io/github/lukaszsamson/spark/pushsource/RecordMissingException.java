package io.github.lukaszsamson.spark.pushsource;

/**
 * An offset inside the ledger's known range is neither buffered nor
 * persisted. Offset accounting no longer matches storage; the read is
 * aborted rather than returning a batch with a gap.
 */
public class RecordMissingException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    private final long offset;

    public RecordMissingException(long offset, Throwable cause) {
        super("Record at offset " + offset + " is missing from both the buffer and the " +
                "durable store", cause);
        this.offset = offset;
    }

    public long getOffset() {
        return offset;
    }
}
