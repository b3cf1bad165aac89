package io.github.lukaszsamson.spark.pushsource;

/**
 * A transient failure of the durable store. The operation may be retried;
 * ledger state is not affected by it.
 */
public class StoreException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final long offset;

    public StoreException(String message, long offset, Throwable cause) {
        super(message, cause);
        this.offset = offset;
    }

    /** The offset whose store access failed. */
    public long getOffset() {
        return offset;
    }
}
