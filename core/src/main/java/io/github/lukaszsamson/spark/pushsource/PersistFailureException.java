package io.github.lukaszsamson.spark.pushsource;

/**
 * Writing a record to the durable store failed. The record is still held by
 * the ledger buffer, so the read that hit this can simply be retried.
 */
public class PersistFailureException extends StoreException {
    private static final long serialVersionUID = 1L;

    public PersistFailureException(long offset, Throwable cause) {
        super("Failed to persist record at offset " + offset, offset, cause);
    }
}
