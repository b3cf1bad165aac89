package io.github.lukaszsamson.spark.pushsource;

/**
 * Lifecycle of an {@link OffsetLedger}.
 */
public enum LedgerState {
    /** Constructed; arrivals suspend until recovery completes. */
    INITIALIZING,
    /** Recovered; arrivals are numbered and buffered. */
    READY,
    /** Torn down; no further operations are valid. */
    STOPPED
}
