package io.github.lukaszsamson.spark.pushsource;

import java.util.Locale;

/**
 * Backend for the durable store of consumed records.
 */
public enum PersistenceMode {
    /** Files in a local directory; survives restarts. */
    FILE,
    /** Heap only; recovery on restart is not supported. */
    MEMORY;

    public static PersistenceMode fromString(String value) {
        try {
            return valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Invalid persistence value: '" + value +
                            "'. Must be one of: file, memory");
        }
    }
}
