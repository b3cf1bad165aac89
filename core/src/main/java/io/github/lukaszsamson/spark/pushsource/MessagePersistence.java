package io.github.lukaszsamson.spark.pushsource;

import java.io.Closeable;
import java.io.IOException;
import java.util.Set;

/**
 * Crash-durable key-value storage used by {@link LocalMessageStore}.
 *
 * <p>Implementations must be safe for concurrent use once opened.
 * {@link #open()} is idempotent.
 */
public interface MessagePersistence extends Closeable {

    void open() throws IOException;

    /** Stores {@code value} under {@code key}, replacing any previous value. */
    void put(String key, byte[] value) throws IOException;

    /** Returns the value stored under {@code key}, or {@code null} if there is none. */
    byte[] get(String key) throws IOException;

    /** Returns a snapshot of the stored keys. */
    Set<String> keys() throws IOException;
}
