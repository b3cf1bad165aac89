package io.github.lukaszsamson.spark.pushsource;

import java.io.IOException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Heap-backed {@link MessagePersistence}. Nothing survives a restart, so a
 * source using it always recovers to offset 0.
 */
public final class InMemoryMessagePersistence implements MessagePersistence {

    private final ConcurrentHashMap<String, byte[]> entries = new ConcurrentHashMap<>();
    private volatile boolean closed;

    @Override
    public void open() {
        closed = false;
    }

    @Override
    public void put(String key, byte[] value) throws IOException {
        ensureOpen();
        entries.put(key, value.clone());
    }

    @Override
    public byte[] get(String key) throws IOException {
        ensureOpen();
        byte[] value = entries.get(key);
        return value != null ? value.clone() : null;
    }

    @Override
    public Set<String> keys() throws IOException {
        ensureOpen();
        return Set.copyOf(entries.keySet());
    }

    @Override
    public void close() {
        closed = true;
        entries.clear();
    }

    private void ensureOpen() throws IOException {
        if (closed) {
            throw new IOException("In-memory persistence is closed");
        }
    }
}
