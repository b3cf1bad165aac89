package io.github.lukaszsamson.spark.pushsource;

import java.io.Closeable;

/**
 * A push-based subscription delivering message payloads at least once.
 */
public interface MessageTransport extends Closeable {

    /**
     * Start delivering payloads to {@code handler}. Delivery may begin before
     * this method returns.
     */
    void subscribe(ArrivalHandler handler);

    /** Disconnect. Idempotent. */
    @Override
    void close();
}
