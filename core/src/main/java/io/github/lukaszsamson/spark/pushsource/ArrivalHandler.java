package io.github.lukaszsamson.spark.pushsource;

/**
 * Callback a {@link MessageTransport} invokes for every delivered payload,
 * possibly from several threads at once.
 */
@FunctionalInterface
public interface ArrivalHandler {

    void onArrival(byte[] payload);
}
