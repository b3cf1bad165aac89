package io.github.lukaszsamson.spark.pushsource;

import java.io.Serializable;

/**
 * Turns a raw message payload into a {@link LedgerRecord}.
 *
 * <p>Custom implementations are configured with the {@code messageParserClass}
 * option and must have a public no-arg constructor. A parser may throw any
 * runtime exception for a payload it cannot handle; that message is then
 * dropped by the transport.
 */
@FunctionalInterface
public interface MessageParser extends Serializable {

    LedgerRecord parse(byte[] payload);
}
