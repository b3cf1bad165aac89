package io.github.lukaszsamson.spark.pushsource;

import java.util.Locale;

/**
 * Where the transport subscription starts in the broker stream.
 */
public enum SubscriptionOffsetMode {
    /** Only messages published after the subscription is created. */
    NEXT,
    /** Every message still retained by the stream. */
    FIRST,
    /** Starting from the last chunk of the stream. */
    LAST;

    public static SubscriptionOffsetMode fromString(String value) {
        try {
            return valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Invalid subscriptionOffset value: '" + value +
                            "'. Must be one of: next, first, last");
        }
    }
}
