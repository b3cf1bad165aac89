package io.github.lukaszsamson.spark.pushsource;

import com.rabbitmq.stream.Consumer;
import com.rabbitmq.stream.ConsumerBuilder;
import com.rabbitmq.stream.Environment;
import com.rabbitmq.stream.OffsetSpecification;
import com.rabbitmq.stream.Resource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Function;

/**
 * {@link MessageTransport} over a RabbitMQ stream consumer.
 *
 * <p>The client library pushes each message to the handler from its own
 * dispatching threads. A handler that throws for a message, typically because
 * the payload cannot be parsed, loses that message only: the failure is logged
 * and delivery continues.
 */
public final class RabbitMQSubscription implements MessageTransport {

    private static final Logger LOG = LoggerFactory.getLogger(RabbitMQSubscription.class);

    private final ConnectorOptions options;
    private final Function<ConnectorOptions, Environment> environmentFactory;

    private final Object lifecycleLock = new Object();
    private Environment environment;
    private Consumer consumer;
    private boolean closed;

    public RabbitMQSubscription(ConnectorOptions options) {
        this(options, EnvironmentBuilderHelper::buildEnvironment);
    }

    RabbitMQSubscription(ConnectorOptions options,
                         Function<ConnectorOptions, Environment> environmentFactory) {
        this.options = Objects.requireNonNull(options, "options");
        this.environmentFactory = Objects.requireNonNull(environmentFactory, "environmentFactory");
    }

    @Override
    public void subscribe(ArrivalHandler handler) {
        Objects.requireNonNull(handler, "handler");
        synchronized (lifecycleLock) {
            if (closed) {
                throw new IllegalStateException("Subscription to stream '" +
                        options.getStream() + "' has been closed");
            }
            if (consumer != null) {
                throw new IllegalStateException("Already subscribed to stream '" +
                        options.getStream() + "'");
            }
            String stream = options.getStream();
            environment = environmentFactory.apply(options);
            try {
                ConsumerBuilder builder = environment.consumerBuilder()
                        .stream(stream)
                        .offset(toOffsetSpecification(options.getSubscriptionOffset()))
                        .noTrackingStrategy()
                        .messageHandler((context, message) ->
                                deliver(handler, stream, context.offset(),
                                        message.getBodyAsBinary()));
                builder.listeners(context -> {
                    Resource.State from = context.previousState();
                    Resource.State to = context.currentState();
                    if (to == Resource.State.RECOVERING) {
                        LOG.warn("Consumer for stream '{}' is recovering ({}->{})",
                                stream, from, to);
                    } else if (to == Resource.State.CLOSED) {
                        LOG.warn("Consumer for stream '{}' has closed ({}->{})",
                                stream, from, to);
                    } else {
                        LOG.debug("Consumer for stream '{}' state change: {}->{}",
                                stream, from, to);
                    }
                });
                consumer = builder.build();
            } catch (RuntimeException e) {
                closeEnvironment();
                throw e;
            }
            LOG.info("Subscribed to stream '{}' starting at {}", stream,
                    options.getSubscriptionOffset());
        }
    }

    /** Hand one payload to the ledger; a failing message is logged and dropped. */
    static void deliver(ArrivalHandler handler, String stream, long brokerOffset, byte[] payload) {
        try {
            handler.onArrival(payload);
        } catch (RuntimeException e) {
            LOG.warn("Dropping message at broker offset {} of stream '{}': {}",
                    brokerOffset, stream, e.toString(), e);
        }
    }

    static OffsetSpecification toOffsetSpecification(SubscriptionOffsetMode mode) {
        return switch (mode) {
            case FIRST -> OffsetSpecification.first();
            case LAST -> OffsetSpecification.last();
            case NEXT -> OffsetSpecification.next();
        };
    }

    @Override
    public void close() {
        synchronized (lifecycleLock) {
            if (closed) {
                return;
            }
            closed = true;
            if (consumer != null) {
                try {
                    consumer.close();
                } catch (RuntimeException e) {
                    LOG.warn("Error closing consumer for stream '{}'", options.getStream(), e);
                }
                consumer = null;
            }
            closeEnvironment();
        }
    }

    private void closeEnvironment() {
        if (environment != null) {
            try {
                environment.close();
            } catch (RuntimeException e) {
                LOG.warn("Error closing environment for stream '{}'", options.getStream(), e);
            }
            environment = null;
        }
    }
}
