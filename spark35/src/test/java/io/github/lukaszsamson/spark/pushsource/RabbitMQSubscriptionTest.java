package io.github.lukaszsamson.spark.pushsource;

import com.rabbitmq.stream.Consumer;
import com.rabbitmq.stream.ConsumerBuilder;
import com.rabbitmq.stream.Environment;
import com.rabbitmq.stream.Message;
import com.rabbitmq.stream.MessageHandler;
import com.rabbitmq.stream.OffsetSpecification;
import com.rabbitmq.stream.Resource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link RabbitMQSubscription} against a mocked stream client.
 */
class RabbitMQSubscriptionTest {

    private Environment environment;
    private ConsumerBuilder builder;
    private Consumer consumer;

    @BeforeEach
    void setUp() {
        environment = mock(Environment.class);
        builder = mock(ConsumerBuilder.class, RETURNS_SELF);
        consumer = mock(Consumer.class);
        when(environment.consumerBuilder()).thenReturn(builder);
        when(builder.build()).thenReturn(consumer);
    }

    private static ConnectorOptions options(String subscriptionOffset) {
        Map<String, String> opts = new HashMap<>();
        opts.put("stream", "sensor-readings");
        opts.put("endpoints", "localhost:5552");
        if (subscriptionOffset != null) {
            opts.put("subscriptionOffset", subscriptionOffset);
        }
        return new ConnectorOptions(opts);
    }

    private RabbitMQSubscription subscription(ConnectorOptions options) {
        return new RabbitMQSubscription(options, o -> environment);
    }

    private MessageHandler capturedHandler() {
        ArgumentCaptor<MessageHandler> captor = ArgumentCaptor.forClass(MessageHandler.class);
        verify(builder).messageHandler(captor.capture());
        return captor.getValue();
    }

    private static Message message(String body) {
        Message message = mock(Message.class);
        when(message.getBodyAsBinary()).thenReturn(body.getBytes(StandardCharsets.UTF_8));
        return message;
    }

    @Nested
    class Subscribe {

        @Test
        void buildsNonTrackingConsumerOnTheStream() {
            subscription(options(null)).subscribe(payload -> { });

            verify(builder).stream("sensor-readings");
            verify(builder).offset(OffsetSpecification.next());
            verify(builder).noTrackingStrategy();
            verify(builder).build();
        }

        @Test
        void honoursSubscriptionOffset() {
            subscription(options("first")).subscribe(payload -> { });

            verify(builder).offset(OffsetSpecification.first());
        }

        @Test
        void forwardsMessageBodiesToTheHandler() {
            List<String> received = new ArrayList<>();
            subscription(options(null)).subscribe(
                    payload -> received.add(new String(payload, StandardCharsets.UTF_8)));

            MessageHandler handler = capturedHandler();
            handler.handle(mock(MessageHandler.Context.class), message("21.5"));
            handler.handle(mock(MessageHandler.Context.class), message("21.7"));

            assertThat(received).containsExactly("21.5", "21.7");
        }

        @Test
        void failingHandlerDropsOnlyThatMessage() {
            List<String> received = new ArrayList<>();
            subscription(options(null)).subscribe(payload -> {
                String text = new String(payload, StandardCharsets.UTF_8);
                if (text.isEmpty()) {
                    throw new IllegalArgumentException("unparseable");
                }
                received.add(text);
            });

            MessageHandler handler = capturedHandler();
            assertThatCode(() -> handler.handle(mock(MessageHandler.Context.class), message("")))
                    .doesNotThrowAnyException();
            handler.handle(mock(MessageHandler.Context.class), message("ok"));

            assertThat(received).containsExactly("ok");
        }

        @Test
        void stateListenerToleratesTransitions() {
            subscription(options(null)).subscribe(payload -> { });

            ArgumentCaptor<Resource.StateListener> captor =
                    ArgumentCaptor.forClass(Resource.StateListener.class);
            verify(builder).listeners(captor.capture());
            Resource.Context context = mock(Resource.Context.class);
            when(context.previousState()).thenReturn(Resource.State.OPEN);
            when(context.currentState()).thenReturn(Resource.State.RECOVERING);

            assertThatCode(() -> captor.getValue().handle(context)).doesNotThrowAnyException();
        }

        @Test
        void subscribingTwiceIsRejected() {
            RabbitMQSubscription subscription = subscription(options(null));
            subscription.subscribe(payload -> { });

            assertThatThrownBy(() -> subscription.subscribe(payload -> { }))
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        void consumerCreationFailureClosesTheEnvironment() {
            when(builder.build()).thenThrow(new IllegalStateException("stream does not exist"));

            assertThatThrownBy(() -> subscription(options(null)).subscribe(payload -> { }))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("stream does not exist");
            verify(environment).close();
        }
    }

    @Nested
    class Close {

        @Test
        void closesConsumerThenEnvironmentOnce() {
            RabbitMQSubscription subscription = subscription(options(null));
            subscription.subscribe(payload -> { });

            subscription.close();
            subscription.close();

            InOrder order = inOrder(consumer, environment);
            order.verify(consumer).close();
            order.verify(environment).close();
            verify(consumer, times(1)).close();
            verify(environment, times(1)).close();
        }

        @Test
        void closeBeforeSubscribeIsHarmless() {
            RabbitMQSubscription subscription = subscription(options(null));

            assertThatCode(subscription::close).doesNotThrowAnyException();
            assertThatThrownBy(() -> subscription.subscribe(payload -> { }))
                    .isInstanceOf(IllegalStateException.class);
            verify(environment, never()).consumerBuilder();
        }

        @Test
        void consumerCloseFailureStillClosesEnvironment() {
            doThrow(new IllegalStateException("already closed")).when(consumer).close();
            RabbitMQSubscription subscription = subscription(options(null));
            subscription.subscribe(payload -> { });

            assertThatCode(subscription::close).doesNotThrowAnyException();
            verify(environment).close();
        }
    }

    @Test
    void mapsEverySubscriptionOffsetMode() {
        assertThat(RabbitMQSubscription.toOffsetSpecification(SubscriptionOffsetMode.FIRST))
                .isEqualTo(OffsetSpecification.first());
        assertThat(RabbitMQSubscription.toOffsetSpecification(SubscriptionOffsetMode.LAST))
                .isEqualTo(OffsetSpecification.last());
        assertThat(RabbitMQSubscription.toOffsetSpecification(SubscriptionOffsetMode.NEXT))
                .isEqualTo(OffsetSpecification.next());
    }

    @Test
    void deliverSwallowsHandlerFailures() {
        assertThatCode(() -> RabbitMQSubscription.deliver(payload -> {
            throw new IllegalArgumentException("bad");
        }, "s", 3L, new byte[0])).doesNotThrowAnyException();
    }
}
