package io.clype.reactoramqp.consumer;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;

import com.rabbitmq.client.Channel;

import io.clype.reactoramqp.channel.ChannelInitializer;
import io.clype.reactoramqp.channel.ChannelOwner;
import io.clype.reactoramqp.channel.ChannelProvider;
import io.clype.reactoramqp.channel.ForwardingConsumer;
import io.clype.reactoramqp.channel.Topology;
import io.clype.reactoramqp.metrics.AmqpClientMetrics;
import io.clype.reactoramqp.model.Binding;
import io.clype.reactoramqp.model.ChannelParameters;
import io.clype.reactoramqp.model.ConnectionState;
import io.clype.reactoramqp.model.Delivery;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * Consumes a fixed list of bindings and forwards every delivery to a {@link DeliveryListener}.
 *
 * <p>On every (re)connection each binding is replayed in list order: declare its queue,
 * declare its exchange, bind the effective queue name to the exchange with the routing key,
 * then start consuming with the binding's auto-ack setting.</p>
 *
 * <p>The consumer has no business logic and never acknowledges on its own; listeners of
 * manual-ack bindings settle deliveries with {@link #ack(long)} and {@link #reject(long, boolean)}.</p>
 */
public class AmqpConsumer implements ChannelInitializer, DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(AmqpConsumer.class);

    private final List<Binding> bindings;
    private final DeliveryListener listener;
    private final ChannelOwner owner;

    /**
     * Creates a consumer with the default reconnect interval, its own scheduler and no metrics.
     */
    public AmqpConsumer(String name, ChannelProvider channelProvider, List<Binding> bindings,
                        DeliveryListener listener, ChannelParameters channelParameters) {
        this(name, channelProvider, bindings, listener, channelParameters,
                ChannelOwner.DEFAULT_RECONNECT_INTERVAL, null, null);
    }

    /**
     * Creates a consumer with full configuration.
     *
     * @param name              owner name used in logs and metrics
     * @param channelProvider   where channels come from
     * @param bindings          bindings to set up on every connection, in order
     * @param listener          receives every delivery
     * @param channelParameters QoS applied to every new channel (may be null)
     * @param reconnectInterval interval between channel requests while disconnected
     * @param scheduler         scheduler for the owner's worker (null for a dedicated one)
     * @param metrics           optional metrics collector (may be null)
     */
    public AmqpConsumer(String name, ChannelProvider channelProvider, List<Binding> bindings,
                        DeliveryListener listener, ChannelParameters channelParameters,
                        Duration reconnectInterval, Scheduler scheduler, AmqpClientMetrics metrics) {
        this.bindings = List.copyOf(Objects.requireNonNull(bindings, "bindings cannot be null"));
        this.listener = Objects.requireNonNull(listener, "listener cannot be null");
        this.owner = new ChannelOwner(name, channelProvider, channelParameters, this,
                reconnectInterval, scheduler, metrics);
    }

    @Override
    public void onChannel(Channel channel) throws IOException {
        ForwardingConsumer consumer = new ForwardingConsumer(channel, owner, this::forward);
        for (Binding binding : bindings) {
            String queueName = Topology.declareQueue(channel, binding.queue()).getQueue();
            Topology.declareExchange(channel, binding.exchange());
            channel.queueBind(queueName, binding.exchange().name(), binding.routingKey());
            String consumerTag = channel.basicConsume(queueName, binding.autoAck(), consumer);
            log.debug("Consumer '{}' bound {} to {} with key '{}' (tag {})", owner.getName(),
                    queueName, binding.exchange().name(), binding.routingKey(), consumerTag);
        }
    }

    private void forward(Channel channel, Delivery delivery) {
        listener.onDelivery(delivery);
    }

    /**
     * Starts asking for a channel. Bindings are set up once one arrives.
     */
    public void start() {
        owner.start();
    }

    /**
     * Acknowledges a delivery from a manual-ack binding.
     */
    public Mono<Void> ack(long deliveryTag) {
        return owner.ack(deliveryTag);
    }

    /**
     * Rejects a delivery from a manual-ack binding.
     */
    public Mono<Void> reject(long deliveryTag, boolean requeue) {
        return owner.reject(deliveryTag, requeue);
    }

    /**
     * Returns the state of the underlying channel owner.
     */
    public ConnectionState state() {
        return owner.state();
    }

    /**
     * The underlying owner, for publishing or declaring from the same channel.
     */
    public ChannelOwner channelOwner() {
        return owner;
    }

    /**
     * Stops the underlying owner and closes its channel.
     */
    @Override
    public void destroy() {
        owner.destroy();
    }
}
