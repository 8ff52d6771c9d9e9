package io.clype.reactoramqp.rpc;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;

import io.clype.reactoramqp.channel.ChannelInitializer;
import io.clype.reactoramqp.channel.ChannelOwner;
import io.clype.reactoramqp.channel.ChannelProvider;
import io.clype.reactoramqp.channel.ForwardingConsumer;
import io.clype.reactoramqp.channel.Topology;
import io.clype.reactoramqp.metrics.AmqpClientMetrics;
import io.clype.reactoramqp.model.ChannelParameters;
import io.clype.reactoramqp.model.ConnectionState;
import io.clype.reactoramqp.model.Delivery;
import io.clype.reactoramqp.model.ExchangeParameters;
import io.clype.reactoramqp.model.QueueParameters;

import reactor.core.scheduler.Scheduler;

/**
 * Serves requests from one queue through an {@link RpcProcessor}.
 *
 * <p>On every (re)connection the queue and exchange are declared, bound with the routing key,
 * and consumed with manual acknowledgment.</p>
 *
 * <p><b>Failure policy:</b> each request is attempted at most twice.</p>
 * <ul>
 *   <li>Success: the result is published to the request's reply-to queue (if any) with the
 *       request's correlation id, then the request is acked.</li>
 *   <li>First failure (not redelivered): the request is rejected with requeue so that any
 *       server on the queue can try again. No reply yet.</li>
 *   <li>Failure of a redelivered request: the {@link RpcProcessor#onFailure(Exception)} payload
 *       is published as the reply and the request is acked, retiring it.</li>
 * </ul>
 */
public class RpcServer implements ChannelInitializer, DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(RpcServer.class);

    private final QueueParameters queue;
    private final ExchangeParameters exchange;
    private final String routingKey;
    private final RpcProcessor processor;
    private final AmqpClientMetrics metrics;
    private final ChannelOwner owner;

    /**
     * Creates a server with the default reconnect interval, its own scheduler and no metrics.
     */
    public RpcServer(String name, ChannelProvider channelProvider, QueueParameters queue,
                     ExchangeParameters exchange, String routingKey, RpcProcessor processor,
                     ChannelParameters channelParameters) {
        this(name, channelProvider, queue, exchange, routingKey, processor, channelParameters,
                ChannelOwner.DEFAULT_RECONNECT_INTERVAL, null, null);
    }

    /**
     * Creates a server with full configuration.
     *
     * @param name              owner name used in logs and metrics
     * @param channelProvider   where channels come from
     * @param queue             request queue, declared on every connection
     * @param exchange          exchange the queue is bound to
     * @param routingKey        binding key
     * @param processor         business logic producing reply bodies
     * @param channelParameters QoS applied to every new channel (may be null)
     * @param reconnectInterval interval between channel requests while disconnected
     * @param scheduler         scheduler for the owner's worker (null for a dedicated one)
     * @param metrics           optional metrics collector (may be null)
     */
    public RpcServer(String name, ChannelProvider channelProvider, QueueParameters queue,
                     ExchangeParameters exchange, String routingKey, RpcProcessor processor,
                     ChannelParameters channelParameters, Duration reconnectInterval,
                     Scheduler scheduler, AmqpClientMetrics metrics) {
        this.queue = Objects.requireNonNull(queue, "queue cannot be null");
        this.exchange = Objects.requireNonNull(exchange, "exchange cannot be null");
        this.routingKey = Objects.requireNonNull(routingKey, "routingKey cannot be null");
        this.processor = Objects.requireNonNull(processor, "processor cannot be null");
        this.metrics = metrics;
        this.owner = new ChannelOwner(name, channelProvider, channelParameters, this,
                reconnectInterval, scheduler, metrics);
    }

    @Override
    public void onChannel(Channel channel) throws IOException {
        String queueName = Topology.declareQueue(channel, queue).getQueue();
        Topology.declareExchange(channel, exchange);
        channel.queueBind(queueName, exchange.name(), routingKey);
        channel.basicConsume(queueName, false, new ForwardingConsumer(channel, owner, this::handle));
        log.debug("RPC server '{}' consuming {} bound to {} with key '{}'",
                owner.getName(), queueName, exchange.name(), routingKey);
    }

    private void handle(Channel channel, Delivery delivery) throws IOException {
        log.debug("RPC server '{}' processing delivery {}", owner.getName(), delivery.deliveryTag());
        byte[] result;
        try {
            result = processor.process(delivery.body());
        } catch (Exception e) {
            handleFailure(channel, delivery, e);
            return;
        }
        reply(channel, delivery, result);
        channel.basicAck(delivery.deliveryTag(), false);
        recordOutcome("success");
    }

    private void handleFailure(Channel channel, Delivery delivery, Exception e) throws IOException {
        if (delivery.redelivered()) {
            log.error("RPC server '{}' failed to process delivery {} twice, returning error payload: {}",
                    owner.getName(), delivery.deliveryTag(), e.toString());
            reply(channel, delivery, processor.onFailure(e));
            channel.basicAck(delivery.deliveryTag(), false);
            recordOutcome("failed");
        } else {
            log.warn("RPC server '{}' failed to process delivery {}, requeueing: {}",
                    owner.getName(), delivery.deliveryTag(), e.toString());
            channel.basicReject(delivery.deliveryTag(), true);
            recordOutcome("requeued");
        }
    }

    private void reply(Channel channel, Delivery delivery, byte[] body) throws IOException {
        String replyTo = delivery.replyTo();
        if (replyTo == null) {
            return;
        }
        AMQP.BasicProperties props = new AMQP.BasicProperties.Builder()
                .correlationId(delivery.correlationId())
                .build();
        channel.basicPublish("", replyTo, true, false, props, body);
        if (metrics != null) {
            metrics.recordPublished(owner.getName(), 1);
        }
    }

    private void recordOutcome(String outcome) {
        if (metrics != null) {
            metrics.recordServerOutcome(owner.getName(), outcome);
        }
    }

    /**
     * Starts asking for a channel. Consumption begins once one arrives.
     */
    public void start() {
        owner.start();
    }

    /**
     * Returns the state of the underlying channel owner.
     */
    public ConnectionState state() {
        return owner.state();
    }

    /**
     * The underlying owner.
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
