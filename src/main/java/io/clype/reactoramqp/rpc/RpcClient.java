package io.clype.reactoramqp.rpc;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

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
import io.clype.reactoramqp.model.Publish;
import io.clype.reactoramqp.model.QueueParameters;
import io.clype.reactoramqp.model.RpcResponse;

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

/**
 * Sends requests and collects a known number of replies per request, matched by correlation id.
 *
 * <p>On every (re)connection the client declares a broker-named, exclusive reply queue and
 * consumes it with manual acknowledgment. Each {@link #request(List, int)} publishes its batch
 * with a fresh correlation id and that reply queue as reply-to; once the expected number of
 * replies has arrived, in any order, the returned Mono emits them in arrival order.</p>
 *
 * <p><b>Limitations:</b> a reconnect discards every pending request (the old reply queue is
 * gone with the old channel), and a request whose replies never arrive is never signalled.
 * Callers must apply their own timeout, e.g. {@code client.request(batch, 2).timeout(...)}.</p>
 *
 * <p>Replies with an unknown correlation id are acked, logged and dropped.</p>
 */
public class RpcClient implements ChannelInitializer, DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(RpcClient.class);

    private static final QueueParameters REPLY_QUEUE = new QueueParameters("", false, false, true, true, Map.of());

    private final ChannelOwner owner;
    private final AmqpClientMetrics metrics;

    // Worker-confined
    private final Map<String, RpcResult> correlationMap = new HashMap<>();
    private String replyQueue;
    private long counter;

    /**
     * Creates a client with the default reconnect interval, its own scheduler and no metrics.
     */
    public RpcClient(String name, ChannelProvider channelProvider, ChannelParameters channelParameters) {
        this(name, channelProvider, channelParameters, ChannelOwner.DEFAULT_RECONNECT_INTERVAL, null, null);
    }

    /**
     * Creates a client with full configuration.
     *
     * @param name              owner name used in logs and metrics
     * @param channelProvider   where channels come from
     * @param channelParameters QoS applied to every new channel (may be null)
     * @param reconnectInterval interval between channel requests while disconnected
     * @param scheduler         scheduler for the owner's worker (null for a dedicated one)
     * @param metrics           optional metrics collector (may be null)
     */
    public RpcClient(String name, ChannelProvider channelProvider, ChannelParameters channelParameters,
                     Duration reconnectInterval, Scheduler scheduler, AmqpClientMetrics metrics) {
        this.metrics = metrics;
        this.owner = new ChannelOwner(name, channelProvider, channelParameters, this,
                reconnectInterval, scheduler, metrics);
    }

    @Override
    public void onChannel(Channel channel) throws IOException {
        replyQueue = Topology.declareQueue(channel, REPLY_QUEUE).getQueue();
        channel.basicConsume(replyQueue, false, new ForwardingConsumer(channel, owner, this::onReply));
        if (!correlationMap.isEmpty()) {
            log.warn("RPC client '{}' discarding {} pending requests after reconnect",
                    owner.getName(), correlationMap.size());
        }
        correlationMap.clear();
        log.debug("RPC client '{}' listening for replies on {}", owner.getName(), replyQueue);
    }

    /**
     * Sends a single message and waits for one reply.
     */
    public Mono<RpcResponse> request(Publish publish) {
        Objects.requireNonNull(publish, "publish cannot be null");
        return request(List.of(publish), 1);
    }

    /**
     * Publishes every message of {@code publishes} under one new correlation id.
     *
     * <p>The request is sent when this method is called, not on subscription.</p>
     *
     * @param publishes         messages to send, all tagged with the same correlation id
     * @param expectedResponses number of replies that complete the request
     * @return a Mono emitting the replies in arrival order once {@code expectedResponses} have
     *         arrived, or erroring with {@link io.clype.reactoramqp.model.ChannelNotConnectedException}
     *         if the client holds no channel; it never completes if the replies are lost
     * @throws IllegalArgumentException if publishes is empty or expectedResponses is not positive
     */
    public Mono<RpcResponse> request(List<Publish> publishes, int expectedResponses) {
        Objects.requireNonNull(publishes, "publishes cannot be null");
        if (publishes.isEmpty()) {
            throw new IllegalArgumentException("publishes must not be empty");
        }
        if (expectedResponses <= 0) {
            throw new IllegalArgumentException("expectedResponses must be positive");
        }
        List<Publish> batch = List.copyOf(publishes);
        Sinks.One<RpcResponse> response = Sinks.one();
        owner.execute("send request", channel -> {
            counter++;
            String correlationId = Long.toString(counter);
            AMQP.BasicProperties props = new AMQP.BasicProperties.Builder()
                    .correlationId(correlationId)
                    .replyTo(replyQueue)
                    .build();
            for (Publish p : batch) {
                channel.basicPublish(p.exchange(), p.routingKey(), p.mandatory(), p.immediate(), props, p.body());
            }
            correlationMap.put(correlationId, new RpcResult(response, expectedResponses, new ArrayList<>()));
            if (metrics != null) {
                metrics.recordPublished(owner.getName(), batch.size());
                metrics.recordRpcRequest(owner.getName());
            }
            return null;
        }).subscribe(null, response::tryEmitError);
        return response.asMono();
    }

    private void onReply(Channel channel, Delivery delivery) throws IOException {
        channel.basicAck(delivery.deliveryTag(), false);
        String correlationId = delivery.correlationId();
        RpcResult result = correlationId != null ? correlationMap.get(correlationId) : null;
        if (result == null) {
            log.warn("RPC client '{}' got unexpected message with correlation id {}",
                    owner.getName(), correlationId);
            if (metrics != null) {
                metrics.recordUnmatchedReply(owner.getName());
            }
            return;
        }
        result.buffers().add(delivery.body());
        if (result.buffers().size() == result.expected()) {
            correlationMap.remove(correlationId);
            result.destination().tryEmitValue(new RpcResponse(correlationId, result.buffers()));
            if (metrics != null) {
                metrics.recordRpcResponse(owner.getName());
            }
        }
    }

    /**
     * Starts asking for a channel. Requests fail until the reply queue is in place.
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
     * The underlying owner, e.g. to watch {@link ChannelOwner#returnedMessages()}.
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

    int pendingRequests() {
        return correlationMap.size();
    }

    OptionalInt bufferedReplies(String correlationId) {
        RpcResult result = correlationMap.get(correlationId);
        return result == null ? OptionalInt.empty() : OptionalInt.of(result.buffers().size());
    }

    String replyQueue() {
        return replyQueue;
    }

    /**
     * Replies gathered so far for one outstanding request.
     */
    private record RpcResult(Sinks.One<RpcResponse> destination, int expected, List<byte[]> buffers) {}
}
