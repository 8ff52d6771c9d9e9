package io.clype.reactoramqp.metrics;

import java.util.concurrent.atomic.AtomicInteger;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Collects and exposes metrics for channel owners and their RPC specializations.
 *
 * <p><b>Available Metrics:</b></p>
 * <ul>
 *   <li>{@code amqp.client.channels.acquired} - Channels successfully initialized</li>
 *   <li>{@code amqp.client.channels.lost} - Shutdown notifications for an owned channel</li>
 *   <li>{@code amqp.client.channels.connected} - Gauge of owners currently connected</li>
 *   <li>{@code amqp.client.messages.published} - Messages handed to the broker</li>
 *   <li>{@code amqp.client.messages.returned} - Mandatory/immediate publishes returned by the broker</li>
 *   <li>{@code amqp.client.deliveries.received} - Deliveries handled on an owner's worker</li>
 *   <li>{@code amqp.client.commands.rejected} - Commands refused because no channel was held</li>
 *   <li>{@code amqp.client.rpc.requests} - RPC requests issued</li>
 *   <li>{@code amqp.client.rpc.responses} - RPC responses completed</li>
 *   <li>{@code amqp.client.rpc.replies.unmatched} - Replies with an unknown correlation id</li>
 *   <li>{@code amqp.client.rpc.server.processed} - Server deliveries by {@code outcome}</li>
 * </ul>
 *
 * <p>Every counter is tagged with the {@code owner} name so several owners can share
 * one registry.</p>
 */
public class AmqpClientMetrics {

    private static final String METRIC_PREFIX = "amqp.client";

    private final MeterRegistry registry;
    private final AtomicInteger connectedOwners;

    /**
     * Creates a new AmqpClientMetrics instance.
     *
     * @param registry the Micrometer registry to register metrics with
     */
    public AmqpClientMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.connectedOwners = new AtomicInteger(0);
        Gauge.builder(METRIC_PREFIX + ".channels.connected", connectedOwners, AtomicInteger::get)
                .description("Number of channel owners currently holding an open channel")
                .register(registry);
    }

    /**
     * Records an owner entering the connected state.
     */
    public void recordChannelAcquired(String owner) {
        increment("channels.acquired", owner);
        connectedOwners.incrementAndGet();
    }

    /**
     * Records an owner losing its channel.
     */
    public void recordChannelLost(String owner) {
        increment("channels.lost", owner);
        connectedOwners.decrementAndGet();
    }

    /**
     * Records an owner leaving the connected state through termination rather than loss.
     */
    public void recordChannelClosed(String owner) {
        connectedOwners.decrementAndGet();
    }

    /**
     * Records messages handed to the broker.
     *
     * @param owner owner name
     * @param count number of messages
     */
    public void recordPublished(String owner, int count) {
        registry.counter(METRIC_PREFIX + ".messages.published", "owner", owner).increment(count);
    }

    /**
     * Records a message returned by the broker.
     */
    public void recordReturned(String owner) {
        increment("messages.returned", owner);
    }

    /**
     * Records a delivery handled on an owner's worker.
     */
    public void recordDelivery(String owner) {
        increment("deliveries.received", owner);
    }

    /**
     * Records a command refused while disconnected.
     */
    public void recordCommandRejected(String owner) {
        increment("commands.rejected", owner);
    }

    /**
     * Records an RPC request sent.
     */
    public void recordRpcRequest(String owner) {
        increment("rpc.requests", owner);
    }

    /**
     * Records an RPC request completed with all its replies.
     */
    public void recordRpcResponse(String owner) {
        increment("rpc.responses", owner);
    }

    /**
     * Records a reply whose correlation id matched no pending request.
     */
    public void recordUnmatchedReply(String owner) {
        increment("rpc.replies.unmatched", owner);
    }

    /**
     * Records how the RPC server disposed of one delivery.
     *
     * @param owner   server name
     * @param outcome {@code success}, {@code requeued} or {@code failed}
     */
    public void recordServerOutcome(String owner, String outcome) {
        registry.counter(METRIC_PREFIX + ".rpc.server.processed", "owner", owner, "outcome", outcome).increment();
    }

    private void increment(String name, String owner) {
        registry.counter(METRIC_PREFIX + "." + name, "owner", owner).increment();
    }
}
