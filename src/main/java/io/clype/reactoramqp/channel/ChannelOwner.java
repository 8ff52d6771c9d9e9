package io.clype.reactoramqp.channel;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Return;
import com.rabbitmq.client.ShutdownSignalException;

import io.clype.reactoramqp.metrics.AmqpClientMetrics;
import io.clype.reactoramqp.model.ChannelNotConnectedException;
import io.clype.reactoramqp.model.ChannelParameters;
import io.clype.reactoramqp.model.ConnectionState;
import io.clype.reactoramqp.model.Delivery;
import io.clype.reactoramqp.model.ExchangeParameters;
import io.clype.reactoramqp.model.Publish;
import io.clype.reactoramqp.model.QueueParameters;
import io.clype.reactoramqp.model.ReturnedMessage;
import io.clype.reactoramqp.model.Transaction;

import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Owns exactly one AMQP channel at a time and survives its loss.
 *
 * <p>The owner is a two-state machine:</p>
 * <ul>
 *   <li><b>Disconnected</b> (initial): a periodic tick asks the {@link ChannelProvider} for a
 *       channel every {@code reconnectInterval}. Commands are refused with
 *       {@link ChannelNotConnectedException}.</li>
 *   <li><b>Connected</b>: commands run directly against the owned channel. A shutdown
 *       notification for that channel moves the owner back to Disconnected and re-arms
 *       the tick.</li>
 * </ul>
 *
 * <p>When a channel arrives the owner applies the optional QoS, registers a return listener
 * that surfaces unroutable mandatory publishes through {@link #returnedMessages()}, and runs
 * the {@link ChannelInitializer}. The initializer runs again after every reconnect, which is
 * what keeps declared topology in place across broker restarts.</p>
 *
 * <p><b>Threading:</b> every event (tick, channel handle, shutdown notice, command, delivery,
 * returned message) is scheduled on a single {@link Scheduler.Worker} and handled one at a
 * time in arrival order. The channel and all specialization state are only touched from that
 * worker, so nothing here takes a lock. Public methods may be called from any thread.</p>
 *
 * <p><b>Commands:</b> each command is enqueued when the method is called and returns a hot
 * {@link Mono} that completes once the command has been applied, or errors if the owner was
 * disconnected or the broker call failed. Subscribing is optional.</p>
 */
public class ChannelOwner implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(ChannelOwner.class);

    /** Interval between channel requests while disconnected. */
    public static final Duration DEFAULT_RECONNECT_INTERVAL = Duration.ofSeconds(1);

    private static final AMQP.BasicProperties NO_PROPERTIES = new AMQP.BasicProperties.Builder().build();

    private final String name;
    private final ChannelProvider channelProvider;
    private final ChannelParameters channelParameters;
    private final ChannelInitializer initializer;
    private final Duration reconnectInterval;
    private final Scheduler scheduler;
    private final boolean ownsScheduler;
    private final Scheduler.Worker worker;
    private final AmqpClientMetrics metrics;
    private final Sinks.Many<ReturnedMessage> returnedMessages = Sinks.many().multicast().directBestEffort();

    // Worker-confined
    private Channel channel;
    private Disposable reconnectTask;
    private boolean started;
    private boolean terminated;

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;

    /**
     * Creates a publish-only owner with no QoS, the default reconnect interval and its own scheduler.
     *
     * @param name            name used in logs, metrics and the worker thread
     * @param channelProvider where channels come from
     */
    public ChannelOwner(String name, ChannelProvider channelProvider) {
        this(name, channelProvider, null, ChannelInitializer.NONE);
    }

    /**
     * Creates an owner with the default reconnect interval, its own scheduler and no metrics.
     *
     * @param name              name used in logs, metrics and the worker thread
     * @param channelProvider   where channels come from
     * @param channelParameters QoS applied to every new channel (may be null)
     * @param initializer       hook run on every new channel
     */
    public ChannelOwner(String name, ChannelProvider channelProvider,
                        ChannelParameters channelParameters, ChannelInitializer initializer) {
        this(name, channelProvider, channelParameters, initializer, DEFAULT_RECONNECT_INTERVAL, null, null);
    }

    /**
     * Creates an owner with full configuration.
     *
     * @param name              name used in logs, metrics and the worker thread
     * @param channelProvider   where channels come from
     * @param channelParameters QoS applied to every new channel (may be null)
     * @param initializer       hook run on every new channel
     * @param reconnectInterval interval between channel requests while disconnected
     * @param scheduler         scheduler to take the worker from; null to create (and later
     *                          dispose) a dedicated single-threaded scheduler
     * @param metrics           optional metrics collector (may be null)
     * @throws NullPointerException     if name, channelProvider, initializer or reconnectInterval is null
     * @throws IllegalArgumentException if reconnectInterval is not positive
     */
    public ChannelOwner(String name, ChannelProvider channelProvider, ChannelParameters channelParameters,
                        ChannelInitializer initializer, Duration reconnectInterval,
                        Scheduler scheduler, AmqpClientMetrics metrics) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.channelProvider = Objects.requireNonNull(channelProvider, "channelProvider cannot be null");
        this.initializer = Objects.requireNonNull(initializer, "initializer cannot be null");
        this.reconnectInterval = Objects.requireNonNull(reconnectInterval, "reconnectInterval cannot be null");
        if (reconnectInterval.isZero() || reconnectInterval.isNegative()) {
            throw new IllegalArgumentException("reconnectInterval must be positive");
        }
        this.channelParameters = channelParameters;
        this.metrics = metrics;
        this.ownsScheduler = scheduler == null;
        this.scheduler = ownsScheduler ? Schedulers.newSingle("amqp-" + name) : scheduler;
        this.worker = this.scheduler.createWorker();
    }

    // ==========================================================================
    // Lifecycle
    // ==========================================================================

    /**
     * Asks for a first channel right away and arms the reconnect tick. Calling it again is a no-op.
     */
    public void start() {
        schedule(() -> {
            if (started || terminated) {
                return;
            }
            started = true;
            log.info("Channel owner '{}' starting", name);
            requestChannel();
            armReconnect();
        });
    }

    /**
     * Stops the tick and closes the owned channel. Close failures are logged, never thrown.
     */
    @Override
    public void destroy() {
        schedule(() -> {
            terminate();
            if (!ownsScheduler) {
                worker.dispose();
            }
        });
        if (ownsScheduler) {
            scheduler.disposeGracefully()
                    .subscribe(null, e -> log.warn("Scheduler of channel owner '{}' did not stop cleanly: {}",
                            name, e.toString()));
        }
    }

    private void terminate() {
        if (terminated) {
            return;
        }
        terminated = true;
        cancelReconnect();
        if (state == ConnectionState.CONNECTED) {
            Channel current = channel;
            channel = null;
            state = ConnectionState.DISCONNECTED;
            if (metrics != null) {
                metrics.recordChannelClosed(name);
            }
            log.info("Channel owner '{}' closing channel", name);
            closeQuietly(current);
        }
        returnedMessages.tryEmitComplete();
    }

    // ==========================================================================
    // Connection owner callbacks
    // ==========================================================================

    /**
     * Hands a freshly opened channel to this owner. Called by the {@link ChannelProvider}.
     */
    public void channelAvailable(Channel newChannel) {
        Objects.requireNonNull(newChannel, "newChannel cannot be null");
        if (!schedule(() -> onChannelAvailable(newChannel))) {
            closeQuietly(newChannel);
        }
    }

    /**
     * Notifies this owner that {@code lostChannel} was shut down. Notifications for any channel
     * other than the one currently owned are ignored.
     */
    public void channelLost(Channel lostChannel, ShutdownSignalException cause) {
        schedule(() -> onChannelLost(lostChannel, cause));
    }

    private void onChannelAvailable(Channel newChannel) {
        if (terminated || state == ConnectionState.CONNECTED) {
            log.debug("Channel owner '{}' discarding surplus channel", name);
            closeQuietly(newChannel);
            return;
        }
        try {
            if (channelParameters != null) {
                newChannel.basicQos(channelParameters.prefetchCount());
            }
            newChannel.addReturnListener(returned -> schedule(() -> onReturned(returned)));
            initializer.onChannel(newChannel);
        } catch (IOException | RuntimeException e) {
            log.warn("Channel owner '{}' failed to initialize channel, will retry: {}", name, e.toString());
            closeQuietly(newChannel);
            return;
        }
        channel = newChannel;
        state = ConnectionState.CONNECTED;
        cancelReconnect();
        if (metrics != null) {
            metrics.recordChannelAcquired(name);
        }
        log.info("Channel owner '{}' connected", name);
    }

    private void onChannelLost(Channel lostChannel, ShutdownSignalException cause) {
        if (state != ConnectionState.CONNECTED || lostChannel != channel) {
            log.debug("Channel owner '{}' ignoring shutdown of a channel it does not own", name);
            return;
        }
        channel = null;
        state = ConnectionState.DISCONNECTED;
        if (metrics != null) {
            metrics.recordChannelLost(name);
        }
        log.warn("Channel owner '{}' disconnected: {}", name, cause != null ? cause.getMessage() : "unknown cause");
        armReconnect();
    }

    private void onReturned(Return returned) {
        if (metrics != null) {
            metrics.recordReturned(name);
        }
        log.debug("Channel owner '{}' got message returned by broker: {} {}",
                name, returned.getReplyCode(), returned.getReplyText());
        returnedMessages.tryEmitNext(new ReturnedMessage(returned.getReplyCode(), returned.getReplyText(),
                returned.getExchange(), returned.getRoutingKey(), returned.getProperties(), returned.getBody()));
    }

    // ==========================================================================
    // Reconnect tick
    // ==========================================================================

    private void armReconnect() {
        if (isReconnectScheduled()) {
            return;
        }
        long millis = reconnectInterval.toMillis();
        try {
            reconnectTask = worker.schedulePeriodically(this::onTick, millis, millis, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Channel owner '{}' is shut down, not arming reconnect", name);
        }
    }

    private void cancelReconnect() {
        if (reconnectTask != null) {
            reconnectTask.dispose();
            reconnectTask = null;
        }
    }

    private void onTick() {
        if (state == ConnectionState.DISCONNECTED && !terminated) {
            requestChannel();
        }
    }

    private void requestChannel() {
        try {
            channelProvider.requestChannel(this);
        } catch (RuntimeException e) {
            log.warn("Channel owner '{}' could not request a channel: {}", name, e.toString());
        }
    }

    boolean isReconnectScheduled() {
        return reconnectTask != null && !reconnectTask.isDisposed();
    }

    // ==========================================================================
    // Commands
    // ==========================================================================

    /**
     * Publishes one message with empty properties. No acknowledgment is involved.
     */
    public Mono<Void> publish(Publish publish) {
        Objects.requireNonNull(publish, "publish cannot be null");
        return execute("publish", ch -> {
            ch.basicPublish(publish.exchange(), publish.routingKey(), publish.mandatory(),
                    publish.immediate(), NO_PROPERTIES, publish.body());
            recordPublished(1);
            return null;
        });
    }

    /**
     * Publishes all messages of the transaction and commits them as one unit.
     *
     * <p>If a publish fails the transaction is rolled back before the error is reported, so
     * none of its messages leak into a later commit. A failed commit is reported, never
     * retried. Note that once {@code tx.select} has been issued the channel stays
     * transactional: later single publishes on this owner are only delivered by the next
     * commit.</p>
     */
    public Mono<Void> transaction(Transaction transaction) {
        Objects.requireNonNull(transaction, "transaction cannot be null");
        return execute("commit transaction", ch -> {
            ch.txSelect();
            try {
                for (Publish p : transaction.publishes()) {
                    ch.basicPublish(p.exchange(), p.routingKey(), p.mandatory(), p.immediate(), NO_PROPERTIES, p.body());
                }
            } catch (IOException | RuntimeException e) {
                rollbackQuietly(ch);
                throw e;
            }
            ch.txCommit();
            recordPublished(transaction.publishes().size());
            return null;
        });
    }

    /**
     * Positively acknowledges a single delivery.
     */
    public Mono<Void> ack(long deliveryTag) {
        return execute("ack", ch -> {
            ch.basicAck(deliveryTag, false);
            return null;
        });
    }

    /**
     * Rejects a single delivery.
     *
     * @param requeue whether the broker should make it available again
     */
    public Mono<Void> reject(long deliveryTag, boolean requeue) {
        return execute("reject", ch -> {
            ch.basicReject(deliveryTag, requeue);
            return null;
        });
    }

    /**
     * Declares an exchange, or checks that it exists when the parameters are passive.
     *
     * @param exchange the exchange settings
     * @return a Mono emitting the broker's declare-ok
     */
    public Mono<AMQP.Exchange.DeclareOk> declareExchange(ExchangeParameters exchange) {
        Objects.requireNonNull(exchange, "exchange cannot be null");
        return execute("declare exchange", ch -> Topology.declareExchange(ch, exchange));
    }

    /**
     * Declares a queue, or checks that it exists when the parameters are passive.
     *
     * @param queue the queue settings; an empty name lets the broker pick one
     * @return a Mono emitting the broker's declare-ok, which carries the effective queue name
     */
    public Mono<AMQP.Queue.DeclareOk> declareQueue(QueueParameters queue) {
        Objects.requireNonNull(queue, "queue cannot be null");
        return execute("declare queue", ch -> Topology.declareQueue(ch, queue));
    }

    /**
     * Binds a queue to an exchange.
     *
     * @param arguments extra binding arguments (may be null)
     */
    public Mono<Void> queueBind(String queue, String exchange, String routingKey, Map<String, Object> arguments) {
        Objects.requireNonNull(queue, "queue cannot be null");
        Objects.requireNonNull(exchange, "exchange cannot be null");
        Objects.requireNonNull(routingKey, "routingKey cannot be null");
        Map<String, Object> args = arguments == null ? Map.of() : arguments;
        return execute("bind queue", ch -> {
            ch.queueBind(queue, exchange, routingKey, args);
            return null;
        });
    }

    /**
     * Runs {@code callback} against the owned channel on the worker.
     *
     * @param operation human readable name used in logs and in {@link ChannelNotConnectedException}
     * @param callback  the work; its result completes the returned Mono ({@code null} completes it empty)
     * @return a hot Mono signalling the outcome
     */
    public <T> Mono<T> execute(String operation, ChannelCallback<T> callback) {
        Sinks.One<T> result = Sinks.one();
        boolean scheduled = schedule(() -> {
            if (state != ConnectionState.CONNECTED) {
                rejectCommand(operation, result);
                return;
            }
            try {
                result.tryEmitValue(callback.doWithChannel(channel));
            } catch (IOException | RuntimeException e) {
                log.warn("Channel owner '{}' failed to {}: {}", name, operation, e.toString());
                result.tryEmitError(e);
            }
        });
        if (!scheduled) {
            result.tryEmitError(new ChannelNotConnectedException(name, operation));
        }
        return result.asMono();
    }

    private void rejectCommand(String operation, Sinks.One<?> result) {
        if (metrics != null) {
            metrics.recordCommandRejected(name);
        }
        log.debug("Channel owner '{}' rejecting '{}' while disconnected", name, operation);
        result.tryEmitError(new ChannelNotConnectedException(name, operation));
    }

    // ==========================================================================
    // Deliveries
    // ==========================================================================

    /**
     * Schedules a delivery for {@code handler} on the worker.
     *
     * <p>Deliveries that arrived on a channel this owner no longer holds are dropped without
     * acknowledgment: their tags mean nothing on a new channel and the broker requeues them.</p>
     */
    void deliver(Channel source, Delivery delivery, DeliveryHandler handler) {
        schedule(() -> {
            if (state != ConnectionState.CONNECTED || source != channel) {
                log.debug("Channel owner '{}' dropping delivery {} from a stale channel",
                        name, delivery.deliveryTag());
                return;
            }
            if (metrics != null) {
                metrics.recordDelivery(name);
            }
            try {
                handler.handle(source, delivery);
            } catch (IOException | RuntimeException e) {
                log.warn("Channel owner '{}' failed to handle delivery {}: {}",
                        name, delivery.deliveryTag(), e.toString());
            }
        });
    }

    // ==========================================================================
    // Accessors
    // ==========================================================================

    /**
     * Returns the name used in logs, metrics and the worker thread.
     */
    public String getName() {
        return name;
    }

    /**
     * Returns the current state. Safe to call from any thread.
     */
    public ConnectionState state() {
        return state;
    }

    /**
     * Shorthand for {@code state() == CONNECTED}.
     */
    public boolean isConnected() {
        return state == ConnectionState.CONNECTED;
    }

    /**
     * Messages the broker returned because they were published mandatory/immediate and could
     * not be routed. Hot: only subscribers present at the time of the return see it.
     */
    public Flux<ReturnedMessage> returnedMessages() {
        return returnedMessages.asFlux();
    }

    // ==========================================================================
    // Utilities
    // ==========================================================================

    private void recordPublished(int count) {
        if (metrics != null) {
            metrics.recordPublished(name, count);
        }
    }

    private boolean schedule(Runnable task) {
        try {
            worker.schedule(task);
            return true;
        } catch (RejectedExecutionException e) {
            log.debug("Channel owner '{}' is shut down, dropping event", name);
            return false;
        }
    }

    private void rollbackQuietly(Channel ch) {
        try {
            ch.txRollback();
        } catch (IOException | RuntimeException e) {
            log.warn("Channel owner '{}' failed to roll back transaction: {}", name, e.toString());
        }
    }

    private void closeQuietly(Channel toClose) {
        try {
            toClose.close();
        } catch (IOException | TimeoutException | RuntimeException e) {
            log.warn("Channel owner '{}' failed to close channel: {}", name, e.toString());
        }
    }
}
