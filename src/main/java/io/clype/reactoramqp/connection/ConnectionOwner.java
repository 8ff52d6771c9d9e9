package io.clype.reactoramqp.connection;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.ShutdownSignalException;

import io.clype.reactoramqp.channel.ChannelOwner;
import io.clype.reactoramqp.channel.ChannelProvider;
import io.clype.reactoramqp.model.ConnectionState;

import reactor.core.Disposable;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Owns the physical broker connection and hands out channels to {@link ChannelOwner}s.
 *
 * <p>While no open connection exists a periodic tick retries
 * {@link ConnectionFactory#newConnection(String)}. Channel requests arriving meanwhile are
 * ignored; the requesting owners ask again on their own tick.</p>
 *
 * <p>Every channel handed out gets a shutdown listener that reports
 * {@link ChannelOwner#channelLost} to its owner. A lost connection shuts down all of its
 * channels, so every dependent owner is notified through the same path.</p>
 *
 * <p>The client library's automatic recovery must be disabled on the factory; recovery is
 * driven from here and from the channel owners.</p>
 */
public class ConnectionOwner implements ChannelProvider, DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(ConnectionOwner.class);

    private final ConnectionFactory connectionFactory;
    private final String connectionName;
    private final Duration reconnectInterval;
    private final Scheduler scheduler;
    private final boolean ownsScheduler;
    private final Scheduler.Worker worker;

    // Worker-confined
    private Connection connection;
    private Disposable reconnectTask;
    private boolean started;
    private boolean terminated;

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;

    /**
     * Creates a connection owner with the default reconnect interval and its own scheduler.
     */
    public ConnectionOwner(ConnectionFactory connectionFactory, String connectionName) {
        this(connectionFactory, connectionName, ChannelOwner.DEFAULT_RECONNECT_INTERVAL, null);
    }

    /**
     * Creates a connection owner.
     *
     * @param connectionFactory factory for the physical connection
     * @param connectionName    client-provided connection name shown by the broker
     * @param reconnectInterval interval between connection attempts while disconnected
     * @param scheduler         scheduler to take the worker from; null to create a dedicated one
     */
    public ConnectionOwner(ConnectionFactory connectionFactory, String connectionName,
                           Duration reconnectInterval, Scheduler scheduler) {
        this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory cannot be null");
        this.connectionName = Objects.requireNonNull(connectionName, "connectionName cannot be null");
        this.reconnectInterval = Objects.requireNonNull(reconnectInterval, "reconnectInterval cannot be null");
        if (reconnectInterval.isZero() || reconnectInterval.isNegative()) {
            throw new IllegalArgumentException("reconnectInterval must be positive");
        }
        this.ownsScheduler = scheduler == null;
        this.scheduler = ownsScheduler ? Schedulers.newSingle("amqp-connection-" + connectionName) : scheduler;
        this.worker = this.scheduler.createWorker();
    }

    /**
     * Connects right away and keeps retrying on the reconnect interval until it succeeds.
     */
    public void start() {
        schedule(() -> {
            if (started || terminated) {
                return;
            }
            started = true;
            connect();
            if (state == ConnectionState.DISCONNECTED) {
                armReconnect();
            }
        });
    }

    @Override
    public void requestChannel(ChannelOwner requester) {
        Objects.requireNonNull(requester, "requester cannot be null");
        schedule(() -> createChannel(requester));
    }

    /**
     * Returns the current connection state. Safe to call from any thread.
     */
    public ConnectionState state() {
        return state;
    }

    /**
     * Closes the connection, and with it every channel handed out. Failures are logged only.
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
                    .subscribe(null, e -> log.warn("Scheduler of connection '{}' did not stop cleanly: {}",
                            connectionName, e.toString()));
        }
    }

    // ==========================================================================
    // Worker steps
    // ==========================================================================

    private void connect() {
        if (terminated || state == ConnectionState.CONNECTED) {
            return;
        }
        Connection newConnection;
        try {
            newConnection = connectionFactory.newConnection(connectionName);
        } catch (IOException | TimeoutException | RuntimeException e) {
            log.warn("Connection '{}' to {}:{} failed, retrying in {}: {}", connectionName,
                    connectionFactory.getHost(), connectionFactory.getPort(), reconnectInterval, e.toString());
            return;
        }
        newConnection.addShutdownListener(cause -> schedule(() -> onConnectionLost(newConnection, cause)));
        connection = newConnection;
        state = ConnectionState.CONNECTED;
        cancelReconnect();
        log.info("Connection '{}' established to {}:{}", connectionName,
                connectionFactory.getHost(), connectionFactory.getPort());
    }

    private void onConnectionLost(Connection lost, ShutdownSignalException cause) {
        if (lost != connection) {
            return;
        }
        connection = null;
        state = ConnectionState.DISCONNECTED;
        if (terminated) {
            return;
        }
        log.warn("Connection '{}' lost: {}", connectionName, cause != null ? cause.getMessage() : "unknown cause");
        armReconnect();
    }

    private void createChannel(ChannelOwner requester) {
        if (state != ConnectionState.CONNECTED || terminated) {
            log.debug("Connection '{}' not available, ignoring channel request from '{}'",
                    connectionName, requester.getName());
            return;
        }
        Channel channel;
        try {
            channel = connection.createChannel();
        } catch (IOException | RuntimeException e) {
            log.warn("Connection '{}' could not open a channel for '{}': {}",
                    connectionName, requester.getName(), e.toString());
            return;
        }
        if (channel == null) {
            log.warn("Connection '{}' has no channel number left for '{}'", connectionName, requester.getName());
            return;
        }
        channel.addShutdownListener(cause -> requester.channelLost(channel, cause));
        requester.channelAvailable(channel);
    }

    private void terminate() {
        if (terminated) {
            return;
        }
        terminated = true;
        cancelReconnect();
        if (connection != null) {
            Connection current = connection;
            connection = null;
            state = ConnectionState.DISCONNECTED;
            log.info("Closing connection '{}'", connectionName);
            try {
                current.close();
            } catch (IOException | RuntimeException e) {
                log.warn("Failed to close connection '{}': {}", connectionName, e.toString());
            }
        }
    }

    private void armReconnect() {
        if (reconnectTask != null && !reconnectTask.isDisposed()) {
            return;
        }
        long millis = reconnectInterval.toMillis();
        try {
            reconnectTask = worker.schedulePeriodically(this::connect, millis, millis, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Connection '{}' is shut down, not arming reconnect", connectionName);
        }
    }

    private void cancelReconnect() {
        if (reconnectTask != null) {
            reconnectTask.dispose();
            reconnectTask = null;
        }
    }

    boolean isReconnectScheduled() {
        return reconnectTask != null && !reconnectTask.isDisposed();
    }

    private void schedule(Runnable task) {
        try {
            worker.schedule(task);
        } catch (RejectedExecutionException e) {
            log.debug("Connection '{}' is shut down, dropping event", connectionName);
        }
    }
}
