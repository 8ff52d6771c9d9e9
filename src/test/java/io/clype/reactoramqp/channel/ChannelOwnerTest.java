package io.clype.reactoramqp.channel;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.Return;
import com.rabbitmq.client.ReturnCallback;
import com.rabbitmq.client.ShutdownSignalException;

import io.clype.reactoramqp.model.ChannelNotConnectedException;
import io.clype.reactoramqp.model.ChannelParameters;
import io.clype.reactoramqp.model.ConnectionState;
import io.clype.reactoramqp.model.ExchangeParameters;
import io.clype.reactoramqp.model.Publish;
import io.clype.reactoramqp.model.QueueParameters;
import io.clype.reactoramqp.model.ReturnedMessage;
import io.clype.reactoramqp.model.Transaction;

import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ChannelOwnerTest {

    private static final Duration INTERVAL = Duration.ofSeconds(1);

    private VirtualTimeScheduler scheduler;
    private ChannelProvider provider;
    private Channel channel;
    private ChannelOwner owner;

    @BeforeEach
    void setUp() {
        scheduler = VirtualTimeScheduler.create();
        provider = mock(ChannelProvider.class);
        channel = mock(Channel.class);
        owner = new ChannelOwner("test", provider, null, ChannelInitializer.NONE, INTERVAL, scheduler, null);
    }

    // ==========================================================================
    // Reconnect tick
    // ==========================================================================

    @Test
    void startRequestsChannelImmediatelyThenOnEveryTick() {
        owner.start();
        verify(provider, times(1)).requestChannel(owner);
        assertTrue(owner.isReconnectScheduled());

        scheduler.advanceTimeBy(INTERVAL);
        verify(provider, times(2)).requestChannel(owner);

        scheduler.advanceTimeBy(INTERVAL.multipliedBy(3));
        verify(provider, times(5)).requestChannel(owner);
        assertEquals(ConnectionState.DISCONNECTED, owner.state());
    }

    @Test
    void startTwiceDoesNotArmSecondTimer() {
        owner.start();
        owner.start();

        scheduler.advanceTimeBy(INTERVAL);

        verify(provider, times(2)).requestChannel(owner);
    }

    @Test
    void connectingCancelsTickAndLosingChannelRearmsIt() {
        owner.start();
        owner.channelAvailable(channel);

        assertEquals(ConnectionState.CONNECTED, owner.state());
        assertFalse(owner.isReconnectScheduled());

        scheduler.advanceTimeBy(INTERVAL.multipliedBy(10));
        verify(provider, times(1)).requestChannel(owner);

        owner.channelLost(channel, new ShutdownSignalException(false, false, null, channel));

        assertEquals(ConnectionState.DISCONNECTED, owner.state());
        assertTrue(owner.isReconnectScheduled());
        // No immediate request on loss, only on the next tick
        verify(provider, times(1)).requestChannel(owner);

        scheduler.advanceTimeBy(INTERVAL);
        verify(provider, times(2)).requestChannel(owner);
    }

    @Test
    void timerIsActiveOnlyWhileDisconnectedAcrossManyCycles() {
        owner.start();

        for (int i = 0; i < 5; i++) {
            Channel next = mock(Channel.class);
            owner.channelAvailable(next);
            assertTrue(owner.isConnected());
            assertFalse(owner.isReconnectScheduled());

            owner.channelLost(next, null);
            assertFalse(owner.isConnected());
            assertTrue(owner.isReconnectScheduled());
        }

        // One request at start, then exactly one per elapsed interval: never double-armed
        scheduler.advanceTimeBy(INTERVAL);
        verify(provider, times(2)).requestChannel(owner);
    }

    @Test
    void providerFailureIsRetriedOnNextTick() {
        doThrow(new IllegalStateException("connection owner gone"))
                .doNothing()
                .when(provider).requestChannel(owner);

        owner.start();
        scheduler.advanceTimeBy(INTERVAL);

        verify(provider, times(2)).requestChannel(owner);
        assertTrue(owner.isReconnectScheduled());
    }

    // ==========================================================================
    // Channel acquisition
    // ==========================================================================

    @Test
    void newChannelGetsQosReturnListenerAndInitializerInOrder() throws IOException {
        ChannelInitializer initializer = mock(ChannelInitializer.class);
        owner = new ChannelOwner("test", provider, new ChannelParameters(25), initializer, INTERVAL, scheduler, null);

        owner.start();
        owner.channelAvailable(channel);

        InOrder order = inOrder(channel, initializer);
        order.verify(channel).basicQos(25);
        order.verify(channel).addReturnListener(any(ReturnCallback.class));
        order.verify(initializer).onChannel(channel);
        assertTrue(owner.isConnected());
    }

    @Test
    void noQosWithoutChannelParameters() throws IOException {
        owner.start();
        owner.channelAvailable(channel);

        verify(channel, never()).basicQos(anyInt());
    }

    @Test
    void failedInitializationClosesChannelAndKeepsRetrying() throws Exception {
        ChannelInitializer initializer = ch -> {
            throw new IOException("queue declaration refused");
        };
        owner = new ChannelOwner("test", provider, null, initializer, INTERVAL, scheduler, null);

        owner.start();
        owner.channelAvailable(channel);

        assertEquals(ConnectionState.DISCONNECTED, owner.state());
        verify(channel).close();
        assertTrue(owner.isReconnectScheduled());

        scheduler.advanceTimeBy(INTERVAL);
        verify(provider, times(2)).requestChannel(owner);
    }

    @Test
    void surplusChannelWhileConnectedIsClosed() throws Exception {
        Channel surplus = mock(Channel.class);
        owner.start();
        owner.channelAvailable(channel);
        owner.channelAvailable(surplus);

        verify(surplus).close();
        verify(channel, never()).close();

        owner.publish(new Publish("ex", "key", new byte[] {1}));
        verify(channel).basicPublish(eq("ex"), eq("key"), eq(false), eq(false), any(), any());
        verify(surplus, never()).basicPublish(anyString(), anyString(), anyBoolean(), anyBoolean(), any(), any());
    }

    @Test
    void shutdownOfStaleChannelIsIgnored() {
        Channel stale = mock(Channel.class);
        owner.start();
        owner.channelAvailable(channel);

        owner.channelLost(stale, null);

        assertTrue(owner.isConnected());
        assertFalse(owner.isReconnectScheduled());
    }

    // ==========================================================================
    // Commands
    // ==========================================================================

    @Test
    void publishSendsExactValuesWithoutAcknowledging() throws IOException {
        byte[] body = "hello".getBytes();
        owner.start();
        owner.channelAvailable(channel);

        StepVerifier.create(owner.publish(new Publish("orders", "created", body, true, false)))
                .verifyComplete();

        verify(channel, times(1)).basicPublish(eq("orders"), eq("created"), eq(true), eq(false), any(), eq(body));
        verify(channel, never()).basicAck(anyLong(), anyBoolean());
        verify(channel, never()).basicReject(anyLong(), anyBoolean());
    }

    @Test
    void commandsWhileDisconnectedAreRejectedExplicitly() {
        owner.start();

        StepVerifier.create(owner.publish(new Publish("ex", "key", new byte[0])))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(ChannelNotConnectedException.class);
                    assertThat(((ChannelNotConnectedException) e).getOwnerName()).isEqualTo("test");
                    assertThat(((ChannelNotConnectedException) e).getOperation()).isEqualTo("publish");
                })
                .verify();

        StepVerifier.create(owner.ack(1L))
                .expectError(ChannelNotConnectedException.class)
                .verify();

        verifyNoInteractions(channel);
    }

    @Test
    void commandsAfterChannelLossAreRejectedAndNotReplayed() throws IOException {
        owner.start();
        owner.channelAvailable(channel);
        owner.channelLost(channel, null);

        StepVerifier.create(owner.publish(new Publish("ex", "key", new byte[0])))
                .expectError(ChannelNotConnectedException.class)
                .verify();

        Channel next = mock(Channel.class);
        owner.channelAvailable(next);

        verify(next, never()).basicPublish(anyString(), anyString(), anyBoolean(), anyBoolean(), any(), any());
    }

    @Test
    void transactionSelectsPublishesAllThenCommits() throws IOException {
        owner.start();
        owner.channelAvailable(channel);

        Transaction tx = new Transaction(List.of(
                new Publish("ex", "a", new byte[] {1}),
                new Publish("ex", "b", new byte[] {2})));

        StepVerifier.create(owner.transaction(tx)).verifyComplete();

        InOrder order = inOrder(channel);
        order.verify(channel).txSelect();
        order.verify(channel).basicPublish(eq("ex"), eq("a"), eq(false), eq(false), any(), any());
        order.verify(channel).basicPublish(eq("ex"), eq("b"), eq(false), eq(false), any(), any());
        order.verify(channel).txCommit();
    }

    @Test
    void failedCommitIsReportedAndNotRetried() throws IOException {
        when(channel.txCommit()).thenThrow(new IOException("commit failed"));
        owner.start();
        owner.channelAvailable(channel);

        StepVerifier.create(owner.transaction(new Transaction(List.of(new Publish("ex", "a", new byte[0])))))
                .expectErrorMessage("commit failed")
                .verify();

        verify(channel, times(1)).txCommit();
        assertTrue(owner.isConnected());
    }

    @Test
    void failedPublishRollsBackSoNextCommitCarriesOnlyItsOwnBatch() throws IOException {
        doThrow(new IOException("connection reset"))
                .when(channel).basicPublish(eq("ex"), eq("b"), anyBoolean(), anyBoolean(), any(), any());
        owner.start();
        owner.channelAvailable(channel);

        StepVerifier.create(owner.transaction(new Transaction(List.of(
                        new Publish("ex", "a", new byte[0]),
                        new Publish("ex", "b", new byte[0])))))
                .expectErrorMessage("connection reset")
                .verify();
        StepVerifier.create(owner.transaction(new Transaction(List.of(new Publish("ex", "c", new byte[0])))))
                .verifyComplete();

        InOrder order = inOrder(channel);
        order.verify(channel).basicPublish(eq("ex"), eq("a"), anyBoolean(), anyBoolean(), any(), any());
        order.verify(channel).txRollback();
        order.verify(channel).basicPublish(eq("ex"), eq("c"), anyBoolean(), anyBoolean(), any(), any());
        order.verify(channel).txCommit();
        verify(channel, times(1)).txCommit();
    }

    @Test
    void rollbackFailureKeepsOriginalError() throws IOException {
        doThrow(new IOException("publish failed"))
                .when(channel).basicPublish(anyString(), anyString(), anyBoolean(), anyBoolean(), any(), any());
        when(channel.txRollback()).thenThrow(new IOException("rollback failed"));
        owner.start();
        owner.channelAvailable(channel);

        StepVerifier.create(owner.transaction(new Transaction(List.of(new Publish("ex", "a", new byte[0])))))
                .expectErrorMessage("publish failed")
                .verify();

        verify(channel).txRollback();
        verify(channel, never()).txCommit();
        assertTrue(owner.isConnected());
    }

    @Test
    void ackAndRejectUseGivenFlags() throws IOException {
        owner.start();
        owner.channelAvailable(channel);

        owner.ack(7L);
        owner.reject(8L, true);
        owner.reject(9L, false);

        verify(channel).basicAck(7L, false);
        verify(channel).basicReject(8L, true);
        verify(channel).basicReject(9L, false);
    }

    @Test
    void declarationsAreForwardedToChannel() throws IOException {
        AMQP.Queue.DeclareOk queueOk = mock(AMQP.Queue.DeclareOk.class);
        when(queueOk.getQueue()).thenReturn("amq.gen-1");
        when(channel.queueDeclare("", false, true, true, Map.of())).thenReturn(queueOk);
        owner.start();
        owner.channelAvailable(channel);

        StepVerifier.create(owner.declareQueue(new QueueParameters("", false, false, true, true, Map.of())))
                .assertNext(ok -> assertEquals("amq.gen-1", ok.getQueue()))
                .verifyComplete();

        owner.declareExchange(new ExchangeParameters("events", false, "topic", true, false, Map.of()));
        owner.declareExchange(new ExchangeParameters("existing", true, "direct"));
        owner.queueBind("amq.gen-1", "events", "order.*", null);

        verify(channel).exchangeDeclare("events", "topic", true, false, Map.of());
        verify(channel).exchangeDeclarePassive("existing");
        verify(channel).queueBind("amq.gen-1", "events", "order.*", Map.of());
    }

    @Test
    void commandsAreAppliedInCallOrder() throws IOException {
        owner.start();
        owner.channelAvailable(channel);

        owner.publish(new Publish("ex", "1", new byte[0]));
        owner.ack(1L);
        owner.publish(new Publish("ex", "2", new byte[0]));

        InOrder order = inOrder(channel);
        order.verify(channel).basicPublish(eq("ex"), eq("1"), anyBoolean(), anyBoolean(), any(), any());
        order.verify(channel).basicAck(1L, false);
        order.verify(channel).basicPublish(eq("ex"), eq("2"), anyBoolean(), anyBoolean(), any(), any());
    }

    // ==========================================================================
    // Returned messages
    // ==========================================================================

    @Test
    void returnedMessagesAreSurfacedAsEvents() throws IOException {
        owner.start();
        owner.channelAvailable(channel);

        ArgumentCaptor<ReturnCallback> captor = ArgumentCaptor.forClass(ReturnCallback.class);
        verify(channel).addReturnListener(captor.capture());

        AMQP.BasicProperties props = new AMQP.BasicProperties.Builder().build();
        StepVerifier.create(owner.returnedMessages().take(1))
                .then(() -> captor.getValue().handle(
                        new Return(312, "NO_ROUTE", "orders", "nowhere", props, new byte[] {9})))
                .assertNext(r -> {
                    assertEquals(312, r.replyCode());
                    assertEquals("NO_ROUTE", r.replyText());
                    assertEquals("orders", r.exchange());
                    assertEquals("nowhere", r.routingKey());
                })
                .verifyComplete();
    }

    // ==========================================================================
    // Deliveries
    // ==========================================================================

    @Test
    void deliveriesFromStaleChannelAreDropped() {
        DeliveryHandler handler = mock(DeliveryHandler.class);
        Channel old = mock(Channel.class);
        owner.start();
        owner.channelAvailable(old);
        ForwardingConsumer oldConsumer = new ForwardingConsumer(old, owner, handler);
        owner.channelLost(old, null);
        owner.channelAvailable(channel);

        oldConsumer.handleDelivery("tag", new Envelope(1L, false, "ex", "key"),
                new AMQP.BasicProperties(), new byte[0]);

        verifyNoInteractions(handler);
    }

    // ==========================================================================
    // Termination
    // ==========================================================================

    @Test
    void destroyClosesChannelAndStopsTick() throws Exception {
        owner.start();
        owner.channelAvailable(channel);

        owner.destroy();

        verify(channel).close();
        assertEquals(ConnectionState.DISCONNECTED, owner.state());
        assertFalse(owner.isReconnectScheduled());
    }

    @Test
    void destroyWhileDisconnectedStopsTick() {
        owner.start();
        owner.destroy();

        scheduler.advanceTimeBy(INTERVAL.multipliedBy(5));

        verify(provider, times(1)).requestChannel(owner);
        assertFalse(owner.isReconnectScheduled());
    }

    @Test
    void closeFailureOnDestroyIsSwallowed() throws Exception {
        doThrow(new TimeoutException("close timed out")).when(channel).close();
        owner.start();
        owner.channelAvailable(channel);

        owner.destroy();

        verify(channel).close();
        assertFalse(owner.isConnected());
    }

    @Test
    void channelOfferedAfterDestroyIsClosed() throws Exception {
        owner.start();
        owner.destroy();

        owner.channelAvailable(channel);

        verify(channel).close();
    }

    @Test
    void destroyDuringStartLeavesNoUncaughtSchedulerError() throws Exception {
        List<Throwable> uncaught = new CopyOnWriteArrayList<>();
        Schedulers.onHandleError((thread, error) -> uncaught.add(error));
        try {
            CountDownLatch entered = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            AtomicReference<Thread> workerThread = new AtomicReference<>();
            ChannelProvider blocking = requester -> {
                workerThread.set(Thread.currentThread());
                entered.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            };
            // Dedicated scheduler: destroy() shuts it down while start() is still running
            ChannelOwner racing = new ChannelOwner("shutdown-race", blocking);
            racing.start();
            assertTrue(entered.await(5, TimeUnit.SECONDS));

            racing.destroy();
            release.countDown();
            workerThread.get().join(5_000);

            assertFalse(workerThread.get().isAlive());
            assertThat(uncaught).isEmpty();
            assertFalse(racing.isConnected());
            // Termination still ran after the interrupted start step
            StepVerifier.create(racing.returnedMessages()).expectComplete().verify(Duration.ofSeconds(1));
        } finally {
            Schedulers.resetOnHandleError();
        }
    }

    @Test
    void rejectsNonPositiveReconnectInterval() {
        assertThrows(IllegalArgumentException.class,
                () -> new ChannelOwner("x", provider, null, ChannelInitializer.NONE, Duration.ZERO, scheduler, null));
        assertThrows(NullPointerException.class,
                () -> new ChannelOwner("x", null, null, ChannelInitializer.NONE, INTERVAL, scheduler, null));
    }

    @Test
    void returnedMessageRecordCarriesBody() {
        ReturnedMessage message = new ReturnedMessage(313, "NO_CONSUMERS", "ex", "key", null, new byte[] {4, 2});
        assertEquals(2, message.body().length);
    }
}
