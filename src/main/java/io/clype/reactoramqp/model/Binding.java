package io.clype.reactoramqp.model;

import java.util.Objects;

/**
 * A queue bound to an exchange and consumed by a {@code AmqpConsumer}.
 *
 * @param queue      the queue to declare and consume
 * @param exchange   the exchange to declare and bind to
 * @param routingKey binding key
 * @param autoAck    whether the broker considers deliveries acknowledged on send
 */
public record Binding(
    QueueParameters queue,
    ExchangeParameters exchange,
    String routingKey,
    boolean autoAck
) {

    public Binding {
        Objects.requireNonNull(queue, "queue cannot be null");
        Objects.requireNonNull(exchange, "exchange cannot be null");
        Objects.requireNonNull(routingKey, "routingKey cannot be null");
    }
}
