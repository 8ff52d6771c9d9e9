package io.clype.reactoramqp.model;

import java.util.Objects;

/**
 * One outbound message.
 *
 * <p>RabbitMQ 3.x and later do not implement {@code immediate}; a publish with
 * {@code immediate=true} makes the broker close the channel.</p>
 *
 * @param exchange   target exchange, empty for the default exchange
 * @param routingKey routing key
 * @param body       message payload
 * @param mandatory  return the message if it cannot be routed to any queue
 * @param immediate  return the message if it cannot be delivered to a consumer right away
 */
public record Publish(
    String exchange,
    String routingKey,
    byte[] body,
    boolean mandatory,
    boolean immediate
) {

    public Publish {
        Objects.requireNonNull(exchange, "exchange cannot be null");
        Objects.requireNonNull(routingKey, "routingKey cannot be null");
        Objects.requireNonNull(body, "body cannot be null");
    }

    /**
     * A publish that is neither mandatory nor immediate.
     */
    public Publish(String exchange, String routingKey, byte[] body) {
        this(exchange, routingKey, body, false, false);
    }
}
