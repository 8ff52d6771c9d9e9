package io.clype.reactoramqp.model;

import java.util.Objects;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Envelope;

/**
 * A message pushed by the broker to one of our consumers.
 *
 * @param consumerTag tag of the consumer the message was delivered to
 * @param envelope    delivery tag, redelivered flag, exchange and routing key
 * @param properties  content header (correlation id, reply-to, ...)
 * @param body        message payload
 */
public record Delivery(
    String consumerTag,
    Envelope envelope,
    AMQP.BasicProperties properties,
    byte[] body
) {

    public Delivery {
        Objects.requireNonNull(envelope, "envelope cannot be null");
        Objects.requireNonNull(properties, "properties cannot be null");
        Objects.requireNonNull(body, "body cannot be null");
    }

    public long deliveryTag() {
        return envelope.getDeliveryTag();
    }

    public boolean redelivered() {
        return envelope.isRedeliver();
    }

    public String correlationId() {
        return properties.getCorrelationId();
    }

    public String replyTo() {
        return properties.getReplyTo();
    }
}
