package io.clype.reactoramqp.model;

import com.rabbitmq.client.AMQP;

/**
 * A mandatory or immediate publish the broker could not route or deliver.
 *
 * @param replyCode  AMQP reply code (312 NO_ROUTE, 313 NO_CONSUMERS)
 * @param replyText  broker explanation
 * @param exchange   exchange the message was published to
 * @param routingKey routing key it was published with
 * @param properties content header of the returned message
 * @param body       returned payload
 */
public record ReturnedMessage(
    int replyCode,
    String replyText,
    String exchange,
    String routingKey,
    AMQP.BasicProperties properties,
    byte[] body
) {}
