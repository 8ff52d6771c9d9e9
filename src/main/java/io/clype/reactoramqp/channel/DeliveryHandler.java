package io.clype.reactoramqp.channel;

import java.io.IOException;

import com.rabbitmq.client.Channel;

import io.clype.reactoramqp.model.Delivery;

/**
 * Handles a delivery on the owner's worker, with the channel it arrived on.
 */
@FunctionalInterface
public interface DeliveryHandler {

    void handle(Channel channel, Delivery delivery) throws IOException;
}
