package io.clype.reactoramqp.channel;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;

import io.clype.reactoramqp.model.Delivery;

/**
 * Broker consumer that hands every delivery over to the owner's worker instead of handling it
 * on the client library's dispatch thread.
 */
public class ForwardingConsumer extends DefaultConsumer {

    private final ChannelOwner owner;
    private final DeliveryHandler handler;

    public ForwardingConsumer(Channel channel, ChannelOwner owner, DeliveryHandler handler) {
        super(channel);
        this.owner = owner;
        this.handler = handler;
    }

    @Override
    public void handleDelivery(String consumerTag, Envelope envelope,
                               AMQP.BasicProperties properties, byte[] body) {
        owner.deliver(getChannel(), new Delivery(consumerTag, envelope, properties, body), handler);
    }
}
