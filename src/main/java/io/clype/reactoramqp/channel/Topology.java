package io.clype.reactoramqp.channel;

import java.io.IOException;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;

import io.clype.reactoramqp.model.ExchangeParameters;
import io.clype.reactoramqp.model.QueueParameters;

/**
 * Queue and exchange declarations shared by every specialization.
 *
 * <p>Declarations are idempotent on the broker side as long as the parameters do not change,
 * which is what makes replaying them after every reconnect safe.</p>
 */
public final class Topology {

    private Topology() {
    }

    /**
     * Declares a queue, or only checks for it when the parameters are passive.
     *
     * @return the broker's answer, whose {@code getQueue()} holds the effective
     *         (possibly broker-generated) queue name
     */
    public static AMQP.Queue.DeclareOk declareQueue(Channel channel, QueueParameters queue) throws IOException {
        if (queue.passive()) {
            return channel.queueDeclarePassive(queue.name());
        }
        return channel.queueDeclare(queue.name(), queue.durable(), queue.exclusive(),
                queue.autodelete(), queue.arguments());
    }

    /**
     * Declares an exchange, or only checks for it when the parameters are passive.
     */
    public static AMQP.Exchange.DeclareOk declareExchange(Channel channel, ExchangeParameters exchange)
            throws IOException {
        if (exchange.passive()) {
            return channel.exchangeDeclarePassive(exchange.name());
        }
        return channel.exchangeDeclare(exchange.name(), exchange.exchangeType(), exchange.durable(),
                exchange.autodelete(), exchange.arguments());
    }
}
