package io.clype.reactoramqp.consumer;

import io.clype.reactoramqp.model.Delivery;

/**
 * Observer of the deliveries an {@link AmqpConsumer} receives.
 *
 * <p>Called on the consumer's worker, one delivery at a time. Deliveries from bindings that
 * are not auto-ack must be settled through {@link AmqpConsumer#ack(long)} or
 * {@link AmqpConsumer#reject(long, boolean)}.</p>
 */
@FunctionalInterface
public interface DeliveryListener {

    void onDelivery(Delivery delivery);
}
