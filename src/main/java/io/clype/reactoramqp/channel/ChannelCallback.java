package io.clype.reactoramqp.channel;

import java.io.IOException;

import com.rabbitmq.client.Channel;

/**
 * Work executed against the owned channel on the owner's worker.
 *
 * @param <T> result type, {@code Void} for fire-and-forget commands
 */
@FunctionalInterface
public interface ChannelCallback<T> {

    T doWithChannel(Channel channel) throws IOException;
}
