package io.clype.reactoramqp.channel;

import java.io.IOException;

import com.rabbitmq.client.Channel;

/**
 * Hook run on the owner's worker every time a new channel has been acquired, after QoS and
 * the return listener are in place and before the owner reports itself connected.
 *
 * <p>Runs again after every reconnect, so whatever it declares must be idempotent.</p>
 */
@FunctionalInterface
public interface ChannelInitializer {

    /** Initializer for owners that only publish. */
    ChannelInitializer NONE = channel -> { };

    void onChannel(Channel channel) throws IOException;
}
