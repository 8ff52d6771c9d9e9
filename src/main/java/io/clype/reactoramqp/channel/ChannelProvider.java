package io.clype.reactoramqp.channel;

/**
 * The party that owns the physical broker connection and hands out channels.
 *
 * <p>Implementations answer {@link #requestChannel(ChannelOwner)} asynchronously: they either
 * call {@link ChannelOwner#channelAvailable(com.rabbitmq.client.Channel)} with a fresh open
 * channel, or do nothing at all, in which case the owner simply asks again on its next tick.
 * Whenever a channel that was handed out becomes unusable, the provider must call
 * {@link ChannelOwner#channelLost(com.rabbitmq.client.Channel, com.rabbitmq.client.ShutdownSignalException)}.
 * Repeated requests from the same owner must be tolerated.</p>
 */
public interface ChannelProvider {

    /**
     * Asks for a new channel on behalf of {@code requester}. Must not block.
     *
     * @param requester the owner to hand the channel to
     */
    void requestChannel(ChannelOwner requester);
}
