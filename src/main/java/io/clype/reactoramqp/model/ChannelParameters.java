package io.clype.reactoramqp.model;

/**
 * Settings applied once to every freshly acquired channel, before any topology is declared.
 *
 * @param prefetchCount maximum number of unacknowledged deliveries the broker pushes
 *                      to this channel (basic.qos)
 */
public record ChannelParameters(int prefetchCount) {

    public ChannelParameters {
        if (prefetchCount < 0) {
            throw new IllegalArgumentException("prefetchCount must not be negative");
        }
    }
}
