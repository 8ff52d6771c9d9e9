package io.clype.reactoramqp.model;

/**
 * Lifecycle state of a channel owner.
 *
 * <p>A channel handle is held if and only if the state is {@link #CONNECTED}.</p>
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTED
}
