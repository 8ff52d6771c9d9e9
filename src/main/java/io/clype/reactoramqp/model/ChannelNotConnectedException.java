package io.clype.reactoramqp.model;

/**
 * Signals a command that reached a channel owner while it held no channel.
 *
 * <p>Commands are never buffered across a reconnect; the caller decides whether to retry.</p>
 */
public class ChannelNotConnectedException extends RuntimeException {

    private final String ownerName;
    private final String operation;

    public ChannelNotConnectedException(String ownerName, String operation) {
        super(String.format("Cannot %s: channel owner '%s' is not connected", operation, ownerName));
        this.ownerName = ownerName;
        this.operation = operation;
    }

    public String getOwnerName() {
        return ownerName;
    }

    public String getOperation() {
        return operation;
    }
}
