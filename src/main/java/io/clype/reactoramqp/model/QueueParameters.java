package io.clype.reactoramqp.model;

import java.util.Map;
import java.util.Objects;

/**
 * Queue declaration settings, replayed on every reconnect.
 *
 * <p>An empty {@code name} asks the broker to generate one; the generated name is returned
 * by the declaration. A {@code passive} declaration only checks that the queue exists.</p>
 *
 * @param name       queue name, or empty for a broker-generated name
 * @param passive    only check for existence, never create
 * @param durable    survive a broker restart
 * @param exclusive  restricted to the declaring connection
 * @param autodelete deleted once the last consumer is gone
 * @param arguments  extra declaration arguments (x-message-ttl, ...)
 */
public record QueueParameters(
    String name,
    boolean passive,
    boolean durable,
    boolean exclusive,
    boolean autodelete,
    Map<String, Object> arguments
) {

    public QueueParameters {
        Objects.requireNonNull(name, "name cannot be null");
        arguments = arguments == null ? Map.of() : Map.copyOf(arguments);
    }

    /**
     * Non-durable, non-exclusive, auto-deleted queue with no arguments.
     */
    public QueueParameters(String name, boolean passive) {
        this(name, passive, false, false, true, Map.of());
    }
}
