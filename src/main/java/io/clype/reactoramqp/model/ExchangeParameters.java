package io.clype.reactoramqp.model;

import java.util.Map;
import java.util.Objects;

/**
 * Exchange declaration settings, replayed on every reconnect.
 *
 * @param name         exchange name
 * @param passive      only check for existence, never create
 * @param exchangeType direct, fanout, topic or headers
 * @param durable      survive a broker restart
 * @param autodelete   deleted once the last binding is gone
 * @param arguments    extra declaration arguments (alternate-exchange, ...)
 */
public record ExchangeParameters(
    String name,
    boolean passive,
    String exchangeType,
    boolean durable,
    boolean autodelete,
    Map<String, Object> arguments
) {

    public ExchangeParameters {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(exchangeType, "exchangeType cannot be null");
        arguments = arguments == null ? Map.of() : Map.copyOf(arguments);
    }

    /**
     * Non-durable, non-auto-deleted exchange with no arguments.
     */
    public ExchangeParameters(String name, boolean passive, String exchangeType) {
        this(name, passive, exchangeType, false, false, Map.of());
    }
}
