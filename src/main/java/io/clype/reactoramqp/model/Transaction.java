package io.clype.reactoramqp.model;

import java.util.List;
import java.util.Objects;

/**
 * Publishes sent as one broker transaction (tx.select, publish all, tx.commit).
 *
 * @param publishes the messages, published in list order
 */
public record Transaction(List<Publish> publishes) {

    public Transaction {
        Objects.requireNonNull(publishes, "publishes cannot be null");
        publishes = List.copyOf(publishes);
    }
}
