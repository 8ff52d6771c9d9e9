package io.clype.reactoramqp.model;

import java.util.List;
import java.util.Objects;

/**
 * All replies collected for one RPC request.
 *
 * @param correlationId correlation id the request was published with
 * @param buffers       reply bodies in arrival order
 */
public record RpcResponse(String correlationId, List<byte[]> buffers) {

    public RpcResponse {
        Objects.requireNonNull(correlationId, "correlationId cannot be null");
        buffers = List.copyOf(buffers);
    }
}
