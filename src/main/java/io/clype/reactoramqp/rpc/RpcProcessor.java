package io.clype.reactoramqp.rpc;

/**
 * Business logic behind an {@link RpcServer}.
 */
public interface RpcProcessor {

    /**
     * Handles one request body and produces the reply body.
     *
     * @throws Exception on any processing failure; the server requeues the request once and
     *                   answers with {@link #onFailure(Exception)} if the retry fails too
     */
    byte[] process(byte[] body) throws Exception;

    /**
     * Builds the reply sent when a request failed on its second attempt. Must not throw.
     *
     * @param e the failure of the second attempt
     */
    byte[] onFailure(Exception e);
}
