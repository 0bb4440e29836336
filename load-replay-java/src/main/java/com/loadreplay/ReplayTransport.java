package com.loadreplay;

import java.io.Closeable;
import java.util.concurrent.CompletableFuture;

/**
 * Sends a single request without blocking the caller.
 */
public interface ReplayTransport extends Closeable {

    /**
     * Starts the request and returns a future for its response. The future fails with an
     * {@link java.io.IOException} on transport-level errors (connection refused, malformed
     * response). Cancelling the future aborts the request.
     */
    CompletableFuture<ReplayResponse> send(RequestEvent event);

    @Override
    void close();
}
