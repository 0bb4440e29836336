package com.loadreplay;

import java.util.concurrent.CompletableFuture;

/**
 * A request that has been handed to the transport and may still be in flight.
 */
public final class DispatchedRequest {

    private final RequestEvent event;
    private final CompletableFuture<ReplayResponse> response;
    private final CompletableFuture<Void> resolution;

    DispatchedRequest(RequestEvent event, CompletableFuture<ReplayResponse> response,
            CompletableFuture<Void> resolution) {
        this.event = event;
        this.response = response;
        this.resolution = resolution;
    }

    public RequestEvent getEvent() {
        return event;
    }

    /**
     * Requests cancellation. Returns {@code false} when the response had already arrived,
     * in which case it is still delivered to the sink as a normal completion.
     */
    public boolean cancel() {
        return response.cancel(true);
    }

    /**
     * True once the response has been delivered to the sink, or the request was cancelled.
     */
    public boolean isResolved() {
        return resolution.isDone();
    }

    /**
     * Completes after delivery to the sink, or right after cancellation.
     */
    public CompletableFuture<Void> resolution() {
        return resolution;
    }
}
