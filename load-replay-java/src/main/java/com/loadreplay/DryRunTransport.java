package com.loadreplay;

import com.google.gson.JsonObject;

import java.util.concurrent.CompletableFuture;

/**
 * Answers every request locally with {@code 200 {"took": 0}}. Useful to check the pacing
 * of a capture without touching the target service.
 */
public class DryRunTransport implements ReplayTransport {

    private final boolean verbose;

    public DryRunTransport(boolean verbose) {
        this.verbose = verbose;
    }

    @Override
    public CompletableFuture<ReplayResponse> send(RequestEvent event) {
        if (verbose) {
            System.out.println(String.format("[DRY-RUN] Would %s to %s", event.getMethod(), event.getPath()));
        }
        JsonObject body = new JsonObject();
        body.addProperty("took", 0);
        return CompletableFuture.completedFuture(new ReplayResponse(200, body, event.getPath(), 0));
    }

    @Override
    public void close() {
        // nothing held
    }
}
