package com.loadreplay;

import com.google.gson.JsonElement;

import java.time.Instant;
import java.util.Objects;

/**
 * One captured request: when it happened in the log, and what to send.
 */
public final class RequestEvent {

    private final Instant timestamp;
    private final String method;
    private final String path;
    private final JsonElement body;

    public RequestEvent(Instant timestamp, String method, String path, JsonElement body) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.method = Objects.requireNonNull(method, "method");
        this.path = Objects.requireNonNull(path, "path");
        // Copied on the way in and out; every cycle replays the same payload
        this.body = body == null ? null : body.deepCopy();
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getMethod() {
        return method;
    }

    public String getPath() {
        return path;
    }

    /**
     * Returns a copy of the request body, or {@code null} for a body-less request.
     */
    public JsonElement getBody() {
        return body == null ? null : body.deepCopy();
    }

    @Override
    public String toString() {
        return method + " " + path + " @ " + timestamp;
    }
}
