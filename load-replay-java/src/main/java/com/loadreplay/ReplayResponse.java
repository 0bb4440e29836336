package com.loadreplay;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * Normalized result of one dispatched request, handed to the {@link ResponseSink}.
 */
public final class ReplayResponse {

    /** Status recorded when the request never produced an HTTP response. */
    public static final int TRANSPORT_FAILURE_STATUS = 0;

    private final int status;
    private final JsonElement body;
    private final String path;
    private final long latencyMillis;
    private final String error;

    public ReplayResponse(int status, JsonElement body, String path, long latencyMillis) {
        this(status, body, path, latencyMillis, null);
    }

    private ReplayResponse(int status, JsonElement body, String path, long latencyMillis, String error) {
        this.status = status;
        this.body = body;
        this.path = path;
        this.latencyMillis = latencyMillis;
        this.error = error;
    }

    public static ReplayResponse transportFailure(String path, long latencyMillis, Throwable cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new ReplayResponse(TRANSPORT_FAILURE_STATUS, null, path, latencyMillis, message);
    }

    public int getStatus() {
        return status;
    }

    public JsonElement getBody() {
        return body;
    }

    /**
     * Body as an object, or {@code null} if it is missing or not a JSON object.
     */
    public JsonObject getBodyObject() {
        return body != null && body.isJsonObject() ? body.getAsJsonObject() : null;
    }

    public String getPath() {
        return path;
    }

    public long getLatencyMillis() {
        return latencyMillis;
    }

    public String getError() {
        return error;
    }

    public boolean isTransportFailure() {
        return status == TRANSPORT_FAILURE_STATUS;
    }
}
