package com.loadreplay.source;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.loadreplay.MalformedEventException;
import com.loadreplay.RequestEvent;
import com.loadreplay.RequestSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

/**
 * Reads requests from a JSONL capture, one event per line:
 * <pre>
 * {"ts": 1700000000123, "endpoint": "/api/v1/plays", "method": "POST", "payload": {...}}
 * </pre>
 * {@code ts} is epoch milliseconds; {@code method} defaults to POST.
 */
public class JsonlRequestSource implements RequestSource {

    private final Path jsonlPath;

    public JsonlRequestSource(Path jsonlPath) {
        this.jsonlPath = jsonlPath;
    }

    @Override
    public Stream<RequestEvent> openPass() throws IOException {
        AtomicLong lineNumber = new AtomicLong(0);
        return Files.lines(jsonlPath, StandardCharsets.UTF_8)
                .map(line -> parseLine(lineNumber.incrementAndGet(), line))
                .filter(Objects::nonNull);
    }

    @Override
    public String describe() {
        return "jsonl " + jsonlPath;
    }

    static RequestEvent parseLine(long lineNumber, String line) {
        if (line.trim().isEmpty()) {
            return null;
        }

        JsonObject event;
        try {
            JsonElement parsed = JsonParser.parseString(line);
            if (!parsed.isJsonObject()) {
                throw new MalformedEventException(lineNumber, "expected a JSON object");
            }
            event = parsed.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new MalformedEventException(lineNumber, "invalid JSON: " + e.getMessage(), e);
        }

        if (!event.has("ts") || !event.has("payload") || !event.has("endpoint")) {
            throw new MalformedEventException(lineNumber, "missing ts, endpoint or payload");
        }

        try {
            Instant timestamp = Instant.ofEpochMilli(event.get("ts").getAsLong());
            String method = event.has("method") ? event.get("method").getAsString() : "POST";
            String endpoint = event.get("endpoint").getAsString();
            return new RequestEvent(timestamp, method, endpoint, event.get("payload"));
        } catch (ClassCastException | IllegalStateException | UnsupportedOperationException | NumberFormatException e) {
            throw new MalformedEventException(lineNumber, "bad field value: " + e.getMessage(), e);
        }
    }
}
