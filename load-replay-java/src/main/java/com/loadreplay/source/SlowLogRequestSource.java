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
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Reads search requests from an Elasticsearch search slow log.
 *
 * Each {@code query} phase entry becomes a {@code POST /{index}/_search} whose body is the
 * logged {@code source} merged with {@code extra_source}. Entries of other phases (fetch)
 * are skipped. A line that does not look like a slow log entry aborts the replay.
 */
public class SlowLogRequestSource implements RequestSource {

    private static final Pattern ENTRY = Pattern.compile(
            "^\\[(?<timestamp>.*?)\\]\\[.*?\\]\\[(?<requestType>.*?)\\]\\s*\\[(?<index>.*?)\\]"
                    + ".*source\\[(?<source>.*)\\],\\s*extra_source\\[(?<extraSource>.*)\\]");

    private static final String QUERY_PHASE = "query";

    private final Path logFile;

    public SlowLogRequestSource(Path logFile) {
        this.logFile = logFile;
    }

    @Override
    public Stream<RequestEvent> openPass() throws IOException {
        AtomicLong lineNumber = new AtomicLong(0);
        return Files.lines(logFile, StandardCharsets.UTF_8)
                .map(line -> parseLine(lineNumber.incrementAndGet(), line))
                .filter(Objects::nonNull);
    }

    @Override
    public String describe() {
        return "slow log " + logFile;
    }

    /**
     * Parses one log line.
     *
     * @return the event, or {@code null} if the line is blank or not a query phase entry
     */
    static RequestEvent parseLine(long lineNumber, String line) {
        if (line.isBlank()) {
            return null;
        }
        Matcher m = ENTRY.matcher(line);
        if (!m.find()) {
            throw new MalformedEventException(lineNumber, "not a slow log entry: " + abbreviate(line));
        }

        String requestType = m.group("requestType");
        String phase = requestType.substring(requestType.lastIndexOf('.') + 1);
        if (!QUERY_PHASE.equals(phase)) {
            return null;
        }

        Instant timestamp = parseTimestamp(lineNumber, m.group("timestamp"));
        String path = "/" + m.group("index") + "/_search";
        JsonObject body = new JsonObject();
        try {
            merge(body, m.group("source"), lineNumber, "source");
            merge(body, m.group("extraSource"), lineNumber, "extra_source");
        } catch (JsonParseException e) {
            throw new MalformedEventException(lineNumber, "invalid JSON body: " + e.getMessage(), e);
        }
        return new RequestEvent(timestamp, "POST", path, body);
    }

    private static void merge(JsonObject target, String raw, long lineNumber, String field) {
        if (raw == null || raw.isEmpty()) {
            return;
        }
        JsonElement parsed = JsonParser.parseString(raw);
        if (!parsed.isJsonObject()) {
            throw new MalformedEventException(lineNumber, field + " is not a JSON object");
        }
        for (Map.Entry<String, JsonElement> entry : parsed.getAsJsonObject().entrySet()) {
            target.add(entry.getKey(), entry.getValue());
        }
    }

    /**
     * Slow log timestamps look like {@code 2018-03-12T17:37:25,123}. Without an offset they
     * are read as UTC; only differences between them matter.
     */
    static Instant parseTimestamp(long lineNumber, String raw) {
        String normalized = raw.trim().replace(',', '.').replaceFirst(" ", "T");
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(normalized,
                    OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime) {
                return ((OffsetDateTime) parsed).toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new MalformedEventException(lineNumber, "bad timestamp: " + raw, e);
        }
    }

    private static String abbreviate(String line) {
        return line.length() > 120 ? line.substring(0, 120) + "..." : line;
    }
}
