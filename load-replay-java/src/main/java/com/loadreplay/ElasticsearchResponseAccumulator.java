package com.loadreplay;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Collects status counts and the server-reported {@code took} time of successful
 * Elasticsearch search responses.
 */
public class ElasticsearchResponseAccumulator implements ResponseSink {

    static final int SUCCESS_STATUS = 200;

    private final Map<Integer, Long> completionStatusCounts = new TreeMap<>();
    private double totalTookTime = 0;
    private long tookSamples = 0;
    private long successesWithoutTook = 0;

    @Override
    public void process(ReplayResponse response) {
        completionStatusCounts.merge(response.getStatus(), 1L, Long::sum);
        if (response.getStatus() != SUCCESS_STATUS) {
            return;
        }

        JsonObject body = response.getBodyObject();
        JsonElement took = body != null ? body.get("took") : null;
        if (took != null && took.isJsonPrimitive() && took.getAsJsonPrimitive().isNumber()) {
            totalTookTime += took.getAsDouble();
            tookSamples++;
        } else {
            successesWithoutTook++;
        }
    }

    /**
     * Mean {@code took} of successful responses, or {@code null} when there were none.
     */
    public Double getAverageTimePerSuccessfulRequest() {
        return tookSamples > 0 ? totalTookTime / tookSamples : null;
    }

    public Map<Integer, Long> getCompletionStatusCounts() {
        return new TreeMap<>(completionStatusCounts);
    }

    @Override
    public Map<String, Object> summary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("completion_status_counts", getCompletionStatusCounts());
        summary.put("average_time_per_successful_request", getAverageTimePerSuccessfulRequest());
        if (successesWithoutTook > 0) {
            summary.put("successful_requests_without_took", successesWithoutTook);
        }
        return summary;
    }
}
