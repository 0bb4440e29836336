package com.loadreplay;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Figures describing one finished replay run.
 */
public final class RunStats {

    private final Duration elapsed;
    private final int sentCount;
    private final int outstandingCount;
    private final double secondsBehind;

    public RunStats(Duration elapsed, int sentCount, int outstandingCount, Duration lastSleep) {
        this.elapsed = elapsed;
        this.sentCount = sentCount;
        this.outstandingCount = outstandingCount;
        double lastSleepSecs = lastSleep == null ? 0 : lastSleep.toNanos() / 1e9;
        // the last request should have gone out this many seconds ago
        this.secondsBehind = Math.max(-lastSleepSecs, 0);
    }

    public Duration getElapsed() {
        return elapsed;
    }

    public double getElapsedSeconds() {
        return elapsed.toNanos() / 1e9;
    }

    public double getElapsedMinutes() {
        return getElapsedSeconds() / 60.0;
    }

    public int getSentCount() {
        return sentCount;
    }

    /**
     * Requests still in flight at the cutoff, all of which were cancelled.
     */
    public int getOutstandingCount() {
        return outstandingCount;
    }

    public double getAverageRequestsPerSecond() {
        double secs = getElapsedSeconds();
        return secs > 0 ? sentCount / secs : 0;
    }

    public double getSecondsBehind() {
        return secondsBehind;
    }

    /**
     * Share of the run the replay was lagging by at its end. Zero means it kept up.
     * Not clamped: values above 1 mean the target was badly overloaded.
     */
    public double getPercentageBehind() {
        double secs = getElapsedSeconds();
        return secs > 0 ? secondsBehind / secs : 0;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("run_time_minutes", getElapsedMinutes());
        result.put("num_sent_requests", sentCount);
        result.put("average_requests_per_second", getAverageRequestsPerSecond());
        result.put("num_outstanding_requests", outstandingCount);
        result.put("seconds_behind", secondsBehind);
        result.put("percentage_behind", getPercentageBehind());
        return result;
    }

    @Override
    public String toString() {
        return String.format("RunStats{elapsed=%.1fs, sent=%d, outstanding=%d, behind=%.3fs}",
                getElapsedSeconds(), sentCount, outstandingCount, secondsBehind);
    }
}
