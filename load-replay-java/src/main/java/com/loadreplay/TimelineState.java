package com.loadreplay;

import java.time.Duration;
import java.time.Instant;

/**
 * Mutable bookkeeping behind {@link ReplayTimeline}.
 *
 * A {@code null} field means "not evaluated yet".
 */
public class TimelineState {

    // Log time treated as zero. Moves back by one log duration on each wrap.
    Instant logOrigin;
    // Real time of the first event of the whole run.
    Instant replayStart;
    // Span of one pass through the capture, known once the first pass is over.
    Duration logDuration;
    Instant lastEventTimestamp;
    int cycle;
    boolean awaitingFirstEvent;

    public Instant getLogOrigin() {
        return logOrigin;
    }

    public Instant getReplayStart() {
        return replayStart;
    }

    public Duration getLogDuration() {
        return logDuration;
    }

    public Instant getLastEventTimestamp() {
        return lastEventTimestamp;
    }

    /**
     * Number of passes started so far, 1 for the first pass.
     */
    public int getCycle() {
        return cycle;
    }
}
