package com.loadreplay;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Maps log-relative timestamps to real sleep intervals.
 *
 * The replay keeps a virtual clock that starts at the first event and advances
 * {@code speedMultiplier} times faster than the wall clock. Each call to
 * {@link #nextSleep(Instant)} answers how long to wait until the virtual clock reaches
 * the given event. When the capture wraps around, the log origin is moved back by the
 * length of one pass, so the repeated timestamps continue the timeline instead of
 * jumping back to its start.
 *
 * Timestamps within one pass are assumed to be non-decreasing; this is not checked.
 * Not thread-safe: the pacing loop is its only caller.
 */
public class ReplayTimeline {

    private final Clock clock;
    private final double speedMultiplier;
    private final TimelineState state = new TimelineState();

    public ReplayTimeline(Clock clock, double speedMultiplier) {
        if (!(speedMultiplier > 0)) {
            throw new IllegalArgumentException("speed multiplier must be > 0, got " + speedMultiplier);
        }
        this.clock = clock;
        this.speedMultiplier = speedMultiplier;
    }

    /**
     * Marks the start of a new pass over the capture. The next event seen is the
     * first event of that pass.
     */
    public void startCycle() {
        state.cycle++;
        state.awaitingFirstEvent = true;
    }

    /**
     * Time to wait before sending the event logged at {@code eventTimestamp}.
     * Negative when the replay is behind schedule; callers clamp before sleeping.
     */
    public Duration nextSleep(Instant eventTimestamp) {
        Instant now = clock.instant();
        if (state.replayStart == null) {
            state.replayStart = now;
        }

        if (state.awaitingFirstEvent || state.logOrigin == null) {
            state.awaitingFirstEvent = false;
            if (state.logOrigin == null) {
                state.logOrigin = eventTimestamp;
            } else {
                if (state.logDuration == null) {
                    // first wrap: the previous pass tells us how long the log is
                    state.logDuration = Duration.between(state.logOrigin, state.lastEventTimestamp);
                }
                state.logOrigin = state.logOrigin.minus(state.logDuration);
            }
        }
        state.lastEventTimestamp = eventTimestamp;

        double logTimeElapsed = Duration.between(state.logOrigin, eventTimestamp).toNanos();
        double realTimeElapsed = Duration.between(state.replayStart, now).toNanos() * speedMultiplier;
        double scaledTimeRemaining = logTimeElapsed - realTimeElapsed;
        return Duration.ofNanos(Math.round(scaledTimeRemaining / speedMultiplier));
    }

    public double getSpeedMultiplier() {
        return speedMultiplier;
    }

    public TimelineState getState() {
        return state;
    }
}
