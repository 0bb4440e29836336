package com.loadreplay;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.stream.Stream;

/**
 * Timed Replay Executor - replays a capture over and over against one destination,
 * paced by the capture's own timestamps, until the wall-clock budget runs out.
 *
 * The pacing loop is the only thread that sleeps. Requests are dispatched without
 * waiting for them; when the budget is exhausted the loop stops, whatever is still in
 * flight is cancelled, and the run figures are assembled.
 *
 * Usage:
 * TimedReplayExecutor executor = new TimedReplayExecutor(source, transport, sink, config);
 * RunStats stats = executor.run();
 */
public class TimedReplayExecutor {

    private static final int PROGRESS_EVERY = 1000;

    private final RequestSource source;
    private final ReplayTimeline timeline;
    private final ReplayDispatcher dispatcher;
    private final Duration runBudget;
    private final Clock clock;
    private final Sleeper sleeper;
    private final boolean verbose;

    private volatile RunState state = RunState.IDLE;

    public TimedReplayExecutor(RequestSource source, ReplayTransport transport, ResponseSink sink,
            ReplayConfig config) {
        this(source, transport, sink, config, Clock.systemUTC(), Sleeper.SYSTEM);
    }

    public TimedReplayExecutor(RequestSource source, ReplayTransport transport, ResponseSink sink,
            ReplayConfig config, Clock clock, Sleeper sleeper) {
        this.source = source;
        this.clock = clock;
        this.sleeper = sleeper;
        this.runBudget = config.getRunTime();
        this.verbose = config.isVerbose();
        this.timeline = new ReplayTimeline(clock, config.getSpeedMultiplier());
        this.dispatcher = new ReplayDispatcher(transport, sink, config.getMaxOutstanding(), verbose);
    }

    private void log(String msg) {
        if (verbose) {
            System.out.println("[Replay] " + msg);
        }
    }

    /**
     * Runs the replay to the end of its budget. May be called once.
     *
     * @throws MalformedEventException if the source yields an entry it cannot parse
     * @throws IOException             if the source cannot be opened
     */
    public RunStats run() throws IOException {
        synchronized (this) {
            if (state != RunState.IDLE) {
                throw new IllegalStateException("replay already started, state=" + state);
            }
            state = RunState.RUNNING;
        }

        log("Starting replay from: " + source.describe());
        log(String.format("Speed multiplier: %.2fx, Run time: %.1f minutes",
                timeline.getSpeedMultiplier(), runBudget.toNanos() / 60e9));

        Instant startTime = clock.instant();
        Duration elapsed = Duration.ZERO;
        Duration lastSleep = null;
        int sent = 0;

        try {
            while (state == RunState.RUNNING) {
                timeline.startCycle();
                int yielded = 0;

                try (Stream<RequestEvent> pass = source.openPass()) {
                    Iterator<RequestEvent> events = pass.iterator();
                    while (state == RunState.RUNNING && events.hasNext()) {
                        RequestEvent event = events.next();
                        yielded++;

                        Duration sleep = timeline.nextSleep(event.getTimestamp());
                        lastSleep = sleep;

                        Duration remaining = runBudget.minus(Duration.between(startTime, clock.instant()));
                        boolean slept = pause(clamp(sleep, remaining));
                        elapsed = Duration.between(startTime, clock.instant());

                        if (!slept || elapsed.compareTo(runBudget) >= 0) {
                            state = RunState.DRAINING;
                            break;
                        }
                        if (!reserveSlot(runBudget.minus(elapsed))) {
                            elapsed = Duration.between(startTime, clock.instant());
                            state = RunState.DRAINING;
                            break;
                        }

                        dispatcher.dispatch(event);
                        sent++;
                        if (sent % PROGRESS_EVERY == 0) {
                            log(String.format("Sent %d requests (%d in flight, %.1fs elapsed)",
                                    sent, dispatcher.getOutstandingCount(), elapsed.toMillis() / 1000.0));
                        }
                    }
                }

                if (state == RunState.RUNNING) {
                    if (yielded == 0) {
                        throw new IllegalStateException("request source yielded no events: " + source.describe());
                    }
                    log(String.format("Pass %d complete (%d events)", timeline.getState().getCycle(), yielded));
                }
            }
        } catch (IOException | RuntimeException e) {
            abort(e);
            throw e;
        }

        int cancelled = dispatcher.drain();
        dispatcher.close();
        state = RunState.DONE;

        RunStats stats = new RunStats(elapsed, sent, cancelled, lastSleep);
        log("Replay finished: " + stats);
        return stats;
    }

    private static Duration clamp(Duration sleep, Duration remaining) {
        if (sleep.isNegative()) {
            return Duration.ZERO;
        }
        if (remaining.isNegative()) {
            return Duration.ZERO;
        }
        return sleep.compareTo(remaining) > 0 ? remaining : sleep;
    }

    private boolean pause(Duration duration) {
        try {
            sleeper.sleep(duration);
            return true;
        } catch (InterruptedException e) {
            log("Interrupted while pacing, draining early");
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private boolean reserveSlot(Duration timeout) {
        try {
            return dispatcher.awaitCapacity(timeout);
        } catch (InterruptedException e) {
            log("Interrupted while waiting for a free slot, draining early");
            Thread.currentThread().interrupt();
            return false;
        }
    }

    // Fatal error: stop everything in flight, the run has no result.
    private void abort(Exception cause) {
        state = RunState.DRAINING;
        try {
            dispatcher.drain();
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
        } finally {
            dispatcher.close();
            state = RunState.DONE;
        }
    }

    public RunState getState() {
        return state;
    }

    public ReplayTimeline getTimeline() {
        return timeline;
    }

    public ReplayDispatcher getDispatcher() {
        return dispatcher;
    }
}
