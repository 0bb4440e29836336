package com.loadreplay;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class TimedReplayExecutorTest {

    private static final Instant REAL_START = Instant.parse("2024-01-01T00:00:00Z");

    private MutableClock clock;
    private Sleeper sleeper;
    private ElasticsearchResponseAccumulator accumulator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(REAL_START);
        sleeper = clock::advance;
        accumulator = new ElasticsearchResponseAccumulator();
    }

    private static ReplayConfig config(double speed, Duration budget) {
        return ReplayConfig.builder()
                .speedMultiplier(speed)
                .runTime(budget)
                .build();
    }

    private TimedReplayExecutor executor(RequestSource source, ReplayTransport transport, ReplayConfig config) {
        return new TimedReplayExecutor(source, transport, accumulator, config, clock, sleeper);
    }

    private static List<Duration> offsetsFromFirst(List<Instant> sendTimes) {
        List<Duration> offsets = new ArrayList<>();
        for (Instant t : sendTimes) {
            offsets.add(Duration.between(sendTimes.get(0), t));
        }
        return offsets;
    }

    private static long count200(ElasticsearchResponseAccumulator accumulator) {
        return accumulator.getCompletionStatusCounts().getOrDefault(200, 0L);
    }

    @Test
    @DisplayName("Real-time replay dispatches at the logged offsets")
    void realTimeReplayKeepsLoggedOffsets() throws Exception {
        StubTransport transport = StubTransport.instant(clock, 1);
        TimedReplayExecutor executor = executor(ListRequestSource.atSeconds(0, 5, 10), transport,
                config(1.0, Duration.ofSeconds(12)));

        RunStats stats = executor.run();

        List<Duration> offsets = offsetsFromFirst(transport.getSendTimes());
        assertEquals(Duration.ZERO, offsets.get(0));
        assertEquals(Duration.ofSeconds(5), offsets.get(1));
        assertEquals(Duration.ofSeconds(10), offsets.get(2));
        // the wrapped first event sits on the same log instant as the last one
        assertEquals(Duration.ofSeconds(10), offsets.get(3));
        assertEquals(4, stats.getSentCount());
        assertEquals(Duration.ofSeconds(12), stats.getElapsed());
    }

    @Test
    @DisplayName("Double speed dispatches the same capture in half the time")
    void doubleSpeedHalvesDispatchOffsets() throws Exception {
        StubTransport transport = StubTransport.instant(clock, 1);
        TimedReplayExecutor executor = executor(ListRequestSource.atSeconds(0, 5, 10), transport,
                config(2.0, Duration.ofSeconds(6)));

        executor.run();

        List<Duration> offsets = offsetsFromFirst(transport.getSendTimes());
        assertEquals(Duration.ZERO, offsets.get(0));
        assertEquals(Duration.ofMillis(2500), offsets.get(1));
        assertEquals(Duration.ofSeconds(5), offsets.get(2));
    }

    @Test
    @DisplayName("Nothing is dispatched once the budget is spent")
    void stopsDispatchingAtBudget() throws Exception {
        StubTransport transport = StubTransport.instant(clock, 1);
        Duration budget = Duration.ofSeconds(30);
        ListRequestSource source = ListRequestSource.atSeconds(0, 1, 2, 3);
        TimedReplayExecutor executor = executor(source, transport, config(1.0, budget));

        RunStats stats = executor.run();

        Instant cutoff = REAL_START.plus(budget);
        for (Instant sent : transport.getSendTimes()) {
            assertTrue(sent.isBefore(cutoff), "dispatched at " + sent + " after cutoff " + cutoff);
        }
        assertTrue(source.getPasses() > 1, "source should have been cycled");
        assertEquals(RunState.DONE, executor.getState());
        assertEquals(budget, stats.getElapsed());
        assertEquals(transport.getSendTimes().size(), stats.getSentCount());
    }

    @Test
    @DisplayName("In-flight requests are cancelled at the end and never reach the sink")
    void drainCancelsEverythingInFlight() throws Exception {
        StubTransport transport = StubTransport.hanging(clock);
        TimedReplayExecutor executor = executor(ListRequestSource.atSeconds(0, 1, 2), transport,
                config(1.0, Duration.ofSeconds(10)));

        RunStats stats = executor.run();

        long cancelled = transport.getFutures().stream().filter(CompletableFuture::isCancelled).count();
        assertTrue(stats.getSentCount() > 0);
        assertEquals(stats.getSentCount(), stats.getOutstandingCount());
        assertEquals(cancelled, stats.getOutstandingCount());
        assertEquals(0, executor.getDispatcher().getOutstandingCount());
        assertTrue(accumulator.getCompletionStatusCounts().isEmpty());
    }

    @Test
    @DisplayName("Outstanding count only covers requests that were still in flight")
    void outstandingCountsOnlyUnfinishedRequests() throws Exception {
        AtomicInteger seq = new AtomicInteger();
        StubTransport transport = new StubTransport(clock, event -> seq.getAndIncrement() % 2 == 0
                ? CompletableFuture.completedFuture(StubTransport.ok(event, 7))
                : new CompletableFuture<>());
        TimedReplayExecutor executor = executor(ListRequestSource.atSeconds(0, 1, 2, 3), transport,
                config(1.0, Duration.ofSeconds(20)));

        RunStats stats = executor.run();

        long hanging = transport.getFutures().stream().filter(f -> !f.isDone() || f.isCancelled()).count();
        assertEquals(hanging, stats.getOutstandingCount());
        assertEquals(stats.getSentCount() - stats.getOutstandingCount(), count200(accumulator));
        assertEquals(0, executor.getDispatcher().getOutstandingCount());
    }

    @Test
    @DisplayName("Transport failures are recorded instead of ending the run")
    void transportFailuresAreRecorded() throws Exception {
        StubTransport transport = StubTransport.refusing(clock);
        TimedReplayExecutor executor = executor(ListRequestSource.atSeconds(0, 1, 2), transport,
                config(1.0, Duration.ofSeconds(5)));

        RunStats stats = executor.run();

        Map<Integer, Long> counts = accumulator.getCompletionStatusCounts();
        assertEquals(Map.of(ReplayResponse.TRANSPORT_FAILURE_STATUS, (long) stats.getSentCount()), counts);
        assertEquals(0, stats.getOutstandingCount());
        assertNull(accumulator.getAverageTimePerSuccessfulRequest());
        assertEquals(stats.getSentCount(), executor.getDispatcher().getTransportFailureCount());
    }

    @Test
    @DisplayName("Ten minute replay of a three event capture keeps up")
    void tenMinuteScenario() throws Exception {
        StubTransport transport = StubTransport.instant(clock, 1);
        ListRequestSource source = ListRequestSource.atSeconds(0, 1, 2);
        TimedReplayExecutor executor = executor(source, transport, config(1.0, Duration.ofMinutes(10)));

        RunStats stats = executor.run();

        assertTrue(stats.getSentCount() > 3, "extra passes should fit in ten minutes");
        assertEquals(0, stats.getOutstandingCount());
        assertEquals(stats.getSentCount(), count200(accumulator));
        assertEquals(1.0, accumulator.getAverageTimePerSuccessfulRequest(), 1e-9);
        assertEquals(0.0, stats.getSecondsBehind(), 1e-9);
        assertEquals(0.0, stats.getPercentageBehind(), 1e-9);
        assertEquals(10.0, stats.getElapsedMinutes(), 1e-9);
    }

    @Test
    @DisplayName("Lag is reported when pacing cannot keep up")
    void reportsLagWhenFallingBehind() throws Exception {
        sleeper = duration -> clock.advance(duration.plusSeconds(2));
        StubTransport transport = StubTransport.instant(clock, 1);
        TimedReplayExecutor executor = executor(ListRequestSource.atSeconds(0, 1, 2), transport,
                config(1.0, Duration.ofSeconds(20)));

        RunStats stats = executor.run();

        assertTrue(stats.getSecondsBehind() > 0);
        assertEquals(stats.getSecondsBehind() / stats.getElapsedSeconds(), stats.getPercentageBehind(), 1e-12);
    }

    @Test
    @DisplayName("A capped replay stops when no slot frees up before the budget ends")
    void capStopsTheLoopWhenSaturated() throws Exception {
        StubTransport transport = StubTransport.hanging(clock);
        ReplayConfig capped = ReplayConfig.builder()
                .speedMultiplier(1.0)
                .runTime(Duration.ofMillis(2100))
                .maxOutstanding(2)
                .build();
        TimedReplayExecutor executor = executor(ListRequestSource.atSeconds(0, 1, 2), transport, capped);

        RunStats stats = executor.run();

        assertEquals(2, stats.getSentCount());
        assertEquals(2, stats.getOutstandingCount());
    }

    @Test
    @DisplayName("A malformed event aborts the run")
    void malformedEventIsFatal() {
        StubTransport transport = StubTransport.hanging(clock);
        RequestSource broken = new RequestSource() {
            @Override
            public Stream<RequestEvent> openPass() {
                return Stream.of("ok", "bad").map(s -> {
                    if (s.equals("bad")) {
                        throw new MalformedEventException(2, "not a slow log entry");
                    }
                    return new RequestEvent(ListRequestSource.LOG_START, "POST", "/i/_search", null);
                });
            }

            @Override
            public String describe() {
                return "broken";
            }
        };
        TimedReplayExecutor executor = executor(broken, transport, config(1.0, Duration.ofMinutes(1)));

        MalformedEventException e = assertThrows(MalformedEventException.class, executor::run);

        assertEquals(2, e.getLineNumber());
        assertEquals(RunState.DONE, executor.getState());
        assertEquals(1, transport.getFutures().size());
        assertTrue(transport.getFutures().get(0).isCancelled());
    }

    @Test
    @DisplayName("An empty capture is rejected instead of spinning")
    void emptySourceIsRejected() {
        TimedReplayExecutor executor = executor(new ListRequestSource(List.of()),
                StubTransport.instant(clock, 1), config(1.0, Duration.ofMinutes(1)));

        assertThrows(IllegalStateException.class, executor::run);
    }

    @Test
    @DisplayName("An executor runs only once")
    void runsOnlyOnce() throws Exception {
        TimedReplayExecutor executor = executor(ListRequestSource.atSeconds(0, 1),
                StubTransport.instant(clock, 1), config(1.0, Duration.ofSeconds(3)));
        assertEquals(RunState.IDLE, executor.getState());

        executor.run();

        assertThrows(IllegalStateException.class, executor::run);
    }

    @Test
    @DisplayName("Interruption while pacing drains and keeps the interrupt flag")
    void interruptDrainsEarly() throws Exception {
        AtomicInteger sleeps = new AtomicInteger();
        sleeper = duration -> {
            if (sleeps.incrementAndGet() == 3) {
                throw new InterruptedException();
            }
            clock.advance(duration);
        };
        StubTransport transport = StubTransport.instant(clock, 1);
        TimedReplayExecutor executor = executor(ListRequestSource.atSeconds(0, 1, 2), transport,
                config(1.0, Duration.ofMinutes(5)));

        RunStats stats = executor.run();

        assertTrue(Thread.interrupted());
        assertEquals(2, stats.getSentCount());
        assertEquals(RunState.DONE, executor.getState());
    }

    @Test
    @DisplayName("Real clock pacing at high speed")
    void realClockPacing() throws Exception {
        Clock system = Clock.systemUTC();
        StubTransport transport = StubTransport.instant(system, 1);
        ReplayConfig fast = ReplayConfig.builder()
                .speedMultiplier(100)
                .runTime(Duration.ofMillis(300))
                .build();
        TimedReplayExecutor executor = new TimedReplayExecutor(ListRequestSource.atSeconds(0, 2, 4),
                transport, accumulator, fast, system, Sleeper.SYSTEM);

        RunStats stats = executor.run();

        List<Duration> offsets = offsetsFromFirst(transport.getSendTimes());
        assertTrue(offsets.size() >= 3);
        assertTrue(offsets.get(1).toMillis() >= 15, "second dispatch too early: " + offsets.get(1));
        assertTrue(offsets.get(2).toMillis() >= 35, "third dispatch too early: " + offsets.get(2));
        assertTrue(stats.getElapsed().compareTo(Duration.ofMillis(300)) >= 0);
    }
}
