package com.loadreplay;

import java.io.Closeable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Fires requests without waiting for them and routes each result to the sink.
 *
 * Every dispatched request is tracked in an owned set until it resolves, so that
 * {@link #drain()} can cancel whatever is still in flight when the run ends.
 * Results reach the sink through a single delivery thread; responses may arrive in
 * any order relative to dispatch order.
 */
public class ReplayDispatcher implements Closeable {

    private final ReplayTransport transport;
    private final ResponseSink sink;
    private final boolean verbose;

    // Single thread: the sink is only ever touched from here
    private final ExecutorService deliveryExecutor;

    private final Set<DispatchedRequest> outstanding = ConcurrentHashMap.newKeySet();
    private final Semaphore capacity; // null when unbounded

    private final AtomicInteger dispatchedCount = new AtomicInteger(0);
    private final AtomicInteger deliveredCount = new AtomicInteger(0);
    private final AtomicInteger transportFailures = new AtomicInteger(0);
    private final AtomicReference<Throwable> deliveryFailure = new AtomicReference<>();

    public ReplayDispatcher(ReplayTransport transport, ResponseSink sink, int maxOutstanding, boolean verbose) {
        if (maxOutstanding < 0) {
            throw new IllegalArgumentException("max outstanding must be >= 0, got " + maxOutstanding);
        }
        this.transport = transport;
        this.sink = sink;
        this.verbose = verbose;
        this.capacity = maxOutstanding > 0 ? new Semaphore(maxOutstanding) : null;
        this.deliveryExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "replay-delivery");
            t.setDaemon(true);
            return t;
        });
    }

    public ReplayDispatcher(ReplayTransport transport, ResponseSink sink) {
        this(transport, sink, 0, false);
    }

    private void log(String msg) {
        if (verbose) {
            System.out.println("[Replay] " + msg);
        }
    }

    /**
     * Waits until another request may be put in flight. Always true without a cap.
     * With a cap, a successful call reserves the slot that the next {@link #dispatch}
     * uses.
     */
    public boolean awaitCapacity(Duration timeout) throws InterruptedException {
        if (capacity == null) {
            return true;
        }
        return capacity.tryAcquire(Math.max(timeout.toNanos(), 0), TimeUnit.NANOSECONDS);
    }

    /**
     * Hands the event to the transport and returns immediately.
     */
    public DispatchedRequest dispatch(RequestEvent event) {
        long start = System.nanoTime();
        CompletableFuture<ReplayResponse> response;
        try {
            response = transport.send(event);
        } catch (RuntimeException e) {
            releaseCapacity();
            throw e;
        }

        CompletableFuture<Void> resolution = response
                .handle((result, error) -> normalize(event, result, error, start))
                .thenAcceptAsync(this::deliver, deliveryExecutor);

        DispatchedRequest unit = new DispatchedRequest(event, response, resolution);
        outstanding.add(unit);
        dispatchedCount.incrementAndGet();
        resolution.whenComplete((ignored, error) -> {
            // record before removal so a concurrent drain() cannot miss it
            if (error != null) {
                deliveryFailure.compareAndSet(null, unwrap(error));
            }
            outstanding.remove(unit);
            releaseCapacity();
        });
        return unit;
    }

    private ReplayResponse normalize(RequestEvent event, ReplayResponse result, Throwable error, long startNanos) {
        if (error == null) {
            return result;
        }
        Throwable cause = unwrap(error);
        if (cause instanceof CancellationException) {
            // cancelled at drain time: nothing reaches the sink
            return null;
        }
        long latencyMs = (System.nanoTime() - startNanos) / 1_000_000;
        transportFailures.incrementAndGet();
        log(String.format("ERROR %s %s: %s", event.getMethod(), event.getPath(), cause.getMessage()));
        return ReplayResponse.transportFailure(event.getPath(), latencyMs, cause);
    }

    private void deliver(ReplayResponse response) {
        if (response == null) {
            return;
        }
        sink.process(response);
        deliveredCount.incrementAndGet();
    }

    private void releaseCapacity() {
        if (capacity != null) {
            capacity.release();
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    /**
     * Cancels every request still in flight and waits until each one is resolved.
     * A request that completed before its cancel took effect is delivered as usual.
     *
     * @return number of requests that were actually cancelled
     * @throws CompletionException if the sink failed while processing a response
     */
    public int drain() {
        List<DispatchedRequest> pending = new ArrayList<>(outstanding);
        int cancelled = 0;
        for (DispatchedRequest unit : pending) {
            if (unit.cancel()) {
                cancelled++;
            }
        }
        for (DispatchedRequest unit : pending) {
            try {
                unit.resolution().join();
            } finally {
                outstanding.remove(unit);
            }
        }
        log(String.format("Drained %d in-flight requests (%d cancelled)", pending.size(), cancelled));

        Throwable failure = deliveryFailure.get();
        if (failure != null) {
            throw new CompletionException("response sink failed", failure);
        }
        return cancelled;
    }

    /**
     * Number of dispatched requests not yet resolved.
     */
    public int getOutstandingCount() {
        return outstanding.size();
    }

    public int getDispatchedCount() {
        return dispatchedCount.get();
    }

    public int getDeliveredCount() {
        return deliveredCount.get();
    }

    public int getTransportFailureCount() {
        return transportFailures.get();
    }

    /**
     * Stops the delivery thread once already queued deliveries have run.
     */
    @Override
    public void close() {
        deliveryExecutor.shutdown();
        try {
            if (!deliveryExecutor.awaitTermination(30, TimeUnit.SECONDS)) {
                log("Warning: Timeout waiting for response delivery to finish");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
