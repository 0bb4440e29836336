package com.loadreplay;

import java.util.Map;

/**
 * Accumulates statistics over the responses of a replay.
 *
 * Calls to {@link #process(ReplayResponse)} arrive from a single delivery thread, so
 * implementations need no locking of their own. {@link #summary()} is called once the
 * replay has drained.
 */
public interface ResponseSink {

    void process(ReplayResponse response);

    Map<String, Object> summary();
}
