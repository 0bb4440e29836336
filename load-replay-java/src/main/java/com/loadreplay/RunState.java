package com.loadreplay;

/**
 * Lifecycle of a {@link TimedReplayExecutor}.
 */
public enum RunState {
    IDLE,
    RUNNING,
    DRAINING,
    DONE
}
