package com.loadreplay;

import java.io.IOException;
import java.util.stream.Stream;

/**
 * A finite capture of requests that can be read from the start any number of times.
 *
 * The replay loop opens one pass after another; it is the {@link ReplayTimeline}
 * that turns the repeated timestamps into a continuing timeline.
 */
public interface RequestSource {

    /**
     * Opens a new pass over the capture. The stream is lazy and must be closed by the caller.
     * Every pass yields the same events in the same order.
     *
     * @throws MalformedEventException (from the stream) when an entry cannot be parsed
     */
    Stream<RequestEvent> openPass() throws IOException;

    /**
     * Short human readable description used in progress output.
     */
    String describe();
}
