package com.loadreplay;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Keeps every response for export while passing it on to another sink.
 */
public class RecordingResponseSink implements ResponseSink {

    private final ResponseSink delegate;
    private final List<ReplayResponse> responses = Collections.synchronizedList(new ArrayList<>());

    public RecordingResponseSink(ResponseSink delegate) {
        this.delegate = delegate;
    }

    @Override
    public void process(ReplayResponse response) {
        responses.add(response);
        delegate.process(response);
    }

    @Override
    public Map<String, Object> summary() {
        return delegate.summary();
    }

    public List<ReplayResponse> getResponses() {
        synchronized (responses) {
            return new ArrayList<>(responses);
        }
    }
}
