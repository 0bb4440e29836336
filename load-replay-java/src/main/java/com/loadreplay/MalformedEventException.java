package com.loadreplay;

/**
 * Thrown when a captured entry cannot be turned into a {@link RequestEvent}.
 * There is no partial recovery: the whole replay aborts.
 */
public class MalformedEventException extends RuntimeException {

    private final long lineNumber;

    public MalformedEventException(long lineNumber, String message) {
        super(String.format("line %d: %s", lineNumber, message));
        this.lineNumber = lineNumber;
    }

    public MalformedEventException(long lineNumber, String message, Throwable cause) {
        super(String.format("line %d: %s", lineNumber, message), cause);
        this.lineNumber = lineNumber;
    }

    public long getLineNumber() {
        return lineNumber;
    }
}
