package org.caureq.caureqsensorhub.service.pipeline;

public class RetriesExhaustedException extends RuntimeException {
    private final int attempts;

    public RetriesExhaustedException(String what, int attempts, Throwable last) {
        super(what + " failed after " + attempts + " attempt(s)", last);
        this.attempts = attempts;
    }

    public int attempts() { return attempts; }
}
