package com.callstt.processing.service;

import java.time.Duration;

public final class RetryPolicy {

    public enum Decision {
        RETRY,
        DEAD_LETTER,
        EXHAUSTED
    }

    private static final Duration MIN_BACKOFF = Duration.ofMillis(100);
    private static final int MAX_EXPONENT = 30;

    private final int maxRetries;
    private final Duration baseBackoff;

    public RetryPolicy(int maxRetries, Duration baseBackoff) {
        this.maxRetries = Math.max(1, maxRetries);
        this.baseBackoff = baseBackoff == null || baseBackoff.compareTo(MIN_BACKOFF) < 0 ? MIN_BACKOFF : baseBackoff;
    }

    // attempt counts the failed call that is being decided on
    public Decision decide(TranscriptionFailure failure, int attempt) {
        if (failure.classification() == FailureClassification.CLIENT_ERROR) {
            return Decision.DEAD_LETTER;
        }
        return attempt >= maxRetries ? Decision.EXHAUSTED : Decision.RETRY;
    }

    // base * 2^(attempt-1), saturating at Long.MAX_VALUE millis
    public Duration backoff(int attempt) {
        long factor = 1L << Math.min(MAX_EXPONENT, Math.max(0, attempt - 1));
        long baseMillis = baseBackoff.toMillis();
        long delayMillis = baseMillis > Long.MAX_VALUE / factor ? Long.MAX_VALUE : baseMillis * factor;
        return Duration.ofMillis(delayMillis);
    }

    public int maxRetries() {
        return maxRetries;
    }
}
