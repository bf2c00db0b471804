package com.baykanat.funnel.domain.exception;

/** Event store sorgusu başarısız (ağ, sözdizimi, timeout, circuit breaker); hesaplama tamamen iptal edilir. 503 + Retry-After. */
public class QueryFailedException extends RuntimeException {

    private final int retryAfterSeconds;

    public QueryFailedException(String message, Throwable cause, int retryAfterSeconds) {
        super(message, cause);
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public int getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
