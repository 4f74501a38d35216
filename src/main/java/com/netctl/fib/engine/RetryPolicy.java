package com.netctl.fib.engine;

/**
 * Bounded exponential backoff: attempt {@code n} (1-based) that fails waits
 * {@code min(maxBackoff, initialBackoff * 2^(n-1))} before attempt {@code n+1}.
 */
public record RetryPolicy(int maxAttempts, long initialBackoffMs, long maxBackoffMs) {

    public RetryPolicy {
        if (maxAttempts < 1)
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        if (initialBackoffMs < 0 || maxBackoffMs < initialBackoffMs)
            throw new IllegalArgumentException("need 0 <= initialBackoff <= maxBackoff");
    }

    public static RetryPolicy once() {
        return new RetryPolicy(1, 0, 0);
    }

    public long backoffMs(int failedAttempt) {
        if (failedAttempt < 1 || initialBackoffMs == 0)
            return 0;
        int shift = Math.min(failedAttempt - 1, 30);
        long d = initialBackoffMs << shift;
        return d < 0 ? maxBackoffMs : Math.min(d, maxBackoffMs);
    }
}
