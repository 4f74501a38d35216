package com.netctl.fib.util;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Throttles a repeating log line. While an agent is down every pass and every
 * reconciliation fails the same way; one line per interval is enough, with a
 * count of what was suppressed in between.
 */
public final class ErrorRateLimiter {
    private final Logger logger;
    private final Level level;
    private final long minIntervalNanos;
    private final AtomicLong lastLogTime = new AtomicLong(Long.MIN_VALUE);
    private final AtomicLong suppressed = new AtomicLong();

    public ErrorRateLimiter(Logger logger, long minIntervalMillis) {
        this(logger, Level.ERROR, minIntervalMillis);
    }

    public ErrorRateLimiter(Logger logger, Level level, long minIntervalMillis) {
        this.logger = logger;
        this.level = level;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
    }

    /**
     * Logs {@code message} unless another line went out within the interval.
     *
     * @return true if the line was written
     */
    public boolean log(String message, Throwable t) {
        long now = System.nanoTime();
        long last = lastLogTime.get();
        if (last != Long.MIN_VALUE && now - last <= minIntervalNanos) {
            suppressed.incrementAndGet();
            return false;
        }
        // one winner per interval when several threads race
        if (!lastLogTime.compareAndSet(last, now)) {
            suppressed.incrementAndGet();
            return false;
        }
        long skipped = suppressed.getAndSet(0);
        if (skipped > 0)
            logger.log(level, "{} ({} similar suppressed)", message, skipped, t);
        else
            logger.log(level, message, t);
        return true;
    }

    public long suppressedCount() {
        return suppressed.get();
    }
}
