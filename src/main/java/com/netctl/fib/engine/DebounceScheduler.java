package com.netctl.fib.engine;

/**
 * Coalesces a burst of updates into one downstream action.
 *
 * <p>
 * The first {@link #notify(Object, long)} opens a window and sets the deadline
 * to {@code now + minInterval}. Every further notify replaces the pending item
 * (intermediate items are never delivered) and pushes the deadline out to
 * {@code now + minInterval}, but never past {@code windowStart + maxInterval}.
 * Under continuous input an item is therefore released at least once per
 * {@code maxInterval}.
 *
 * <p>
 * Time is passed in explicitly; the caller owns the actual timer. Not
 * thread-safe: used only from the pipeline owner thread.
 *
 * @param <T> the coalesced item
 */
public final class DebounceScheduler<T> {

    private final long minIntervalMs;
    private final long maxIntervalMs;

    private T pending;
    private long windowStartMs = -1;
    private long deadlineMs = -1;

    public DebounceScheduler(long minIntervalMs, long maxIntervalMs) {
        if (minIntervalMs < 0 || maxIntervalMs < minIntervalMs)
            throw new IllegalArgumentException(
                    "need 0 <= minInterval <= maxInterval, got " + minIntervalMs + "/" + maxIntervalMs);
        this.minIntervalMs = minIntervalMs;
        this.maxIntervalMs = maxIntervalMs;
    }

    /**
     * Records {@code item} as the latest state.
     *
     * @return the (possibly extended) deadline in millis
     */
    public long notify(T item, long nowMs) {
        pending = item;
        if (windowStartMs < 0) {
            windowStartMs = nowMs;
            deadlineMs = nowMs + minIntervalMs;
        } else {
            deadlineMs = Math.min(nowMs + minIntervalMs, windowStartMs + maxIntervalMs);
        }
        return deadlineMs;
    }

    public boolean isArmed() {
        return windowStartMs >= 0;
    }

    public boolean isDue(long nowMs) {
        return isArmed() && nowMs >= deadlineMs;
    }

    /**
     * Releases the pending item if the deadline has passed, closing the window.
     *
     * @return the latest item, or {@code null} if nothing is due yet
     */
    public T fire(long nowMs) {
        if (!isDue(nowMs))
            return null;
        T out = pending;
        reset();
        return out;
    }

    /** Drops the pending item and closes the window. */
    public void cancel() {
        reset();
    }

    public long deadlineMs() {
        return deadlineMs;
    }

    public long windowStartMs() {
        return windowStartMs;
    }

    private void reset() {
        pending = null;
        windowStartMs = -1;
        deadlineMs = -1;
    }
}
