package com.netctl.fib.wiring;

import com.netctl.fib.model.PerfTrace;
import com.netctl.fib.model.RouteSnapshot;

import java.util.concurrent.CountDownLatch;

/**
 * A mutable slot in the pipeline's Disruptor ring buffer.
 *
 * <p>
 * Pre-allocated for the lifetime of the ring and reused. Every input to the
 * owner thread travels through one of these: snapshots from the ingress
 * thread and ticks from the timer thread alike, which is what serialises all
 * writers of the programmed state onto one thread.
 */
public final class FibEvent {

    public enum Type {
        /** A validated snapshot from ingress. */
        SNAPSHOT,
        /** The debounce deadline may have passed. */
        DEBOUNCE_TIMER,
        /** Periodic full reconciliation. */
        RECONCILE_TIMER,
        /** Agent liveness check (restart detection). */
        HEALTH_CHECK,
        /** Start-up bulk sync; {@link #latch()} is released when done. */
        INITIAL_SYNC
    }

    private Type type;
    private RouteSnapshot snapshot;
    private PerfTrace trace;
    private CountDownLatch latch;

    public void setSnapshot(RouteSnapshot snapshot, PerfTrace trace) {
        this.type = Type.SNAPSHOT;
        this.snapshot = snapshot;
        this.trace = trace;
        this.latch = null;
    }

    public void setControl(Type type, CountDownLatch latch) {
        this.type = type;
        this.snapshot = null;
        this.trace = null;
        this.latch = latch;
    }

    public Type type() {
        return type;
    }

    public RouteSnapshot snapshot() {
        return snapshot;
    }

    public PerfTrace trace() {
        return trace;
    }

    public CountDownLatch latch() {
        return latch;
    }

    /** Drops references so a consumed slot does not pin a large snapshot. */
    public void clear() {
        type = null;
        snapshot = null;
        trace = null;
        latch = null;
    }
}
