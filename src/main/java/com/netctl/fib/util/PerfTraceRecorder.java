package com.netctl.fib.util;

import com.netctl.fib.model.PerfEvent;
import com.netctl.fib.model.PerfTrace;
import com.netctl.fib.model.RouteSnapshot;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;

/**
 * Stamps pipeline stages onto a pass's {@link PerfTrace} and files completed
 * traces into the {@link PerfHistory}.
 *
 * <p>
 * Purely additive and never throws: a failure to record is counted and
 * dropped, the pass continues with whatever trace it already had.
 */
public final class PerfTraceRecorder {
    private static final Logger log = LogManager.getLogger(PerfTraceRecorder.class);

    public static final String ROUTE_DB_RECEIVED = "FIB_ROUTE_DB_RECVD";
    public static final String DEBOUNCE = "FIB_DEBOUNCE";
    public static final String ROUTES_PROGRAMMED = "FIB_ROUTES_PROGRAMMED";

    private final String nodeName;
    private final Clock clock;
    private final PerfHistory history;
    private final FibCounters counters;

    public PerfTraceRecorder(String nodeName, Clock clock, PerfHistory history, FibCounters counters) {
        this.nodeName = nodeName;
        this.clock = clock;
        this.history = history;
        this.counters = counters;
    }

    /** Starts a trace from the snapshot's upstream events, if any. */
    public PerfTrace begin(RouteSnapshot snapshot) {
        try {
            return new PerfTrace(snapshot.perfEvents());
        } catch (RuntimeException e) {
            dropped(e);
            return PerfTrace.empty();
        }
    }

    public PerfTrace stamp(PerfTrace trace, String stage) {
        try {
            return trace.with(new PerfEvent(nodeName, stage, clock.millis()));
        } catch (RuntimeException e) {
            dropped(e);
            return trace;
        }
    }

    /** Moves a completed trace into the history. */
    public void finalizeTrace(PerfTrace trace) {
        try {
            if (trace != null && !trace.isEmpty())
                history.add(trace);
        } catch (RuntimeException e) {
            dropped(e);
        }
    }

    public PerfHistory history() {
        return history;
    }

    private void dropped(RuntimeException e) {
        counters.increment(FibCounters.PERF_DROPPED);
        log.trace("perf event dropped", e);
    }
}
