package com.netctl.fib.wiring;

import com.lmax.disruptor.EventHandler;
import com.netctl.fib.model.PerfTrace;
import com.netctl.fib.model.RouteSnapshot;
import com.netctl.fib.util.FibCounters;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.CountDownLatch;

/**
 * Disruptor consumer that turns ring-buffer events into pipeline work on the
 * single owner thread.
 *
 * <p>
 * Batching: when several snapshots are already waiting in the ring, only the
 * newest of the run is handed on. The Disruptor's {@code endOfBatch} flag
 * tells us the ring is drained; until then a snapshot is held and replaced by
 * the next one. Any control event flushes the held snapshot first, so ordering
 * between snapshots and timers is preserved.
 */
public final class FibEventHandler implements EventHandler<FibEvent> {
    private static final Logger log = LogManager.getLogger(FibEventHandler.class);

    private final PassRunner runner;
    private final FibCounters counters;

    private RouteSnapshot heldSnapshot;
    private PerfTrace heldTrace;

    public FibEventHandler(PassRunner runner, FibCounters counters) {
        this.runner = runner;
        this.counters = counters;
    }

    @Override
    public void onEvent(FibEvent event, long sequence, boolean endOfBatch) {
        FibEvent.Type type = event.type();
        try {
            if (type == FibEvent.Type.SNAPSHOT) {
                if (heldSnapshot != null)
                    counters.increment(FibCounters.BATCH_COALESCED);
                heldSnapshot = event.snapshot();
                heldTrace = event.trace();
            } else if (type != null) {
                flush();
                dispatch(type, event.latch());
            }
            if (endOfBatch)
                flush();
        } finally {
            event.clear();
        }
    }

    private void dispatch(FibEvent.Type type, CountDownLatch latch) {
        switch (type) {
            case DEBOUNCE_TIMER -> runner.onDebounceTimer();
            case RECONCILE_TIMER -> runner.onReconcileTimer();
            case HEALTH_CHECK -> runner.onHealthCheck();
            case INITIAL_SYNC -> {
                try {
                    runner.onInitialSync();
                } finally {
                    if (latch != null)
                        latch.countDown();
                }
            }
            default -> log.error("Unexpected control event {}", type);
        }
    }

    private void flush() {
        RouteSnapshot s = heldSnapshot;
        PerfTrace t = heldTrace;
        if (s == null)
            return;
        heldSnapshot = null;
        heldTrace = null;
        runner.onSnapshot(s, t);
    }
}
