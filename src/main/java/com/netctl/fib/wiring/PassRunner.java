package com.netctl.fib.wiring;

import com.netctl.fib.model.PerfTrace;
import com.netctl.fib.model.RouteSnapshot;

/**
 * The owner-thread side of the pipeline, driven by {@link FibEventHandler}.
 */
public interface PassRunner {

    void onSnapshot(RouteSnapshot snapshot, PerfTrace trace);

    void onDebounceTimer();

    void onReconcileTimer();

    void onHealthCheck();

    void onInitialSync();
}
