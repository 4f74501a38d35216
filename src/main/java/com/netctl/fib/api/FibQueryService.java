package com.netctl.fib.api;

import com.netctl.fib.model.PerfTrace;
import com.netctl.fib.model.RouteSnapshot;

import java.util.List;
import java.util.Map;

/**
 * Read-only view exposed to external callers. All methods return
 * point-in-time copies and are safe to call from any thread.
 */
public interface FibQueryService {

    /** The routes the pipeline believes are installed in the agent. */
    RouteSnapshot getCurrentState();

    /** Completed perf traces, oldest first. */
    List<PerfTrace> getPerfHistory();

    Map<String, Long> getCounters();

    PipelineState getPipelineState();
}
