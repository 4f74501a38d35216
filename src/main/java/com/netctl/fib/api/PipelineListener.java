package com.netctl.fib.api;

import com.netctl.fib.model.PerfTrace;
import com.netctl.fib.model.RouteDelta;

/**
 * Observability hooks for the FIB pipeline.
 *
 * <p>
 * {@link #onSnapshotRejected} runs on the ingress thread; the other callbacks
 * run on the pipeline's owner thread, inside the pass.
 * Implementations must be cheap and must not block; anything slow belongs on
 * another thread.
 */
public interface PipelineListener {

    /** An incoming snapshot was dropped at ingestion. */
    default void onSnapshotRejected(String reason) {
    }

    /** A delta was applied (or dry-run applied) and the state updated. */
    default void onPassProgrammed(RouteDelta delta, PerfTrace trace) {
    }

    /** A delta was abandoned after exhausting retries. */
    default void onPassFailed(RouteDelta delta, Throwable cause) {
    }

    /**
     * A reconciliation attempt finished.
     *
     * @param success        whether the agent now matches the desired routes
     * @param correctedRoutes number of prefixes that had drifted and were fixed
     */
    default void onReconciled(boolean success, int correctedRoutes) {
    }
}
