package com.netctl.fib.util;

import com.netctl.fib.api.PipelineListener;
import com.netctl.fib.model.FibInvariantException;
import com.netctl.fib.model.PerfTrace;
import com.netctl.fib.model.RouteDelta;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;

/**
 * Fans pipeline callbacks out to several listeners. Registration copies the
 * array, so iteration on the owner thread never allocates or locks. A
 * misbehaving listener is logged and skipped; it never fails the pass. A
 * {@link FibInvariantException} is not a misbehaving listener and propagates.
 */
public final class CompositePipelineListener implements PipelineListener {
    private static final Logger log = LogManager.getLogger(CompositePipelineListener.class);

    private volatile PipelineListener[] listeners = new PipelineListener[0];

    public synchronized void add(PipelineListener listener) {
        PipelineListener[] old = listeners;
        PipelineListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onSnapshotRejected(String reason) {
        for (PipelineListener l : listeners) {
            try {
                l.onSnapshotRejected(reason);
            } catch (FibInvariantException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("Listener {} failed in onSnapshotRejected", l, e);
            }
        }
    }

    @Override
    public void onPassProgrammed(RouteDelta delta, PerfTrace trace) {
        for (PipelineListener l : listeners) {
            try {
                l.onPassProgrammed(delta, trace);
            } catch (FibInvariantException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("Listener {} failed in onPassProgrammed", l, e);
            }
        }
    }

    @Override
    public void onPassFailed(RouteDelta delta, Throwable cause) {
        for (PipelineListener l : listeners) {
            try {
                l.onPassFailed(delta, cause);
            } catch (FibInvariantException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("Listener {} failed in onPassFailed", l, e);
            }
        }
    }

    @Override
    public void onReconciled(boolean success, int correctedRoutes) {
        for (PipelineListener l : listeners) {
            try {
                l.onReconciled(success, correctedRoutes);
            } catch (FibInvariantException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("Listener {} failed in onReconciled", l, e);
            }
        }
    }
}
