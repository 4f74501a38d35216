package com.netctl.fib.engine;

import com.netctl.fib.model.RouteDelta;

/**
 * Outcome of one programming or reconciliation pass.
 */
public record ProgramResult(Status status, RouteDelta delta, Throwable error) {

    public enum Status {
        /** Nothing to do; no agent call was made. */
        NOOP,
        /** Validated and logged only; state updated optimistically. */
        DRYRUN,
        /** The agent confirmed every call. */
        PROGRAMMED,
        /** Retries exhausted; state reflects only the calls that were confirmed. */
        FAILED,
        /** Abandoned because the pipeline is stopping. */
        CANCELLED
    }

    public static ProgramResult noop() {
        return new ProgramResult(Status.NOOP, RouteDelta.empty(), null);
    }

    public static ProgramResult of(Status status, RouteDelta delta) {
        return new ProgramResult(status, delta, null);
    }

    public static ProgramResult failed(RouteDelta delta, Throwable error) {
        return new ProgramResult(Status.FAILED, delta, error);
    }

    public static ProgramResult cancelled(RouteDelta delta, Throwable error) {
        return new ProgramResult(Status.CANCELLED, delta, error);
    }

    /** True when state now reflects the whole delta. */
    public boolean isApplied() {
        return status == Status.NOOP || status == Status.DRYRUN || status == Status.PROGRAMMED;
    }
}
