package com.netctl.fib.engine;

import com.netctl.fib.api.FibAgent;
import com.netctl.fib.api.FibAgentException;
import com.netctl.fib.model.FibInvariantException;
import com.netctl.fib.model.RouteDelta;
import com.netctl.fib.model.RouteSnapshot;
import com.netctl.fib.model.UnicastRoute;
import com.netctl.fib.util.ErrorRateLimiter;
import com.netctl.fib.util.FibCounters;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Full resynchronisation against what the agent actually reports.
 *
 * <p>
 * Delta programming between reconciliations is best effort: messages can be
 * dropped on the way in, the agent can restart and lose its table, a pass can
 * fail half way. A reconciliation reads the agent's table, adopts it as the
 * current belief, diffs it against the last known good snapshot and pushes the
 * correction through the same {@link FibProgrammer}. When it succeeds the
 * belief equals the desired routes exactly; this is the pipeline's only
 * guaranteed-consistency point.
 *
 * <p>
 * Failures are not fatal. The attempt is abandoned, retried at the next
 * period, and after {@code alertThreshold} consecutive failures an alert is
 * logged and counted.
 *
 * <p>
 * Owner thread only.
 */
public final class Reconciler {
    private static final Logger log = LogManager.getLogger(Reconciler.class);

    private final FibAgent agent;
    private final AgentCaller caller;
    private final FibProgrammer programmer;
    private final ProgrammedState state;
    private final int clientId;
    private final int alertThreshold;
    private final FibCounters counters;
    private final ErrorRateLimiter alertLimiter = new ErrorRateLimiter(log, 10_000);

    private int consecutiveFailures;

    public Reconciler(FibAgent agent, AgentCaller caller, FibProgrammer programmer, ProgrammedState state,
            int clientId, int alertThreshold, FibCounters counters) {
        this.agent = agent;
        this.caller = caller;
        this.programmer = programmer;
        this.state = state;
        this.clientId = clientId;
        this.alertThreshold = alertThreshold;
        this.counters = counters;
    }

    /**
     * Start-up sync: bulk-replaces the agent's table with {@code desired}.
     *
     * @return true if the agent confirmed
     */
    public boolean initialSync(RouteSnapshot desired) {
        List<UnicastRoute> routes = desired.unicastRoutes();
        if (programmer.isDryrun()) {
            log.info("[dryrun] would sync {} routes into agent", routes.size());
            state.replaceAll(routes);
            return true;
        }
        counters.increment(FibCounters.SYNC_FIB_CALLS);
        try {
            caller.run("syncRoutes", () -> agent.syncRoutes(clientId, routes));
        } catch (FibAgentException e) {
            counters.increment(FibCounters.SYNC_FIB_FAILURES);
            log.warn("Initial route sync failed, periodic reconciliation will retry: {}", e.getMessage());
            return false;
        }
        state.replaceAll(routes);
        log.info("Initial sync installed {} routes", routes.size());
        return true;
    }

    /**
     * Reconciles the agent against {@code desired}.
     *
     * @return {@code NOOP} if nothing had drifted, {@code PROGRAMMED}/{@code DRYRUN}
     *         with the correcting delta, or {@code FAILED}/{@code CANCELLED}
     */
    public ProgramResult reconcile(RouteSnapshot desired) {
        List<UnicastRoute> reported;
        if (programmer.isDryrun()) {
            reported = state.routes();
        } else {
            try {
                reported = caller.call("getRouteTable", () -> agent.getRouteTable(clientId));
            } catch (AgentCaller.CallCancelledException e) {
                return ProgramResult.cancelled(RouteDelta.empty(), e);
            } catch (FibAgentException e) {
                return failed(RouteDelta.empty(), e);
            }
            state.replaceAll(reported);
        }

        RouteDelta correction = RouteDiff.diff(RouteDiff.index(reported), desired);
        if (!correction.isEmpty())
            log.info("Reconciliation found drift: {}", correction);

        ProgramResult result = programmer.apply(correction);
        switch (result.status()) {
            case FAILED:
                return failed(correction, result.error());
            case CANCELLED:
                return result;
            default:
                break;
        }

        if (!state.matches(desired.unicastRoutes()))
            throw new FibInvariantException("state diverges from desired routes after successful reconciliation");

        if (consecutiveFailures > 0)
            log.info("Reconciliation recovered after {} failed attempt(s)", consecutiveFailures);
        consecutiveFailures = 0;
        counters.increment(FibCounters.RECONCILE_SUCCESS);
        counters.add(FibCounters.RECONCILE_CORRECTED, correction.size());
        return result;
    }

    public int consecutiveFailures() {
        return consecutiveFailures;
    }

    private ProgramResult failed(RouteDelta delta, Throwable cause) {
        consecutiveFailures++;
        counters.increment(FibCounters.RECONCILE_FAILURE);
        log.warn("Reconciliation failed ({} in a row): {}", consecutiveFailures,
                cause == null ? "unknown" : cause.getMessage());
        if (consecutiveFailures >= alertThreshold) {
            counters.increment(FibCounters.RECONCILE_ALERT);
            alertLimiter.log(String.format(
                    "ALERT: agent reconciliation has failed %d consecutive times; serving from in-memory state",
                    consecutiveFailures), cause);
        }
        return ProgramResult.failed(delta, cause);
    }
}
