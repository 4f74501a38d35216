package com.netctl.fib.engine;

import com.netctl.fib.api.FibAgent;
import com.netctl.fib.api.FibAgentException;
import com.netctl.fib.model.IpPrefix;
import com.netctl.fib.model.RouteDelta;
import com.netctl.fib.model.UnicastRoute;
import com.netctl.fib.util.FibCounters;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Pushes a {@link RouteDelta} into the forwarding agent and keeps
 * {@link ProgrammedState} in step with what the agent confirmed.
 *
 * <p>
 * A live pass issues at most two batched calls: one delete for all removed
 * prefixes, then one add-or-update for all added and changed routes. Empty
 * batches are skipped, so an empty delta costs no RPC at all. State is updated
 * per confirmed batch: if the delete succeeds and the update then fails, state
 * reflects the delete only. Retries and timeouts are handled by
 * {@link AgentCaller}.
 *
 * <p>
 * In dry-run mode nothing is sent; the delta is logged and state is updated as
 * if the agent had accepted it.
 */
public final class FibProgrammer {
    private static final Logger log = LogManager.getLogger(FibProgrammer.class);

    private final FibAgent agent;
    private final ProgrammedState state;
    private final AgentCaller caller;
    private final boolean dryrun;
    private final int clientId;
    private final FibCounters counters;

    public FibProgrammer(FibAgent agent, ProgrammedState state, AgentCaller caller,
            boolean dryrun, int clientId, FibCounters counters) {
        this.agent = agent;
        this.state = state;
        this.caller = caller;
        this.dryrun = dryrun;
        this.clientId = clientId;
        this.counters = counters;
    }

    public ProgramResult apply(RouteDelta delta) {
        if (delta.isEmpty())
            return ProgramResult.noop();

        if (dryrun) {
            logDryrun(delta);
            state.apply(delta);
            countApplied(delta);
            return ProgramResult.of(ProgramResult.Status.DRYRUN, delta);
        }

        List<IpPrefix> removed = delta.removed();
        List<UnicastRoute> updates = delta.addsAndUpdates();
        try {
            if (!removed.isEmpty()) {
                caller.run("deleteRoutes", () -> agent.deleteRoutes(clientId, removed));
                state.applyDeletes(removed);
                counters.add(FibCounters.ROUTES_DELETED, removed.size());
            }
            if (!updates.isEmpty()) {
                caller.run("addOrUpdateRoutes", () -> agent.addOrUpdateRoutes(clientId, updates));
                state.applyUpdates(updates);
                counters.add(FibCounters.ROUTES_ADDED, delta.added().size());
                counters.add(FibCounters.ROUTES_UPDATED, delta.changed().size());
            }
        } catch (AgentCaller.CallCancelledException e) {
            log.info("Programming of {} abandoned: pipeline stopping", delta);
            return ProgramResult.cancelled(delta, e);
        } catch (FibAgentException e) {
            return ProgramResult.failed(delta, e);
        }

        log.debug("Programmed {} into agent (client {})", delta, clientId);
        return ProgramResult.of(ProgramResult.Status.PROGRAMMED, delta);
    }

    public boolean isDryrun() {
        return dryrun;
    }

    private void countApplied(RouteDelta delta) {
        counters.add(FibCounters.ROUTES_ADDED, delta.added().size());
        counters.add(FibCounters.ROUTES_UPDATED, delta.changed().size());
        counters.add(FibCounters.ROUTES_DELETED, delta.removed().size());
    }

    private static void logDryrun(RouteDelta delta) {
        log.info("[dryrun] would program {}", delta);
        if (log.isDebugEnabled()) {
            for (UnicastRoute r : delta.added())
                log.debug("[dryrun]   add    {} via {}", r.destination(), r.nextHops());
            for (UnicastRoute r : delta.changed())
                log.debug("[dryrun]   update {} via {}", r.destination(), r.nextHops());
            for (IpPrefix p : delta.removed())
                log.debug("[dryrun]   delete {}", p);
        }
    }
}
