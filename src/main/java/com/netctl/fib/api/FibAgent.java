package com.netctl.fib.api;

import com.netctl.fib.model.IpPrefix;
import com.netctl.fib.model.UnicastRoute;

import java.util.List;

/**
 * The programming interface of a forwarding agent (kernel or line-card route
 * table).
 *
 * <p>
 * Every call identifies the programming client, so several route producers
 * can share one agent without clobbering each other's routes. Calls may block
 * for an unbounded time; callers are expected to apply their own timeout.
 *
 * <p>
 * Implementations: {@link com.netctl.fib.agent.HttpFibAgentClient} for a live
 * agent, {@link com.netctl.fib.agent.MockFibAgent} for tests and dry runs.
 */
public interface FibAgent {

    /** Installs or replaces the given routes. */
    void addOrUpdateRoutes(int clientId, List<UnicastRoute> routes) throws FibAgentException;

    /** Removes routes for the given prefixes. Unknown prefixes are ignored. */
    void deleteRoutes(int clientId, List<IpPrefix> prefixes) throws FibAgentException;

    /** Returns everything the agent currently has installed for this client. */
    List<UnicastRoute> getRouteTable(int clientId) throws FibAgentException;

    /** Atomically replaces this client's whole table with {@code routes}. */
    void syncRoutes(int clientId, List<UnicastRoute> routes) throws FibAgentException;

    /**
     * Start time of the agent process (epoch millis). A change between two
     * reads means the agent restarted and may have lost its table.
     */
    long aliveSince() throws FibAgentException;
}
