package com.netctl.fib.agent;

import com.netctl.fib.api.FibAgent;
import com.netctl.fib.api.FibAgentException;
import com.netctl.fib.model.IpPrefix;
import com.netctl.fib.model.UnicastRoute;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory forwarding agent. Keeps one route table per client and counts
 * every call, with knobs to inject failures, latency and restarts.
 *
 * <p>
 * All methods are synchronized; the {@code await*} helpers block until a call
 * count reaches a target, which lets tests wait for the pipeline without
 * sleeping.
 */
public class MockFibAgent implements FibAgent {
    private static final Logger log = LogManager.getLogger(MockFibAgent.class);

    private final Map<Integer, Map<IpPrefix, UnicastRoute>> tables = new HashMap<>();

    private long aliveSince = System.currentTimeMillis();
    private int addCount;
    private int deleteCount;
    private int syncCount;
    private int getTableCount;

    private int failNext;
    private boolean failing;
    private long callDelayMs;

    @Override
    public void addOrUpdateRoutes(int clientId, List<UnicastRoute> routes) throws FibAgentException {
        beforeCall("addOrUpdateRoutes");
        synchronized (this) {
            Map<IpPrefix, UnicastRoute> table = table(clientId);
            for (UnicastRoute r : routes)
                table.put(r.destination(), r);
            addCount++;
            notifyAll();
        }
    }

    @Override
    public void deleteRoutes(int clientId, List<IpPrefix> prefixes) throws FibAgentException {
        beforeCall("deleteRoutes");
        synchronized (this) {
            Map<IpPrefix, UnicastRoute> table = table(clientId);
            for (IpPrefix p : prefixes)
                table.remove(p);
            deleteCount++;
            notifyAll();
        }
    }

    @Override
    public List<UnicastRoute> getRouteTable(int clientId) throws FibAgentException {
        beforeCall("getRouteTable");
        synchronized (this) {
            getTableCount++;
            notifyAll();
            return new ArrayList<>(table(clientId).values());
        }
    }

    @Override
    public void syncRoutes(int clientId, List<UnicastRoute> routes) throws FibAgentException {
        beforeCall("syncRoutes");
        synchronized (this) {
            Map<IpPrefix, UnicastRoute> table = table(clientId);
            table.clear();
            for (UnicastRoute r : routes)
                table.put(r.destination(), r);
            syncCount++;
            notifyAll();
        }
    }

    @Override
    public synchronized long aliveSince() throws FibAgentException {
        if (failing)
            throw new FibAgentException("agent unreachable");
        return aliveSince;
    }

    // ---- test controls ----

    /** The next {@code n} programming calls throw. */
    public synchronized void failNextCalls(int n) {
        failNext = n;
    }

    /** Every call throws until cleared. */
    public synchronized void setFailing(boolean failing) {
        this.failing = failing;
    }

    /** Each programming call sleeps this long first, outside the lock. */
    public synchronized void setCallDelayMs(long callDelayMs) {
        this.callDelayMs = callDelayMs;
    }

    /** Simulates an agent restart: all tables are lost and {@link #aliveSince()} moves. */
    public synchronized void restart() {
        tables.clear();
        aliveSince = Math.max(aliveSince + 1, System.currentTimeMillis());
        log.info("Mock agent restarted, aliveSince={}", aliveSince);
    }

    /** Drops or rewrites entries behind the programmer's back. */
    public synchronized void corrupt(int clientId, IpPrefix prefix, UnicastRoute replacement) {
        if (replacement == null)
            table(clientId).remove(prefix);
        else
            table(clientId).put(prefix, replacement);
    }

    public synchronized Map<IpPrefix, UnicastRoute> routes(int clientId) {
        return new LinkedHashMap<>(table(clientId));
    }

    public synchronized int addCount() {
        return addCount;
    }

    public synchronized int deleteCount() {
        return deleteCount;
    }

    public synchronized int syncCount() {
        return syncCount;
    }

    public synchronized int getTableCount() {
        return getTableCount;
    }

    /** Total programming calls (add, delete, sync). */
    public synchronized int programmingCalls() {
        return addCount + deleteCount + syncCount;
    }

    public boolean awaitAddCount(int target, long timeoutMs) throws InterruptedException {
        return await(() -> addCount >= target, timeoutMs);
    }

    public boolean awaitDeleteCount(int target, long timeoutMs) throws InterruptedException {
        return await(() -> deleteCount >= target, timeoutMs);
    }

    public boolean awaitSyncCount(int target, long timeoutMs) throws InterruptedException {
        return await(() -> syncCount >= target, timeoutMs);
    }

    public boolean awaitGetTableCount(int target, long timeoutMs) throws InterruptedException {
        return await(() -> getTableCount >= target, timeoutMs);
    }

    /** Waits until the client's table has exactly {@code size} entries. */
    public boolean awaitTableSize(int clientId, int size, long timeoutMs) throws InterruptedException {
        return await(() -> table(clientId).size() == size, timeoutMs);
    }

    private synchronized boolean await(Condition condition, long timeoutMs) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (!condition.holds()) {
            long left = deadline - System.currentTimeMillis();
            if (left <= 0)
                return false;
            wait(left);
        }
        return true;
    }

    private interface Condition {
        boolean holds();
    }

    private void beforeCall(String op) throws FibAgentException {
        long delay;
        synchronized (this) {
            if (failing)
                throw new FibAgentException(op + ": agent unreachable");
            if (failNext > 0) {
                failNext--;
                throw new FibAgentException(op + ": injected failure");
            }
            delay = callDelayMs;
        }
        if (delay > 0) {
            try {
                Thread.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new FibAgentException(op + ": interrupted", e);
            }
        }
    }

    private synchronized Map<IpPrefix, UnicastRoute> table(int clientId) {
        return tables.computeIfAbsent(clientId, k -> new HashMap<>());
    }
}
