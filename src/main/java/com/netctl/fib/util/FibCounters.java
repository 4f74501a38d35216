package com.netctl.fib.util;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Named monotonic counters and gauges for the FIB pipeline.
 *
 * <p>
 * Written from the owner thread, the ingress thread and the RPC workers; read
 * by the query endpoint. Lookups allocate only the first time a key is seen.
 */
public final class FibCounters {
    public static final String NUM_ROUTES = "fib.num_routes";
    public static final String SNAPSHOTS_RECEIVED = "fib.snapshots.received";
    public static final String SNAPSHOTS_REJECTED = "fib.snapshots.rejected";
    public static final String DEBOUNCE_COALESCED = "fib.debounce.coalesced";
    public static final String BATCH_COALESCED = "fib.batch.coalesced";
    public static final String PASSES_PROGRAMMED = "fib.passes.programmed";
    public static final String PASSES_NOOP = "fib.passes.noop";
    public static final String PASSES_FAILED = "fib.passes.failed";
    public static final String ROUTES_ADDED = "fib.routes.added";
    public static final String ROUTES_UPDATED = "fib.routes.updated";
    public static final String ROUTES_DELETED = "fib.routes.deleted";
    public static final String AGENT_CALLS = "fib.agent.calls";
    public static final String AGENT_FAILURES = "fib.agent.failures";
    public static final String AGENT_TIMEOUTS = "fib.agent.timeouts";
    public static final String AGENT_RETRIES = "fib.agent.retries";
    public static final String AGENT_RESTARTS = "fib.agent.restarts";
    public static final String SYNC_FIB_CALLS = "fib.sync_fib_calls";
    public static final String SYNC_FIB_FAILURES = "fib.sync_fib_failures";
    public static final String RECONCILE_SUCCESS = "fib.reconcile.success";
    public static final String RECONCILE_FAILURE = "fib.reconcile.failure";
    public static final String RECONCILE_ALERT = "fib.reconcile.alert";
    public static final String RECONCILE_CORRECTED = "fib.reconcile.corrected_routes";
    public static final String INGRESS_DISCONNECTS = "fib.ingress.disconnects";
    public static final String INGRESS_RECONNECTS = "fib.ingress.reconnects";
    public static final String PERF_DROPPED = "fib.perf.dropped";
    public static final String HANDLER_ERRORS = "fib.handler.errors";

    private final ConcurrentHashMap<String, AtomicLong> values = new ConcurrentHashMap<>();

    public void increment(String key) {
        counter(key).incrementAndGet();
    }

    public void add(String key, long delta) {
        counter(key).addAndGet(delta);
    }

    public void set(String key, long value) {
        counter(key).set(value);
    }

    public long get(String key) {
        AtomicLong v = values.get(key);
        return v == null ? 0 : v.get();
    }

    /** Sorted point-in-time copy. */
    public Map<String, Long> snapshot() {
        Map<String, Long> out = new TreeMap<>();
        values.forEach((k, v) -> out.put(k, v.get()));
        return out;
    }

    private AtomicLong counter(String key) {
        return values.computeIfAbsent(key, k -> new AtomicLong());
    }
}
