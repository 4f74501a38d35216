package com.netctl.fib.engine;

import com.netctl.fib.model.IpPrefix;
import com.netctl.fib.model.RouteDelta;
import com.netctl.fib.model.RouteSnapshot;
import com.netctl.fib.model.UnicastRoute;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes the minimal {@link RouteDelta} that turns the current table into the
 * desired one.
 *
 * <p>
 * Pure function: no I/O, no mutation of its inputs, deterministic output
 * order (added and changed follow the desired order, removed follows the
 * current table sorted by prefix). Linear in the size of the union via
 * hash lookups by prefix.
 *
 * <p>
 * Comparison is by prefix, then by next-hop <i>set</i>: a reordering of the
 * same next-hops is not a change. Emitted routes keep the desired next-hop
 * order for programming.
 *
 * <p>
 * An empty desired table removes everything currently installed. That is how
 * an upstream publisher withdraws all routes for a node.
 */
public final class RouteDiff {

    private RouteDiff() {
    }

    public static RouteDelta diff(Map<IpPrefix, UnicastRoute> current, RouteSnapshot incoming) {
        return diff(current, incoming.unicastRoutes());
    }

    public static RouteDelta diff(Map<IpPrefix, UnicastRoute> current, Collection<UnicastRoute> desired) {
        List<UnicastRoute> added = new ArrayList<>();
        List<UnicastRoute> changed = new ArrayList<>();
        Map<IpPrefix, UnicastRoute> wanted = new HashMap<>(Math.max(16, desired.size() * 2));

        for (UnicastRoute want : desired) {
            wanted.put(want.destination(), want);
            UnicastRoute have = current.get(want.destination());
            if (have == null)
                added.add(want);
            else if (!have.sameNextHops(want))
                changed.add(want);
        }

        List<IpPrefix> removed = new ArrayList<>();
        for (IpPrefix p : current.keySet()) {
            if (!wanted.containsKey(p))
                removed.add(p);
        }
        removed.sort(null);

        if (added.isEmpty() && changed.isEmpty() && removed.isEmpty())
            return RouteDelta.empty();
        return new RouteDelta(added, changed, removed);
    }

    /** Indexes a route list by prefix; later duplicates win. */
    public static Map<IpPrefix, UnicastRoute> index(Collection<UnicastRoute> routes) {
        Map<IpPrefix, UnicastRoute> out = new HashMap<>(Math.max(16, routes.size() * 2));
        for (UnicastRoute r : routes)
            out.put(r.destination(), r);
        return out;
    }
}
