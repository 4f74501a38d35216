package com.netctl.fib.engine;

import com.netctl.fib.model.IpPrefix;
import com.netctl.fib.model.RouteDelta;
import com.netctl.fib.model.RouteSnapshot;
import com.netctl.fib.model.UnicastRoute;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * The pipeline's belief of what is installed in the forwarding agent.
 *
 * <p>
 * Single writer: only the pipeline owner thread mutates it, and only after the
 * agent confirmed the corresponding call (or in dry-run mode). The owner may
 * read through {@link #ownerView()} without locking. Other threads read
 * through {@link #routes()} / {@link #toSnapshot(String)}, which copy under a
 * read lock; the write lock is held only for the in-memory update, never
 * across an agent call.
 */
public final class ProgrammedState {

    private final Map<IpPrefix, UnicastRoute> routes = new HashMap<>();
    private final Map<IpPrefix, UnicastRoute> ownerView = Collections.unmodifiableMap(routes);
    private final ReentrantReadWriteLock rw = new ReentrantReadWriteLock();

    /**
     * Live, unlocked view for the owner thread (the diff engine's input).
     * Must not be handed to other threads.
     */
    public Map<IpPrefix, UnicastRoute> ownerView() {
        return ownerView;
    }

    public void apply(RouteDelta delta) {
        rw.writeLock().lock();
        try {
            for (IpPrefix p : delta.removed())
                routes.remove(p);
            for (UnicastRoute r : delta.added())
                routes.put(r.destination(), r);
            for (UnicastRoute r : delta.changed())
                routes.put(r.destination(), r);
        } finally {
            rw.writeLock().unlock();
        }
    }

    public void applyDeletes(Collection<IpPrefix> prefixes) {
        rw.writeLock().lock();
        try {
            for (IpPrefix p : prefixes)
                routes.remove(p);
        } finally {
            rw.writeLock().unlock();
        }
    }

    public void applyUpdates(Collection<UnicastRoute> updates) {
        rw.writeLock().lock();
        try {
            for (UnicastRoute r : updates)
                routes.put(r.destination(), r);
        } finally {
            rw.writeLock().unlock();
        }
    }

    /** Replaces the whole belief, after a confirmed full sync. */
    public void replaceAll(Collection<UnicastRoute> installed) {
        rw.writeLock().lock();
        try {
            routes.clear();
            for (UnicastRoute r : installed)
                routes.put(r.destination(), r);
        } finally {
            rw.writeLock().unlock();
        }
    }

    public void clear() {
        replaceAll(List.of());
    }

    public int size() {
        rw.readLock().lock();
        try {
            return routes.size();
        } finally {
            rw.readLock().unlock();
        }
    }

    /** Point-in-time copy, sorted by prefix. Safe from any thread. */
    public List<UnicastRoute> routes() {
        List<UnicastRoute> copy;
        rw.readLock().lock();
        try {
            copy = new ArrayList<>(routes.values());
        } finally {
            rw.readLock().unlock();
        }
        copy.sort(Comparator.comparing(UnicastRoute::destination));
        return copy;
    }

    public RouteSnapshot toSnapshot(String nodeName) {
        return new RouteSnapshot(nodeName, routes());
    }

    /**
     * Set-wise comparison against {@code desired}: same prefixes, same next-hop
     * sets. Owner thread only.
     */
    public boolean matches(Collection<UnicastRoute> desired) {
        if (desired.size() != routes.size())
            return false;
        for (UnicastRoute want : desired) {
            UnicastRoute have = routes.get(want.destination());
            if (have == null || !have.sameNextHops(want))
                return false;
        }
        return true;
    }
}
