package com.netctl.fib.model;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The minimal change set between what is programmed and what is desired.
 *
 * <p>
 * Invariant: a prefix appears in at most one of {@code added}, {@code changed}
 * and {@code removed}, and at most once within it. The constructor enforces
 * this and throws {@link FibInvariantException} otherwise, since a delta that
 * breaks it can only come from a bug in the diff engine.
 */
public record RouteDelta(List<UnicastRoute> added, List<UnicastRoute> changed, List<IpPrefix> removed) {

    private static final RouteDelta EMPTY = new RouteDelta(List.of(), List.of(), List.of());

    public RouteDelta {
        added = List.copyOf(added);
        changed = List.copyOf(changed);
        removed = List.copyOf(removed);

        Set<IpPrefix> seen = new HashSet<>(added.size() + changed.size() + removed.size());
        for (UnicastRoute r : added)
            if (!seen.add(r.destination()))
                throw new FibInvariantException("prefix " + r.destination() + " appears twice in delta (added)");
        for (UnicastRoute r : changed)
            if (!seen.add(r.destination()))
                throw new FibInvariantException("prefix " + r.destination() + " appears twice in delta (changed)");
        for (IpPrefix p : removed)
            if (!seen.add(p))
                throw new FibInvariantException("prefix " + p + " appears twice in delta (removed)");
    }

    public static RouteDelta empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return added.isEmpty() && changed.isEmpty() && removed.isEmpty();
    }

    public int size() {
        return added.size() + changed.size() + removed.size();
    }

    /** Additions followed by changes: the payload of one add-or-update call. */
    public List<UnicastRoute> addsAndUpdates() {
        if (changed.isEmpty())
            return added;
        if (added.isEmpty())
            return changed;
        List<UnicastRoute> out = new ArrayList<>(added.size() + changed.size());
        out.addAll(added);
        out.addAll(changed);
        return out;
    }

    @Override
    public String toString() {
        return "RouteDelta[+" + added.size() + " ~" + changed.size() + " -" + removed.size() + "]";
    }
}
