package com.netctl.fib.engine;

import com.netctl.fib.model.IpPrefix;
import com.netctl.fib.model.MalformedSnapshotException;
import com.netctl.fib.model.RouteSnapshot;
import com.netctl.fib.model.UnicastRoute;

import java.util.HashSet;
import java.util.Set;

/**
 * Ingestion gate. A snapshot either passes whole or is rejected whole.
 *
 * <p>
 * Rejected: a snapshot addressed to another node, duplicate prefixes, a route
 * with no next-hops (every unicast route published here is expected to be
 * reachable). Null entries never get this far; the model constructors refuse
 * them.
 */
public final class SnapshotValidator {

    private final String nodeName;

    public SnapshotValidator(String nodeName) {
        this.nodeName = nodeName;
    }

    public void validate(RouteSnapshot snapshot) {
        if (snapshot == null)
            throw new MalformedSnapshotException("null snapshot");
        if (snapshot.nodeName() == null || snapshot.nodeName().isEmpty())
            throw new MalformedSnapshotException("snapshot without node name");
        if (!snapshot.nodeName().equals(nodeName))
            throw new MalformedSnapshotException(
                    "snapshot for node '" + snapshot.nodeName() + "', expected '" + nodeName + "'");

        Set<IpPrefix> seen = new HashSet<>(snapshot.size() * 2);
        for (UnicastRoute route : snapshot.unicastRoutes()) {
            if (!seen.add(route.destination()))
                throw new MalformedSnapshotException("duplicate prefix " + route.destination());
            if (route.nextHops().isEmpty())
                throw new MalformedSnapshotException("route " + route.destination() + " has no next-hops");
        }
    }
}
