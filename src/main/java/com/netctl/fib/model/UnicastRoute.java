package com.netctl.fib.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A destination prefix and its ordered next-hops.
 *
 * <p>
 * Next-hop order is preserved for programming but is insignificant for
 * equality: {@link #sameNextHops(UnicastRoute)} compares set-wise.
 */
public record UnicastRoute(IpPrefix destination, List<NextHop> nextHops) {

    @JsonCreator
    public UnicastRoute(@JsonProperty("destination") IpPrefix destination,
            @JsonProperty("nextHops") List<NextHop> nextHops) {
        if (destination == null)
            throw new MalformedSnapshotException("route without destination");
        this.destination = destination;
        this.nextHops = RouteSnapshot.copyOf(nextHops, "next-hop");
    }

    @JsonIgnore
    public Set<NextHop> nextHopSet() {
        return new HashSet<>(nextHops);
    }

    public boolean sameNextHops(UnicastRoute other) {
        return sameNextHops(nextHops, other.nextHops);
    }

    static boolean sameNextHops(List<NextHop> a, List<NextHop> b) {
        if (a == b)
            return true;
        if (a.equals(b))
            return true;
        return new HashSet<>(a).equals(new HashSet<>(b));
    }

    /** Set-wise route equality, the notion used by convergence checks. */
    public boolean equivalentTo(UnicastRoute other) {
        return other != null && Objects.equals(destination, other.destination) && sameNextHops(other);
    }

    @Override
    public String toString() {
        return destination + " -> " + nextHops.size() + " nexthop(s)";
    }
}
