package com.netctl.fib.model;

import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static com.netctl.fib.RouteFixtures.route;
import static org.junit.Assert.*;

public class UnicastRouteTest {

    @Test
    public void testNextHopOrderDoesNotMatter() {
        UnicastRoute a = route("10.0.0.0/24", "1.1.1.1", "2.2.2.2");
        UnicastRoute b = route("10.0.0.0/24", "2.2.2.2", "1.1.1.1");
        assertTrue(a.sameNextHops(b));
        assertNotEquals(a.nextHops(), b.nextHops());
    }

    @Test
    public void testWeightIsPartOfNextHopIdentity() {
        UnicastRoute a = new UnicastRoute(IpPrefix.parse("10.0.0.0/24"), List.of(new NextHop("eth0", "1.1.1.1", 1)));
        UnicastRoute b = new UnicastRoute(IpPrefix.parse("10.0.0.0/24"), List.of(new NextHop("eth0", "1.1.1.1", 2)));
        assertFalse(a.sameNextHops(b));
    }

    @Test
    public void testNextHopsAreCopied() {
        List<NextHop> hops = new ArrayList<>(List.of(NextHop.of("eth0", "1.1.1.1")));
        UnicastRoute r = new UnicastRoute(IpPrefix.parse("10.0.0.0/24"), hops);
        hops.add(NextHop.of("eth1", "2.2.2.2"));
        assertEquals(1, r.nextHops().size());
    }

    @Test(expected = MalformedSnapshotException.class)
    public void testNegativeWeightRejected() {
        new NextHop("eth0", "1.1.1.1", -1);
    }

    @Test(expected = MalformedSnapshotException.class)
    public void testNullNextHopRejected() {
        List<NextHop> hops = new ArrayList<>();
        hops.add(null);
        new UnicastRoute(IpPrefix.parse("10.0.0.0/24"), hops);
    }
}
