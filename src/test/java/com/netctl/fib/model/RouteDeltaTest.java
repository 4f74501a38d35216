package com.netctl.fib.model;

import org.junit.Test;

import java.util.List;

import static com.netctl.fib.RouteFixtures.route;
import static org.junit.Assert.*;

public class RouteDeltaTest {

    @Test(expected = FibInvariantException.class)
    public void testPrefixInTwoListsIsFatal() {
        UnicastRoute r = route("10.0.0.0/24", "1.1.1.1");
        new RouteDelta(List.of(r), List.of(), List.of(r.destination()));
    }

    @Test(expected = FibInvariantException.class)
    public void testDuplicateWithinListIsFatal() {
        new RouteDelta(List.of(), List.of(route("10.0.0.0/24", "1.1.1.1"), route("10.0.0.5/24", "2.2.2.2")), List.of());
    }

    @Test
    public void testAddsAndUpdatesKeepsAddsFirst() {
        UnicastRoute a = route("10.0.0.0/24", "1.1.1.1");
        UnicastRoute c = route("10.0.1.0/24", "1.1.1.1");
        RouteDelta d = new RouteDelta(List.of(a), List.of(c), List.of(IpPrefix.parse("10.0.2.0/24")));
        assertEquals(List.of(a, c), d.addsAndUpdates());
        assertEquals(3, d.size());
        assertFalse(d.isEmpty());
        assertTrue(RouteDelta.empty().isEmpty());
    }
}
