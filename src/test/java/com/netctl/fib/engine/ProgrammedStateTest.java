package com.netctl.fib.engine;

import com.netctl.fib.model.RouteDelta;
import com.netctl.fib.model.UnicastRoute;
import org.junit.Test;

import java.util.List;

import static com.netctl.fib.RouteFixtures.route;
import static org.junit.Assert.*;

public class ProgrammedStateTest {

    @Test
    public void testApplyDelta() {
        ProgrammedState s = new ProgrammedState();
        UnicastRoute a = route("10.0.0.0/24", "1.1.1.1");
        UnicastRoute b = route("10.0.1.0/24", "1.1.1.1");
        s.replaceAll(List.of(a, b));

        UnicastRoute b2 = route("10.0.1.0/24", "2.2.2.2");
        UnicastRoute c = route("10.0.2.0/24", "1.1.1.1");
        s.apply(new RouteDelta(List.of(c), List.of(b2), List.of(a.destination())));

        assertEquals(List.of(b2, c), s.routes());
        assertTrue(s.matches(List.of(c, b2)));
    }

    @Test
    public void testRoutesIsACopy() {
        ProgrammedState s = new ProgrammedState();
        s.replaceAll(List.of(route("10.0.0.0/24", "1.1.1.1")));
        List<UnicastRoute> copy = s.routes();
        s.clear();
        assertEquals(1, copy.size());
        assertEquals(0, s.size());
    }

    @Test
    public void testMatchesIsSetWise() {
        ProgrammedState s = new ProgrammedState();
        s.replaceAll(List.of(route("10.0.0.0/24", "1.1.1.1", "2.2.2.2")));
        assertTrue(s.matches(List.of(route("10.0.0.0/24", "2.2.2.2", "1.1.1.1"))));
        assertFalse(s.matches(List.of(route("10.0.0.0/24", "2.2.2.2"))));
        assertFalse(s.matches(List.of()));
    }
}
