package com.netctl.fib.engine;

import org.junit.Test;

import static org.junit.Assert.*;

public class DebounceSchedulerTest {

    @Test
    public void testBurstCollapsesToLatest() {
        DebounceScheduler<String> d = new DebounceScheduler<>(10, 100);
        assertEquals(10, d.notify("s1", 0));
        assertEquals(13, d.notify("s2", 3));
        assertEquals(16, d.notify("s3", 6));

        assertNull(d.fire(15));
        assertEquals("s3", d.fire(16));
        assertFalse(d.isArmed());
        assertNull(d.fire(1000));
    }

    @Test
    public void testCeilingBoundsTheWindow() {
        DebounceScheduler<Integer> d = new DebounceScheduler<>(10, 50);
        long now = 0;
        d.notify(0, now);
        // keep notifying every 5 ms: the deadline would slide forever without a ceiling
        for (int i = 1; i <= 20; i++) {
            now += 5;
            long deadline = d.notify(i, now);
            assertTrue("deadline " + deadline + " beyond ceiling", deadline <= 50);
            if (d.isDue(now))
                break;
        }
        assertEquals(50, d.deadlineMs());
        assertEquals(Integer.valueOf(10), d.fire(50));
    }

    @Test
    public void testNewWindowAfterFire() {
        DebounceScheduler<String> d = new DebounceScheduler<>(10, 30);
        d.notify("a", 0);
        assertEquals("a", d.fire(10));
        d.notify("b", 100);
        assertEquals(100, d.windowStartMs());
        assertEquals(110, d.deadlineMs());
    }

    @Test
    public void testCancelDropsPending() {
        DebounceScheduler<String> d = new DebounceScheduler<>(10, 30);
        d.notify("a", 0);
        d.cancel();
        assertFalse(d.isArmed());
        assertNull(d.fire(100));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMaxBelowMinRejected() {
        new DebounceScheduler<String>(50, 10);
    }
}
