package com.netctl.fib.io;

import com.netctl.fib.model.MalformedSnapshotException;
import com.netctl.fib.model.NextHop;
import com.netctl.fib.model.PerfEvent;
import com.netctl.fib.model.RouteSnapshot;
import com.netctl.fib.model.UnicastRoute;
import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static com.netctl.fib.RouteFixtures.routes;
import static org.junit.Assert.*;

public class RouteSnapshotCodecTest {

    private final RouteSnapshotCodec codec = new RouteSnapshotCodec();

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    public void testEncodedSnapshotDecodesToEqualValue() {
        RouteSnapshot s = new RouteSnapshot("node-1", routes(0, 3, 4), List.of(new PerfEvent("d", "SPF", 42)));
        assertEquals(s, codec.decode(codec.encode(s)));
    }

    @Test
    public void testWireFormat() {
        String json = "{\"nodeName\":\"node-1\",\"unicastRoutes\":[{\"destination\":\"10.1.2.7/24\","
                + "\"nextHops\":[{\"ifName\":\"eth0\",\"address\":\"fe80::1\"}]}]}";
        RouteSnapshot s = codec.decode(utf8(json));
        assertEquals(1, s.size());
        UnicastRoute r = s.unicastRoutes().get(0);
        assertEquals("10.1.2.0/24", r.destination().toString());
        assertEquals(List.of(new NextHop("eth0", "fe80::1", 0)), r.nextHops());
        assertTrue(s.perfEvents().isEmpty());
        assertTrue(new String(codec.encode(s), StandardCharsets.UTF_8).contains("\"destination\":\"10.1.2.0/24\""));
    }

    @Test
    public void testBadPrefixSurfacesItsReason() {
        String json = "{\"nodeName\":\"n\",\"unicastRoutes\":[{\"destination\":\"10.0.0.0/40\",\"nextHops\":[]}]}";
        try {
            codec.decode(utf8(json));
            fail();
        } catch (MalformedSnapshotException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("out of range"));
        }
    }

    @Test
    public void testNullRouteEntryRejected() {
        String json = "{\"nodeName\":\"n\",\"unicastRoutes\":[null]}";
        try {
            codec.decode(utf8(json));
            fail();
        } catch (MalformedSnapshotException e) {
            assertEquals("null route entry", e.getMessage());
        }
    }

    @Test
    public void testGarbageRejectedWithParserReason() {
        try {
            codec.decode(utf8("not json"));
            fail("expected MalformedSnapshotException");
        } catch (MalformedSnapshotException e) {
            assertTrue(e.getMessage(), e.getMessage().startsWith("undecodable snapshot: "));
            assertFalse(e.getMessage(), e.getMessage().contains("line:"));
        }
    }

    @Test(expected = MalformedSnapshotException.class)
    public void testEmptyPayloadRejected() {
        codec.decode(new byte[0]);
    }
}
