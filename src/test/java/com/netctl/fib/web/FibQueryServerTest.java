package com.netctl.fib.web;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.netctl.fib.api.FibQueryService;
import com.netctl.fib.api.PipelineState;
import com.netctl.fib.model.PerfEvent;
import com.netctl.fib.model.PerfTrace;
import com.netctl.fib.model.RouteSnapshot;
import io.javalin.testtools.JavalinTest;
import org.junit.Before;
import org.junit.Test;

import java.util.List;
import java.util.Map;

import static com.netctl.fib.RouteFixtures.routes;
import static com.netctl.fib.RouteFixtures.snapshot;
import static org.junit.Assert.*;

public class FibQueryServerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final RouteSnapshot routes = snapshot(routes(0, 3, 2));
    private final PerfTrace trace = PerfTrace.empty().with(new PerfEvent("node-1", "FIB_ROUTE_DB_RECVD", 5));
    private FibQueryServer server;

    @Before
    public void setUp() {
        server = new FibQueryServer(new FibQueryService() {
            @Override
            public RouteSnapshot getCurrentState() {
                return routes;
            }

            @Override
            public List<PerfTrace> getPerfHistory() {
                return List.of(trace);
            }

            @Override
            public Map<String, Long> getCounters() {
                return Map.of("fib.num_routes", 3L);
            }

            @Override
            public PipelineState getPipelineState() {
                return PipelineState.RUNNING;
            }
        });
    }

    @Test
    public void testRoutes() {
        JavalinTest.test(server.app(), (javalin, client) -> {
            var response = client.get("/api/routes");
            assertEquals(200, response.code());
            assertEquals(routes, mapper.readValue(response.body().string(), RouteSnapshot.class));
        });
    }

    @Test
    public void testPerf() {
        JavalinTest.test(server.app(), (javalin, client) -> {
            var response = client.get("/api/perf");
            assertEquals(200, response.code());
            List<PerfTrace> perf = mapper.readValue(response.body().string(),
                    new TypeReference<List<PerfTrace>>() {
                    });
            assertEquals(List.of(trace), perf);
        });
    }

    @Test
    public void testCountersAndState() {
        JavalinTest.test(server.app(), (javalin, client) -> {
            var counters = client.get("/api/counters");
            assertEquals(200, counters.code());
            Map<String, Long> values = mapper.readValue(counters.body().string(),
                    new TypeReference<Map<String, Long>>() {
                    });
            assertEquals(Long.valueOf(3), values.get("fib.num_routes"));

            var state = client.get("/api/state");
            assertTrue(state.header("Content-Type").startsWith("application/json"));
            assertTrue(state.body().string().contains("\"RUNNING\""));
        });
    }

    @Test
    public void testUnknownPathIsNotFound() {
        JavalinTest.test(server.app(), (javalin, client) -> {
            assertEquals(404, client.get("/api/nope").code());
        });
    }
}
