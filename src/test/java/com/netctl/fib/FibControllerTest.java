package com.netctl.fib;

import com.netctl.fib.agent.MockFibAgent;
import com.netctl.fib.api.IngressException;
import com.netctl.fib.api.PipelineListener;
import com.netctl.fib.api.PipelineState;
import com.netctl.fib.ingress.InProcessRouteBus;
import com.netctl.fib.io.FibConfig;
import com.netctl.fib.model.FibInvariantException;
import com.netctl.fib.model.PerfTrace;
import com.netctl.fib.model.RouteDelta;
import com.netctl.fib.model.RouteSnapshot;
import com.netctl.fib.model.UnicastRoute;
import com.netctl.fib.util.FibCounters;
import com.netctl.fib.util.PerfTraceRecorder;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

import static com.netctl.fib.RouteFixtures.route;
import static com.netctl.fib.RouteFixtures.routes;
import static com.netctl.fib.RouteFixtures.snapshot;
import static com.netctl.fib.RouteFixtures.testConfig;
import static org.junit.Assert.*;

public class FibControllerTest {
    private static final String EP = "inproc://decision";
    private static final int CLIENT = 786;
    private static final long WAIT_MS = 5_000;

    private MockFibAgent agent;
    private InProcessRouteBus bus;
    private FibController controller;
    private final List<RouteDelta> programmed = new CopyOnWriteArrayList<>();
    private final List<String> rejected = new CopyOnWriteArrayList<>();

    @Before
    public void setUp() {
        agent = new MockFibAgent();
        bus = new InProcessRouteBus();
        controller = new FibController(agent, bus.newIngress(), Clock.systemUTC());
        controller.addListener(new PipelineListener() {
            @Override
            public void onPassProgrammed(RouteDelta delta, PerfTrace trace) {
                programmed.add(delta);
            }

            @Override
            public void onSnapshotRejected(String reason) {
                rejected.add(reason);
            }
        });
    }

    @After
    public void tearDown() {
        controller.stop();
    }

    private static void waitFor(String what, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + WAIT_MS;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline)
                fail("timed out waiting for " + what);
            Thread.sleep(5);
        }
    }

    private long counter(String key) {
        return controller.getCounters().getOrDefault(key, 0L);
    }

    private boolean stateEquals(List<UnicastRoute> desired) {
        RouteSnapshot s = controller.getCurrentState();
        if (s.size() != desired.size())
            return false;
        for (UnicastRoute want : desired) {
            boolean found = false;
            for (UnicastRoute have : s.unicastRoutes())
                found |= have.equivalentTo(want);
            if (!found)
                return false;
        }
        return true;
    }

    @Test
    public void testTenRoutesThenTenMore() throws Exception {
        controller.startAsync(testConfig(EP));
        assertEquals(PipelineState.RUNNING, controller.getPipelineState());

        List<UnicastRoute> first = routes(0, 10, 128);
        bus.publish(EP, snapshot(first));
        waitFor("first pass", () -> programmed.size() == 1);
        assertEquals(10, controller.getCurrentState().size());
        assertTrue(stateEquals(first));
        assertEquals(10, agent.routes(CLIENT).size());

        List<UnicastRoute> second = new ArrayList<>(first);
        second.addAll(routes(10, 10, 128));
        bus.publish(EP, snapshot(second));
        waitFor("second pass", () -> programmed.size() == 2);

        RouteDelta delta = programmed.get(1);
        assertEquals(10, delta.added().size());
        assertTrue(delta.changed().isEmpty());
        assertTrue(delta.removed().isEmpty());
        assertTrue(stateEquals(second));
        assertEquals(20, agent.routes(CLIENT).size());
    }

    @Test
    public void testRedeliveryIsNoop() throws Exception {
        controller.startAsync(testConfig(EP));
        RouteSnapshot s = snapshot(routes(0, 5, 4));
        bus.publish(EP, s);
        waitFor("first pass", () -> programmed.size() == 1);
        int calls = agent.programmingCalls();

        bus.publish(EP, s);
        waitFor("noop pass", () -> counter(FibCounters.PASSES_NOOP) == 1);
        assertEquals(calls, agent.programmingCalls());
        assertEquals(1, programmed.size());
    }

    @Test
    public void testBurstIsDebouncedToOnePass() throws Exception {
        FibConfig cfg = testConfig(EP);
        cfg.setEnableDebounce(true);
        cfg.setDebounceMinMs(150);
        cfg.setDebounceMaxMs(2_000);
        controller.startAsync(cfg);

        List<UnicastRoute> last = null;
        for (int k = 1; k <= 5; k++) {
            last = routes(0, k, 2);
            bus.publish(EP, snapshot(last));
        }
        waitFor("debounced pass", () -> programmed.size() == 1);
        Thread.sleep(300);

        assertEquals(1, programmed.size());
        assertEquals(1, agent.addCount());
        assertEquals(5, programmed.get(0).added().size());
        assertTrue(stateEquals(last));
    }

    @Test
    public void testCeilingForcesProgressUnderContinuousInput() throws Exception {
        FibConfig cfg = testConfig(EP);
        cfg.setEnableDebounce(true);
        cfg.setDebounceMinMs(50);
        cfg.setDebounceMaxMs(150);
        controller.startAsync(cfg);

        long end = System.currentTimeMillis() + 900;
        int n = 1;
        while (System.currentTimeMillis() < end) {
            bus.publish(EP, snapshot(routes(0, n++, 1)));
            Thread.sleep(15);
        }
        // without the ceiling the window would never close while input keeps coming
        assertTrue("passes: " + programmed.size(), programmed.size() >= 3);
    }

    @Test
    public void testPerfTraceStages() throws Exception {
        controller.startAsync(testConfig(EP));
        bus.publish(EP, snapshot(routes(0, 2, 2)));
        waitFor("pass", () -> controller.getPerfHistory().size() == 1);

        PerfTrace t = controller.getPerfHistory().get(0);
        List<String> stages = new ArrayList<>();
        t.events().forEach(e -> stages.add(e.eventDescr()));
        assertEquals(List.of(PerfTraceRecorder.ROUTE_DB_RECEIVED, PerfTraceRecorder.DEBOUNCE,
                PerfTraceRecorder.ROUTES_PROGRAMMED), stages);
    }

    @Test
    public void testAgentOutageLeavesStateThenReconcileConverges() throws Exception {
        FibConfig cfg = testConfig(EP);
        cfg.setEnablePeriodicSync(true);
        cfg.setSyncIntervalMs(100);
        controller.startAsync(cfg);

        agent.setFailing(true);
        List<UnicastRoute> desired = routes(0, 3, 2);
        bus.publish(EP, snapshot(desired));
        waitFor("failed pass", () -> counter(FibCounters.PASSES_FAILED) == 1);
        assertEquals(0, controller.getCurrentState().size());
        waitFor("reconcile failures", () -> counter(FibCounters.RECONCILE_FAILURE) >= 1);

        agent.setFailing(false);
        waitFor("convergence", () -> stateEquals(desired) && agent.routes(CLIENT).size() == 3);
        assertTrue(counter(FibCounters.RECONCILE_SUCCESS) >= 1);
    }

    @Test
    public void testPeriodicSyncRepairsDrift() throws Exception {
        FibConfig cfg = testConfig(EP);
        cfg.setEnablePeriodicSync(true);
        cfg.setSyncIntervalMs(100);
        controller.startAsync(cfg);

        List<UnicastRoute> desired = routes(0, 4, 2);
        bus.publish(EP, snapshot(desired));
        waitFor("pass", () -> agent.routes(CLIENT).size() == 4);

        agent.corrupt(CLIENT, desired.get(2).destination(), null);
        waitFor("repair", () -> agent.routes(CLIENT).size() == 4);
        assertTrue(stateEquals(desired));
    }

    @Test
    public void testAgentRestartTriggersResync() throws Exception {
        FibConfig cfg = testConfig(EP);
        cfg.setAgentHealthCheckIntervalMs(30);
        controller.startAsync(cfg);

        List<UnicastRoute> desired = routes(0, 6, 2);
        bus.publish(EP, snapshot(desired));
        waitFor("pass", () -> agent.routes(CLIENT).size() == 6);

        agent.restart();
        waitFor("restart detected", () -> counter(FibCounters.AGENT_RESTARTS) == 1);
        waitFor("table restored", () -> agent.routes(CLIENT).size() == 6);
    }

    @Test
    public void testMalformedSnapshotsAreDropped() throws Exception {
        controller.startAsync(testConfig(EP));

        bus.publish(EP, "{not json".getBytes(StandardCharsets.UTF_8));
        bus.publish(EP, snapshot(route("10.0.0.0/24", "1.1.1.1"), route("10.0.0.0/24", "2.2.2.2")));
        bus.publish(EP, new RouteSnapshot("other-node", List.of(route("10.0.0.0/24", "1.1.1.1"))));

        assertEquals(3, rejected.size());
        assertEquals(3, counter(FibCounters.SNAPSHOTS_REJECTED));
        Thread.sleep(100);
        assertEquals(0, controller.getCurrentState().size());
        assertEquals(0, agent.addCount());
    }

    @Test
    public void testEmptySnapshotWithdrawsAll() throws Exception {
        controller.startAsync(testConfig(EP));
        bus.publish(EP, snapshot(routes(0, 3, 1)));
        waitFor("install", () -> agent.routes(CLIENT).size() == 3);

        bus.publish(EP, snapshot(List.of()));
        waitFor("withdraw", () -> agent.routes(CLIENT).isEmpty());
        assertEquals(0, controller.getCurrentState().size());
        assertEquals(1, agent.deleteCount());
    }

    @Test
    public void testDryrunNeverCallsAgent() throws Exception {
        FibConfig cfg = testConfig(EP);
        cfg.setDryrun(true);
        controller.startAsync(cfg);

        bus.publish(EP, snapshot(routes(0, 10, 128)));
        waitFor("dryrun pass", () -> programmed.size() == 1);
        assertEquals(10, controller.getCurrentState().size());
        assertEquals(0, agent.programmingCalls());
    }

    @Test
    public void testIngressReconnects() throws Exception {
        controller.startAsync(testConfig(EP));

        bus.setReachable(false);
        bus.disconnectAll(EP, new RuntimeException("publisher went away"));
        Thread.sleep(60);
        assertEquals(0, bus.subscriberCount(EP));
        assertEquals(1, counter(FibCounters.INGRESS_DISCONNECTS));

        bus.setReachable(true);
        waitFor("reconnect", () -> counter(FibCounters.INGRESS_RECONNECTS) == 1);
        bus.publish(EP, snapshot(routes(0, 2, 1)));
        waitFor("pass after reconnect", () -> agent.routes(CLIENT).size() == 2);
    }

    @Test
    public void testStopIsIdempotentAndRestartable() throws Exception {
        controller.startAsync(testConfig(EP));
        bus.publish(EP, snapshot(routes(0, 2, 1)));
        waitFor("pass", () -> programmed.size() == 1);

        controller.stop();
        controller.stop();
        assertEquals(PipelineState.STOPPED, controller.getPipelineState());
        assertEquals(0, bus.subscriberCount(EP));
        assertEquals(0, controller.getCurrentState().size());

        controller.startAsync(testConfig(EP));
        assertTrue(controller.awaitRunning(1, TimeUnit.SECONDS));
        assertEquals(1, bus.subscriberCount(EP));
    }

    @Test
    public void testRestartReprogramsAgentThatLostItsTable() throws Exception {
        RouteSnapshot desired = snapshot(routes(0, 2, 1));
        controller.startAsync(testConfig(EP));
        bus.publish(EP, desired);
        assertTrue(agent.awaitTableSize(CLIENT, 2, WAIT_MS));
        controller.stop();

        agent.restart();
        agent.failNextCalls(3);
        controller.startAsync(testConfig(EP));
        assertEquals(PipelineState.RUNNING, controller.getPipelineState());
        assertTrue(agent.routes(CLIENT).isEmpty());
        assertEquals(0, controller.getCurrentState().size());

        bus.publish(EP, desired);
        assertTrue(agent.awaitTableSize(CLIENT, 2, WAIT_MS));
        waitFor("state", () -> controller.getCurrentState().size() == 2);
    }

    @Test
    public void testBlockingStartReturnsAfterStop() throws Exception {
        AtomicReference<Throwable> error = new AtomicReference<>();
        Thread runner = new Thread(() -> {
            try {
                controller.start(testConfig(EP));
            } catch (Exception e) {
                error.set(e);
            }
        });
        runner.start();
        assertTrue(controller.awaitRunning(WAIT_MS, TimeUnit.MILLISECONDS));
        assertTrue(runner.isAlive());

        controller.stop();
        runner.join(WAIT_MS);
        assertFalse(runner.isAlive());
        assertNull(error.get());
    }

    @Test
    public void testStartFailsCleanlyWhenIngressUnreachable() throws Exception {
        bus.setReachable(false);
        try {
            controller.startAsync(testConfig(EP));
            fail("expected connect failure");
        } catch (IngressException expected) {
            assertEquals(PipelineState.STOPPED, controller.getPipelineState());
        }
        bus.setReachable(true);
        controller.startAsync(testConfig(EP));
        assertEquals(PipelineState.RUNNING, controller.getPipelineState());
    }

    @Test
    public void testFatalErrorFailsPipeline() throws Exception {
        AtomicReference<Throwable> fatal = new AtomicReference<>();
        controller.setFatalHook(fatal::set);
        controller.addListener(new PipelineListener() {
            @Override
            public void onPassProgrammed(RouteDelta delta, PerfTrace trace) {
                throw new AssertionError("listener broke an invariant");
            }
        });
        controller.startAsync(testConfig(EP));

        bus.publish(EP, snapshot(routes(0, 1, 1)));
        waitFor("fatal hook", () -> fatal.get() != null);
        assertEquals(PipelineState.FAILED, controller.getPipelineState());
        assertEquals(0, bus.subscriberCount(EP));
    }

    @Test
    public void testInvariantViolationInListenerFailsPipeline() throws Exception {
        AtomicReference<Throwable> fatal = new AtomicReference<>();
        controller.setFatalHook(fatal::set);
        controller.addListener(new PipelineListener() {
            @Override
            public void onPassProgrammed(RouteDelta delta, PerfTrace trace) {
                throw new FibInvariantException("programmed state diverged");
            }
        });
        controller.startAsync(testConfig(EP));

        bus.publish(EP, snapshot(routes(0, 1, 1)));
        waitFor("fatal hook", () -> fatal.get() != null);
        assertTrue(fatal.get() instanceof FibInvariantException);
        assertEquals(PipelineState.FAILED, controller.getPipelineState());
        assertEquals(0, bus.subscriberCount(EP));
    }

    @Test
    public void testInitialSyncClearsStaleAgentRoutes() throws Exception {
        agent.syncRoutes(CLIENT, routes(0, 3, 1));
        controller.startAsync(testConfig(EP));
        assertEquals(2, agent.syncCount());
        assertTrue(agent.routes(CLIENT).isEmpty());
    }
}
