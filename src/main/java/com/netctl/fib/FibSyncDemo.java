package com.netctl.fib;

import com.netctl.fib.agent.MockFibAgent;
import com.netctl.fib.ingress.InProcessRouteBus;
import com.netctl.fib.io.FibConfig;
import com.netctl.fib.model.IpPrefix;
import com.netctl.fib.model.NextHop;
import com.netctl.fib.model.PerfEvent;
import com.netctl.fib.model.PerfTrace;
import com.netctl.fib.model.RouteSnapshot;
import com.netctl.fib.model.UnicastRoute;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Pushes route database bursts through an in-process bus into a pipeline over
 * the in-memory agent and prints the per-stage latency of every pass.
 *
 * <p>
 * Each round publishes the previous routes plus {@code routesPerRound} new
 * ones, every route carrying {@code nextHopsPerRoute} next hops, so each pass
 * programs exactly the newly added prefixes.
 */
public class FibSyncDemo {
    private static final Logger log = LogManager.getLogger(FibSyncDemo.class);

    private static final String NODE = "demo-node";
    private static final String ENDPOINT = "inproc://demo-decision";
    private static final int CLIENT_ID = 786;

    public static void main(String[] args) throws Exception {
        int rounds = args.length > 0 ? Integer.parseInt(args[0]) : 2;
        int routesPerRound = args.length > 1 ? Integer.parseInt(args[1]) : 10;
        int nextHopsPerRoute = args.length > 2 ? Integer.parseInt(args[2]) : 128;

        MockFibAgent agent = new MockFibAgent();
        InProcessRouteBus bus = new InProcessRouteBus();
        FibController controller = new FibController(agent, bus.newIngress(), Clock.systemUTC());

        FibConfig config = new FibConfig();
        config.setNodeName(NODE);
        config.setIngressEndpoint(ENDPOINT);
        config.setClientId(CLIENT_ID);
        config.setWaitOnInitialSync(true);
        config.setDebounceMinMs(10);
        config.setDebounceMaxMs(250);
        config.setPerfHistoryCapacity(Math.max(rounds, 1));
        controller.startAsync(config);

        List<UnicastRoute> routes = new ArrayList<>();
        try {
            for (int round = 0; round < rounds; round++) {
                routes.addAll(generateRoutes(routes.size(), routesPerRound, nextHopsPerRoute));
                long now = System.currentTimeMillis();
                RouteSnapshot snapshot = new RouteSnapshot(NODE, routes,
                        List.of(new PerfEvent(NODE, "DECISION_RECEIVED", now)));
                bus.publish(ENDPOINT, snapshot);

                if (!agent.awaitTableSize(CLIENT_ID, routes.size(), 10_000))
                    throw new IllegalStateException("agent did not converge on round " + round);
                log.info("Round {}: {} routes installed", round, agent.routes(CLIENT_ID).size());
            }

            for (PerfTrace trace : controller.getPerfHistory())
                printTrace(trace);
            for (Map.Entry<String, Long> e : controller.getCounters().entrySet())
                log.info("  {} = {}", e.getKey(), e.getValue());
        } finally {
            controller.stop();
        }
    }

    /** Routes {@code 10.<n/256>.<n%256>.0/24}, each with its own set of next hops. */
    static List<UnicastRoute> generateRoutes(int start, int count, int nextHops) {
        List<UnicastRoute> out = new ArrayList<>(count);
        for (int n = start; n < start + count; n++) {
            IpPrefix prefix = new IpPrefix("10." + (n / 256) + "." + (n % 256) + ".0", 24);
            List<NextHop> hops = new ArrayList<>(nextHops);
            for (int h = 0; h < nextHops; h++)
                hops.add(NextHop.of("eth" + (h % 4), "fe80::" + Integer.toHexString(h + 1)));
            out.add(new UnicastRoute(prefix, hops));
        }
        return out;
    }

    private static void printTrace(PerfTrace trace) {
        StringBuilder sb = new StringBuilder("Perf trace, total ").append(trace.totalMs()).append(" ms:");
        for (Map.Entry<String, Long> e : trace.durationsMs().entrySet())
            sb.append(' ').append(e.getKey()).append('=').append(e.getValue()).append("ms");
        log.info(sb.toString());
    }
}
