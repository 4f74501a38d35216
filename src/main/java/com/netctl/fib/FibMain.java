package com.netctl.fib;

import com.netctl.fib.agent.HttpFibAgentClient;
import com.netctl.fib.agent.MockFibAgent;
import com.netctl.fib.api.FibAgent;
import com.netctl.fib.ingress.InProcessRouteBus;
import com.netctl.fib.io.FibConfig;
import com.netctl.fib.io.FibConfigException;
import com.netctl.fib.io.FibConfigLoader;
import com.netctl.fib.web.FibQueryServer;

import lombok.extern.log4j.Log4j2;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Process entry point: {@code FibMain [config.json]}. Without an argument the
 * bundled {@code fib.json} is used.
 */
@Log4j2
public final class FibMain {

    private FibMain() {
    }

    public static void main(String[] args) throws Exception {
        FibConfig config = args.length > 0
                ? FibConfigLoader.load(Path.of(args[0]))
                : FibConfigLoader.loadResource("/fib.json");

        FibAgent agent = createAgent(config);
        InProcessRouteBus bus = new InProcessRouteBus();
        FibController controller = new FibController(agent, bus.newIngress(), Clock.systemUTC());
        controller.setFatalHook(cause -> {
            log.fatal("FIB pipeline failed, exiting", cause);
            System.exit(1);
        });

        FibQueryServer queryServer = null;
        if (config.getQueryPort() > 0) {
            queryServer = new FibQueryServer(controller);
            queryServer.start(config.getQueryPort());
        }

        FibQueryServer server = queryServer;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            controller.stop();
            if (server != null)
                server.stop();
        }, "fib-shutdown"));

        controller.start(config);
    }

    /**
     * @throws FibConfigException if programming is live but no agent endpoint
     *         is configured
     */
    static FibAgent createAgent(FibConfig config) {
        if (config.isDryrun()) {
            log.info("Dryrun, using in-memory agent");
            return new MockFibAgent();
        }
        String endpoint = config.getAgentEndpoint();
        if (endpoint == null || endpoint.isBlank())
            throw new FibConfigException("agentEndpoint is required when dryrun is false");
        return new HttpFibAgentClient(endpoint, Duration.ofMillis(config.getAgentTimeoutMs()));
    }
}
