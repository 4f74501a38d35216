package com.netctl.fib.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.netctl.fib.api.FibQueryService;

import io.javalin.Javalin;
import io.javalin.http.Context;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Read-only HTTP view of a running pipeline.
 *
 * <pre>
 * GET /api/routes    programmed routes, as a RouteSnapshot
 * GET /api/perf      completed perf traces, oldest first
 * GET /api/counters  counter name -&gt; value
 * GET /api/state     {"state":"RUNNING"}
 * </pre>
 *
 * Handlers run on Jetty threads and only call the thread-safe
 * {@link FibQueryService} methods.
 */
public class FibQueryServer {
    private static final Logger log = LogManager.getLogger(FibQueryServer.class);

    private final FibQueryService service;
    private final ObjectMapper mapper;
    private final Javalin app;
    private boolean started;

    public FibQueryServer(FibQueryService service) {
        this(service, new ObjectMapper());
    }

    public FibQueryServer(FibQueryService service, ObjectMapper mapper) {
        this.service = service;
        this.mapper = mapper;
        this.app = Javalin.create(config -> config.showJavalinBanner = false);

        app.get("/api/routes", ctx -> json(ctx, service::getCurrentState));
        app.get("/api/perf", ctx -> json(ctx, service::getPerfHistory));
        app.get("/api/counters", ctx -> json(ctx, service::getCounters));
        app.get("/api/state", ctx -> json(ctx, () -> Map.of("state", service.getPipelineState().name())));
    }

    /** The configured, not yet started, application. */
    public Javalin app() {
        return app;
    }

    /**
     * Starts serving on {@code port}; 0 picks a free port (see {@link #port()}).
     */
    public synchronized void start(int port) {
        log.info("Starting FIB query server on port {}", port);
        app.start(port);
        started = true;
        log.info("FIB query server listening on port {}", app.port());
    }

    public synchronized int port() {
        return started ? app.port() : -1;
    }

    public synchronized void stop() {
        if (started) {
            app.stop();
            started = false;
        }
    }

    private void json(Context ctx, Supplier<?> body) {
        ctx.contentType("application/json");
        try {
            ctx.result(mapper.writeValueAsString(body.get()));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialise {} response", ctx.path(), e);
            ctx.status(500).result("{\"error\":\"serialisation failed\"}");
        }
    }
}
