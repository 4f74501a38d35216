package com.netctl.fib;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.netctl.fib.api.FibAgent;
import com.netctl.fib.api.FibAgentException;
import com.netctl.fib.api.FibQueryService;
import com.netctl.fib.api.IngressException;
import com.netctl.fib.api.PipelineListener;
import com.netctl.fib.api.PipelineState;
import com.netctl.fib.api.RouteIngress;
import com.netctl.fib.engine.AgentCaller;
import com.netctl.fib.engine.DebounceScheduler;
import com.netctl.fib.engine.FibProgrammer;
import com.netctl.fib.engine.ProgramResult;
import com.netctl.fib.engine.ProgrammedState;
import com.netctl.fib.engine.Reconciler;
import com.netctl.fib.engine.RouteDiff;
import com.netctl.fib.engine.SnapshotValidator;
import com.netctl.fib.io.FibConfig;
import com.netctl.fib.io.RouteSnapshotCodec;
import com.netctl.fib.model.FibInvariantException;
import com.netctl.fib.model.MalformedSnapshotException;
import com.netctl.fib.model.PerfTrace;
import com.netctl.fib.model.RouteDelta;
import com.netctl.fib.model.RouteSnapshot;
import com.netctl.fib.util.CompositePipelineListener;
import com.netctl.fib.util.ErrorRateLimiter;
import com.netctl.fib.util.FibCounters;
import com.netctl.fib.util.PerfHistory;
import com.netctl.fib.util.PerfTraceRecorder;
import com.netctl.fib.wiring.FibEvent;
import com.netctl.fib.wiring.FibEventHandler;
import com.netctl.fib.wiring.FibExceptionHandler;
import com.netctl.fib.wiring.PassRunner;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * The FIB synchronisation pipeline: ingest, debounce, diff, program,
 * reconcile.
 *
 * <p>
 * <b>Threading.</b> One Disruptor consumer is the owner thread and the only
 * writer of {@link ProgrammedState}. Everything that touches the agent or the
 * state is published into the ring as a {@link FibEvent}: validated snapshots
 * from the ingress thread, debounce deadlines, reconciliation ticks and health
 * checks from the timer thread. The periodic reconciliation therefore never
 * races an in-flight delta pass. Query methods read copies and may be called
 * from any thread.
 *
 * <p>
 * <b>Lifecycle.</b> {@code STOPPED -> STARTING -> RUNNING -> STOPPING -> STOPPED}.
 * {@link #start(FibConfig)} blocks until {@link #stop()}; {@link #startAsync}
 * returns once running. A fatal invariant violation moves the pipeline to
 * {@code FAILED}, tears it down and invokes the fatal hook. Teardown drops
 * the programmed state. A stopped or failed controller can be started again
 * and begins, like a fresh one, with an empty state and an initial sync.
 */
public class FibController implements FibQueryService {
    private static final Logger log = LogManager.getLogger(FibController.class);

    private final FibAgent agent;
    private final RouteIngress ingress;
    private final Clock clock;
    private final RouteSnapshotCodec codec;

    private final FibCounters counters = new FibCounters();
    private final ProgrammedState state = new ProgrammedState();
    private final CompositePipelineListener listeners = new CompositePipelineListener();
    private final ErrorRateLimiter passErrLimiter = new ErrorRateLimiter(log, Level.WARN, 1000);
    private final ErrorRateLimiter reconnectLimiter = new ErrorRateLimiter(log, Level.WARN, 5000);

    private final ReentrantLock lifecycleLock = new ReentrantLock();
    private volatile PipelineState pipelineState = PipelineState.STOPPED;
    private volatile CountDownLatch runningLatch = new CountDownLatch(1);
    private volatile Run run;
    private volatile PerfHistory perfHistory = new PerfHistory(1);
    private volatile String nodeName = "";
    private volatile Consumer<Throwable> fatalHook = t -> {
    };

    public FibController(FibAgent agent, RouteIngress ingress, Clock clock) {
        this(agent, ingress, clock, new RouteSnapshotCodec());
    }

    public FibController(FibAgent agent, RouteIngress ingress, Clock clock, RouteSnapshotCodec codec) {
        this.agent = agent;
        this.ingress = ingress;
        this.clock = clock;
        this.codec = codec;
    }

    /**
     * Everything that lives for one start/stop cycle.
     */
    private final class Run {
        final FibConfig config;
        final CountDownLatch stopSignal = new CountDownLatch(1);
        final CountDownLatch stoppedLatch = new CountDownLatch(1);
        final SnapshotValidator validator;
        final PerfTraceRecorder recorder;
        final AgentCaller caller;
        final FibProgrammer programmer;
        final Reconciler reconciler;
        final ScheduledExecutorService timers;
        final OwnerLoop loop;
        final Disruptor<FibEvent> disruptor;
        volatile RingBuffer<FibEvent> ringBuffer;
        volatile boolean stopping;

        Run(FibConfig config, PerfHistory history) {
            this.config = config;
            this.validator = new SnapshotValidator(config.getNodeName());
            this.recorder = new PerfTraceRecorder(config.getNodeName(), clock, history, counters);
            this.caller = new AgentCaller(config.retryPolicy(), config.getAgentTimeoutMs(), stopSignal, counters);
            this.programmer = new FibProgrammer(agent, state, caller, config.isDryrun(), config.getClientId(),
                    counters);
            this.reconciler = new Reconciler(agent, caller, programmer, state, config.getClientId(),
                    config.getReconcileAlertThreshold(), counters);
            this.timers = Executors.newSingleThreadScheduledExecutor(DaemonThreadFactory.INSTANCE);
            this.loop = new OwnerLoop(this);

            this.disruptor = new Disruptor<>(FibEvent::new, config.getRingBufferSize(),
                    DaemonThreadFactory.INSTANCE, ProducerType.MULTI, new BlockingWaitStrategy());
            disruptor.setDefaultExceptionHandler(new FibExceptionHandler(FibController.this::onFatal, counters));
            disruptor.handleEventsWith(new FibEventHandler(loop, counters));
        }
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    /**
     * Starts the pipeline and blocks until {@link #stop()} is called from
     * another thread (or a fatal error tears it down).
     */
    public void start(FibConfig config) throws IngressException, InterruptedException {
        Run r = startup(config);
        awaitUninterruptibly(r.stoppedLatch);
    }

    /**
     * Starts the pipeline and returns once it is {@code RUNNING}.
     */
    public void startAsync(FibConfig config) throws IngressException, InterruptedException {
        startup(config);
    }

    /**
     * @return true if the pipeline reached {@code RUNNING} within the timeout
     */
    public boolean awaitRunning(long timeout, TimeUnit unit) throws InterruptedException {
        return runningLatch.await(timeout, unit) && pipelineState == PipelineState.RUNNING;
    }

    private Run startup(FibConfig config) throws IngressException, InterruptedException {
        config.validate();
        lifecycleLock.lock();
        try {
            if (pipelineState != PipelineState.STOPPED && pipelineState != PipelineState.FAILED)
                throw new IllegalStateException("Cannot start pipeline in state " + pipelineState);
            pipelineState = PipelineState.STARTING;
            log.info("Starting FIB pipeline for node {} (dryrun={}, debounce={}, periodicSync={})",
                    config.getNodeName(), config.isDryrun(), config.isEnableDebounce(), config.isEnablePeriodicSync());

            nodeName = config.getNodeName();
            perfHistory = new PerfHistory(config.getPerfHistoryCapacity());
            // no owner thread yet; a new run starts with no belief about the agent
            state.clear();
            Run r = new Run(config, perfHistory);
            try {
                r.ringBuffer = r.disruptor.start();
                this.run = r;
                ingress.connect(config.getIngressEndpoint(), new IngressHandler(r));

                CountDownLatch synced = new CountDownLatch(1);
                publishControl(r, FibEvent.Type.INITIAL_SYNC, synced);
                if (config.isWaitOnInitialSync()) {
                    log.info("Waiting for initial sync with agent");
                    synced.await();
                }

                if (config.isEnablePeriodicSync()) {
                    r.timers.scheduleWithFixedDelay(() -> publishControl(r, FibEvent.Type.RECONCILE_TIMER, null),
                            config.getSyncIntervalMs(), config.getSyncIntervalMs(), TimeUnit.MILLISECONDS);
                }
                if (config.getAgentHealthCheckIntervalMs() > 0 && !config.isDryrun()) {
                    r.timers.scheduleWithFixedDelay(() -> publishControl(r, FibEvent.Type.HEALTH_CHECK, null),
                            config.getAgentHealthCheckIntervalMs(), config.getAgentHealthCheckIntervalMs(),
                            TimeUnit.MILLISECONDS);
                }
                if (r.stopping)
                    throw new IllegalStateException("pipeline failed during initial sync");
            } catch (IngressException | InterruptedException | RuntimeException e) {
                log.error("FIB pipeline failed to start: {}", e.getMessage());
                teardown(r);
                pipelineState = PipelineState.STOPPED;
                throw e;
            }

            pipelineState = PipelineState.RUNNING;
            runningLatch.countDown();
            log.info("FIB pipeline running, subscribed to {}", config.getIngressEndpoint());
            return r;
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * Stops the pipeline. Idempotent. Ingestion halts first, then timers; an
     * agent call already in flight runs to completion or timeout, pending
     * retries are abandoned. Must not be called from a pipeline listener.
     */
    public void stop() {
        lifecycleLock.lock();
        try {
            Run r = run;
            if (r == null || pipelineState == PipelineState.STOPPED)
                return;
            pipelineState = PipelineState.STOPPING;
            log.info("Stopping FIB pipeline");
            teardown(r);
            pipelineState = PipelineState.STOPPED;
            log.info("FIB pipeline stopped");
        } finally {
            lifecycleLock.unlock();
        }
    }

    private void teardown(Run r) {
        if (r.stopping && r.stoppedLatch.getCount() == 0)
            return;
        r.stopping = true;
        r.stopSignal.countDown();
        ingress.close();
        r.timers.shutdownNow();
        if (r.ringBuffer != null) {
            long waitMs = r.config.getAgentTimeoutMs() * 2 + 1000;
            try {
                r.disruptor.shutdown(waitMs, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                log.warn("Owner thread did not drain within {} ms, halting", waitMs);
                r.disruptor.halt();
            }
        }
        r.caller.close();
        state.clear();
        if (run == r)
            run = null;
        runningLatch = new CountDownLatch(1);
        r.stoppedLatch.countDown();
    }

    /** Called by the exception handler on the owner thread, or from {@link #reject}. */
    private void onFatal(Throwable cause) {
        Run r = run;
        pipelineState = PipelineState.FAILED;
        if (r == null)
            return;
        r.stopping = true;
        Thread t = new Thread(() -> {
            lifecycleLock.lock();
            try {
                teardown(r);
                pipelineState = PipelineState.FAILED;
            } finally {
                lifecycleLock.unlock();
            }
            fatalHook.accept(cause);
        }, "fib-fatal");
        t.setDaemon(true);
        t.start();
    }

    /** Invoked after a fatal error has torn the pipeline down. */
    public void setFatalHook(Consumer<Throwable> hook) {
        this.fatalHook = hook;
    }

    public void addListener(PipelineListener listener) {
        listeners.add(listener);
    }

    // ------------------------------------------------------------------
    // Ingestion (ingress thread)
    // ------------------------------------------------------------------

    /**
     * Validates and enqueues a snapshot, exactly as if it had arrived on the
     * ingress channel. Malformed snapshots are counted, logged and dropped.
     *
     * @return true if the snapshot was accepted
     */
    public boolean ingest(RouteSnapshot snapshot) {
        Run r = run;
        if (r == null || r.stopping || r.ringBuffer == null)
            return false;
        counters.increment(FibCounters.SNAPSHOTS_RECEIVED);
        try {
            r.validator.validate(snapshot);
        } catch (MalformedSnapshotException e) {
            reject(e.getMessage());
            return false;
        }
        PerfTrace trace = r.recorder.stamp(r.recorder.begin(snapshot), PerfTraceRecorder.ROUTE_DB_RECEIVED);
        r.ringBuffer.publishEvent((event, seq, s, t) -> event.setSnapshot(s, t), snapshot, trace);
        return true;
    }

    private void reject(String reason) {
        counters.increment(FibCounters.SNAPSHOTS_REJECTED);
        log.warn("Dropping malformed route snapshot: {}", reason);
        try {
            listeners.onSnapshotRejected(reason);
        } catch (FibInvariantException e) {
            // ingress thread, outside the Disruptor exception handler
            log.fatal("Invariant violated while rejecting a snapshot", e);
            onFatal(e);
        }
    }

    private void publishControl(Run r, FibEvent.Type type, CountDownLatch latch) {
        if (r.stopping) {
            if (latch != null)
                latch.countDown();
            return;
        }
        if (!r.ringBuffer.tryPublishEvent((event, seq, t, l) -> event.setControl(t, l), type, latch)) {
            // ring full of snapshots; the next tick will try again
            log.warn("Ring buffer full, dropped {} tick", type);
            if (latch != null)
                latch.countDown();
        }
    }

    private final class IngressHandler implements RouteIngress.Handler {
        private final Run r;

        IngressHandler(Run r) {
            this.r = r;
        }

        @Override
        public void onMessage(byte[] payload) {
            if (r.stopping)
                return;
            RouteSnapshot snapshot;
            try {
                snapshot = codec.decode(payload);
            } catch (MalformedSnapshotException e) {
                counters.increment(FibCounters.SNAPSHOTS_RECEIVED);
                reject(e.getMessage());
                return;
            }
            ingest(snapshot);
        }

        @Override
        public void onDisconnect(Throwable cause) {
            if (r.stopping)
                return;
            counters.increment(FibCounters.INGRESS_DISCONNECTS);
            log.warn("Ingress disconnected from {}: {}; serving current state until reconnected",
                    r.config.getIngressEndpoint(), cause == null ? "closed" : cause.getMessage());
            scheduleReconnect();
        }

        private void scheduleReconnect() {
            try {
                r.timers.schedule(this::reconnect, r.config.getIngressReconnectIntervalMs(), TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                log.debug("Reconnect not scheduled, pipeline stopping");
            }
        }

        private void reconnect() {
            if (r.stopping)
                return;
            try {
                ingress.connect(r.config.getIngressEndpoint(), this);
                counters.increment(FibCounters.INGRESS_RECONNECTS);
                log.info("Ingress reconnected to {}", r.config.getIngressEndpoint());
            } catch (IngressException e) {
                reconnectLimiter.log("Ingress reconnect failed: " + e.getMessage(), null);
                scheduleReconnect();
            }
        }
    }

    // ------------------------------------------------------------------
    // Owner thread
    // ------------------------------------------------------------------

    private record Pending(RouteSnapshot snapshot, PerfTrace trace) {
    }

    private final class OwnerLoop implements PassRunner {
        private final Run r;
        private final DebounceScheduler<Pending> debounce;
        private ScheduledFuture<?> debounceTimer;
        private RouteSnapshot lastKnownGood;
        private long lastAliveSince;

        OwnerLoop(Run r) {
            this.r = r;
            this.debounce = new DebounceScheduler<>(r.config.getDebounceMinMs(), r.config.getDebounceMaxMs());
        }

        @Override
        public void onSnapshot(RouteSnapshot snapshot, PerfTrace trace) {
            if (pipelineState == PipelineState.FAILED)
                return;
            if (!r.config.isEnableDebounce()) {
                programPass(snapshot, r.recorder.stamp(trace, PerfTraceRecorder.DEBOUNCE));
                return;
            }
            if (debounce.isArmed())
                counters.increment(FibCounters.DEBOUNCE_COALESCED);
            long deadline = debounce.notify(new Pending(snapshot, trace), clock.millis());
            armDebounceTimer(deadline);
        }

        @Override
        public void onDebounceTimer() {
            if (pipelineState == PipelineState.FAILED || !debounce.isArmed())
                return;
            Pending p = debounce.fire(clock.millis());
            if (p == null) {
                armDebounceTimer(debounce.deadlineMs());
                return;
            }
            programPass(p.snapshot(), r.recorder.stamp(p.trace(), PerfTraceRecorder.DEBOUNCE));
        }

        @Override
        public void onReconcileTimer() {
            if (pipelineState == PipelineState.FAILED)
                return;
            reconcile("periodic");
        }

        @Override
        public void onHealthCheck() {
            if (pipelineState == PipelineState.FAILED || r.programmer.isDryrun())
                return;
            long alive;
            try {
                alive = r.caller.callOnce("aliveSince", agent::aliveSince);
            } catch (FibAgentException e) {
                log.debug("Agent health check failed: {}", e.getMessage());
                return;
            }
            long previous = lastAliveSince;
            lastAliveSince = alive;
            if (previous != 0 && alive != previous) {
                counters.increment(FibCounters.AGENT_RESTARTS);
                log.warn("Agent restarted (aliveSince {} -> {}), reconciling now", previous, alive);
                reconcile("agent restart");
            }
        }

        @Override
        public void onInitialSync() {
            RouteSnapshot desired = desired();
            if (!r.programmer.isDryrun()) {
                try {
                    lastAliveSince = r.caller.callOnce("aliveSince", agent::aliveSince);
                } catch (FibAgentException e) {
                    log.debug("Could not read agent aliveSince: {}", e.getMessage());
                }
            }
            boolean ok = r.reconciler.initialSync(desired);
            counters.set(FibCounters.NUM_ROUTES, state.size());
            listeners.onReconciled(ok, ok ? desired.size() : 0);
        }

        private RouteSnapshot desired() {
            return lastKnownGood != null ? lastKnownGood : RouteSnapshot.empty(r.config.getNodeName());
        }

        private void armDebounceTimer(long deadlineMs) {
            if (debounceTimer != null)
                debounceTimer.cancel(false);
            long delay = Math.max(0, deadlineMs - clock.millis());
            try {
                debounceTimer = r.timers.schedule(() -> publishControl(r, FibEvent.Type.DEBOUNCE_TIMER, null),
                        delay, TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                log.debug("Debounce timer not armed, pipeline stopping");
            }
        }

        private void programPass(RouteSnapshot snapshot, PerfTrace trace) {
            lastKnownGood = snapshot;
            RouteDelta delta = RouteDiff.diff(state.ownerView(), snapshot);
            ProgramResult result = r.programmer.apply(delta);
            switch (result.status()) {
                case NOOP -> {
                    counters.increment(FibCounters.PASSES_NOOP);
                    log.debug("Snapshot already programmed, nothing to do");
                }
                case PROGRAMMED, DRYRUN -> {
                    PerfTrace done = r.recorder.stamp(trace, PerfTraceRecorder.ROUTES_PROGRAMMED);
                    r.recorder.finalizeTrace(done);
                    counters.increment(FibCounters.PASSES_PROGRAMMED);
                    log.info("Programmed {} ({} routes installed) in {} ms", delta, state.size(), done.totalMs());
                    listeners.onPassProgrammed(delta, done);
                }
                case FAILED -> {
                    counters.increment(FibCounters.PASSES_FAILED);
                    passErrLimiter.log("Programming pass abandoned, reconciliation will retry: " + delta,
                            result.error());
                    listeners.onPassFailed(delta, result.error());
                }
                case CANCELLED -> log.debug("Programming pass cancelled: {}", delta);
            }
            counters.set(FibCounters.NUM_ROUTES, state.size());
        }

        private void reconcile(String reason) {
            RouteSnapshot desired = desired();
            log.debug("Reconciling against agent ({})", reason);
            ProgramResult result = r.reconciler.reconcile(desired);
            counters.set(FibCounters.NUM_ROUTES, state.size());
            if (result.status() == ProgramResult.Status.CANCELLED)
                return;
            listeners.onReconciled(result.isApplied(), result.delta().size());
        }
    }

    // ------------------------------------------------------------------
    // Queries (any thread)
    // ------------------------------------------------------------------

    @Override
    public RouteSnapshot getCurrentState() {
        return state.toSnapshot(nodeName);
    }

    @Override
    public List<PerfTrace> getPerfHistory() {
        return perfHistory.snapshot();
    }

    @Override
    public Map<String, Long> getCounters() {
        return counters.snapshot();
    }

    @Override
    public PipelineState getPipelineState() {
        return pipelineState;
    }

    /** Same as {@link #getCurrentState()}. */
    public RouteSnapshot queryState() {
        return getCurrentState();
    }

    /** Same as {@link #getPerfHistory()}. */
    public List<PerfTrace> queryPerfHistory() {
        return getPerfHistory();
    }

    FibCounters counters() {
        return counters;
    }

    private static void awaitUninterruptibly(CountDownLatch latch) {
        boolean interrupted = false;
        while (true) {
            try {
                latch.await();
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted)
            Thread.currentThread().interrupt();
    }
}
