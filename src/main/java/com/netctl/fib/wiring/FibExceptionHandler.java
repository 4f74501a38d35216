package com.netctl.fib.wiring;

import com.lmax.disruptor.ExceptionHandler;
import com.netctl.fib.model.FibInvariantException;
import com.netctl.fib.util.ErrorRateLimiter;
import com.netctl.fib.util.FibCounters;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.function.Consumer;

/**
 * Last line of defence on the owner thread.
 *
 * <p>
 * An invariant violation (or a JVM {@link Error}) means the pipeline's own
 * logic is broken: it is logged at FATAL and handed to {@code onFatal}, which
 * takes the pipeline down. Anything else that escapes a handler is logged
 * (throttled), counted, and the consumer carries on with the next event; the
 * next reconciliation repairs whatever that event left behind.
 */
public final class FibExceptionHandler implements ExceptionHandler<FibEvent> {
    private static final Logger log = LogManager.getLogger(FibExceptionHandler.class);

    private final Consumer<Throwable> onFatal;
    private final FibCounters counters;
    private final ErrorRateLimiter errLimiter = new ErrorRateLimiter(log, 1000);

    public FibExceptionHandler(Consumer<Throwable> onFatal, FibCounters counters) {
        this.onFatal = onFatal;
        this.counters = counters;
    }

    @Override
    public void handleEventException(Throwable ex, long sequence, FibEvent event) {
        if (ex instanceof FibInvariantException || ex instanceof Error) {
            log.fatal("Fatal error processing event seq={}; stopping pipeline", sequence, ex);
            onFatal.accept(ex);
            return;
        }
        counters.increment(FibCounters.HANDLER_ERRORS);
        errLimiter.log(String.format("Unexpected error processing event seq=%d: %s", sequence, ex), ex);
        if (event != null)
            event.clear();
    }

    @Override
    public void handleOnStartException(Throwable ex) {
        log.error("Pipeline consumer failed to start", ex);
    }

    @Override
    public void handleOnShutdownException(Throwable ex) {
        log.error("Pipeline consumer failed during shutdown", ex);
    }
}
