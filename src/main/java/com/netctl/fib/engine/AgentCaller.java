package com.netctl.fib.engine;

import com.lmax.disruptor.util.DaemonThreadFactory;
import com.netctl.fib.api.FibAgentException;
import com.netctl.fib.util.ErrorRateLimiter;
import com.netctl.fib.util.FibCounters;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs forwarding-agent calls with a hard timeout and bounded retry.
 *
 * <p>
 * Each attempt runs on a worker thread and is awaited for at most
 * {@code timeoutMs}. A call that overruns is cancelled (interrupted) and counted
 * as failed even if the agent answers later; the late answer is discarded with
 * the future. Between attempts the caller backs off per {@link RetryPolicy};
 * the wait ends early once {@code cancelSignal} is released, and the call then
 * fails with {@link CallCancelledException}.
 *
 * <p>
 * Workers come from a cached pool so a call stuck past its timeout cannot hold
 * up the next one.
 */
public final class AgentCaller implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(AgentCaller.class);

    private final RetryPolicy retryPolicy;
    private final long timeoutMs;
    private final CountDownLatch cancelSignal;
    private final FibCounters counters;
    private final ExecutorService workers;
    private final ErrorRateLimiter errLimiter = new ErrorRateLimiter(log, Level.WARN, 1000);

    public AgentCaller(RetryPolicy retryPolicy, long timeoutMs, CountDownLatch cancelSignal, FibCounters counters) {
        this.retryPolicy = retryPolicy;
        this.timeoutMs = timeoutMs;
        this.cancelSignal = cancelSignal;
        this.counters = counters;
        this.workers = Executors.newCachedThreadPool(DaemonThreadFactory.INSTANCE);
    }

    /** A single agent RPC. */
    @FunctionalInterface
    public interface AgentCall<T> {
        T invoke() throws FibAgentException;
    }

    /** An agent RPC with no result. */
    @FunctionalInterface
    public interface AgentAction {
        void invoke() throws FibAgentException;
    }

    /**
     * Calls with the configured retry policy.
     *
     * @throws FibAgentException      after the last attempt failed
     * @throws CallCancelledException if the pipeline stopped while retrying
     */
    public <T> T call(String op, AgentCall<T> call) throws FibAgentException {
        return call(op, call, retryPolicy);
    }

    public void run(String op, AgentAction action) throws FibAgentException {
        call(op, () -> {
            action.invoke();
            return null;
        }, retryPolicy);
    }

    /** Single attempt, still bounded by the timeout. */
    public <T> T callOnce(String op, AgentCall<T> call) throws FibAgentException {
        return call(op, call, RetryPolicy.once());
    }

    public boolean isCancelled() {
        return cancelSignal.getCount() == 0;
    }

    private <T> T call(String op, AgentCall<T> call, RetryPolicy policy) throws FibAgentException {
        FibAgentException last = null;
        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            if (isCancelled())
                throw new CallCancelledException(op, last);
            if (attempt > 1)
                counters.increment(FibCounters.AGENT_RETRIES);
            try {
                return attempt(op, call);
            } catch (FibAgentException e) {
                last = e;
                counters.increment(FibCounters.AGENT_FAILURES);
                errLimiter.log(String.format("Agent call %s failed (attempt %d/%d): %s",
                        op, attempt, policy.maxAttempts(), e.getMessage()), null);
            }
            if (attempt < policy.maxAttempts() && backoff(policy.backoffMs(attempt)))
                throw new CallCancelledException(op, last);
        }
        throw last;
    }

    private <T> T attempt(String op, AgentCall<T> call) throws FibAgentException {
        counters.increment(FibCounters.AGENT_CALLS);
        Future<T> future;
        try {
            future = workers.submit(call::invoke);
        } catch (RejectedExecutionException e) {
            throw new CallCancelledException(op, null);
        }
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            counters.increment(FibCounters.AGENT_TIMEOUTS);
            throw new FibAgentException(op + " timed out after " + timeoutMs + " ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof FibAgentException fae)
                throw fae;
            throw new FibAgentException(op + " failed: " + cause, cause);
        } catch (CancellationException e) {
            throw new FibAgentException(op + " was cancelled", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new CallCancelledException(op, null);
        }
    }

    /** @return true if cancelled while waiting */
    private boolean backoff(long ms) {
        if (ms <= 0)
            return isCancelled();
        try {
            return cancelSignal.await(ms, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    @Override
    public void close() {
        workers.shutdownNow();
    }

    /**
     * The call was abandoned because the pipeline is shutting down, not because
     * the agent failed.
     */
    public static final class CallCancelledException extends FibAgentException {
        public CallCancelledException(String op, Throwable lastFailure) {
            super(op + " abandoned: pipeline stopping", lastFailure);
        }
    }
}
