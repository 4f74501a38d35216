package com.netctl.fib.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.netctl.fib.engine.RetryPolicy;

import lombok.Data;

/**
 * Runtime options of the FIB pipeline. Bound from JSON by
 * {@link FibConfigLoader}; every field has a usable default.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FibConfig {
    /** Only snapshots addressed to this node are accepted. */
    private String nodeName = "node-1";
    private String ingressEndpoint = "inproc://decision-pub";
    /** Base URL of the agent's programming API, e.g. {@code http://localhost:60100}. */
    private String agentEndpoint;
    /** Identifies this pipeline's routes inside a shared agent. */
    private int clientId = 786;

    private boolean dryrun = false;

    private boolean enablePeriodicSync = true;
    private long syncIntervalMs = 60_000;

    private boolean enableDebounce = true;
    private long debounceMinMs = 10;
    private long debounceMaxMs = 250;

    private boolean waitOnInitialSync = false;
    private int perfHistoryCapacity = 10;

    private long agentTimeoutMs = 5_000;
    private int maxRetryAttempts = 3;
    private long retryInitialBackoffMs = 50;
    private long retryMaxBackoffMs = 2_000;

    private int reconcileAlertThreshold = 3;
    private long agentHealthCheckIntervalMs = 0;
    private long ingressReconnectIntervalMs = 1_000;

    /** Must be a power of two. */
    private int ringBufferSize = 1024;
    /** Query API port; 0 disables the server. */
    private int queryPort = 0;

    public RetryPolicy retryPolicy() {
        return new RetryPolicy(maxRetryAttempts, retryInitialBackoffMs, retryMaxBackoffMs);
    }

    /**
     * Cross-checks the options.
     *
     * @return this, for chaining
     * @throws FibConfigException on the first problem found
     */
    public FibConfig validate() {
        require(nodeName != null && !nodeName.isBlank(), "nodeName must be set");
        require(ingressEndpoint != null && !ingressEndpoint.isBlank(), "ingressEndpoint must be set");
        require(!enablePeriodicSync || syncIntervalMs > 0, "syncIntervalMs must be > 0");
        require(debounceMinMs >= 0, "debounceMinMs must be >= 0");
        require(debounceMaxMs >= debounceMinMs, "debounceMaxMs must be >= debounceMinMs");
        require(perfHistoryCapacity >= 1, "perfHistoryCapacity must be >= 1");
        require(agentTimeoutMs > 0, "agentTimeoutMs must be > 0");
        require(maxRetryAttempts >= 1, "maxRetryAttempts must be >= 1");
        require(retryInitialBackoffMs >= 0, "retryInitialBackoffMs must be >= 0");
        require(retryMaxBackoffMs >= retryInitialBackoffMs, "retryMaxBackoffMs must be >= retryInitialBackoffMs");
        require(reconcileAlertThreshold >= 1, "reconcileAlertThreshold must be >= 1");
        require(agentHealthCheckIntervalMs >= 0, "agentHealthCheckIntervalMs must be >= 0");
        require(ingressReconnectIntervalMs > 0, "ingressReconnectIntervalMs must be > 0");
        require(ringBufferSize > 0 && Integer.bitCount(ringBufferSize) == 1, "ringBufferSize must be a power of two");
        require(queryPort >= 0 && queryPort <= 65535, "queryPort out of range");
        return this;
    }

    private static void require(boolean ok, String message) {
        if (!ok)
            throw new FibConfigException(message);
    }
}
