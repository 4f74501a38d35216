package com.netctl.fib.api;

/**
 * Subscriber side of the channel that delivers serialized route snapshots.
 *
 * <p>
 * Delivery is at-most-once: there is no acknowledgement, and messages sent
 * while disconnected are lost. Periodic reconciliation is what makes that
 * acceptable.
 */
public interface RouteIngress extends AutoCloseable {

    /**
     * Binds to {@code endpoint} and starts delivering messages to
     * {@code handler}. Handler callbacks may arrive on any thread.
     */
    void connect(String endpoint, Handler handler) throws IngressException;

    boolean isConnected();

    /** Releases the subscription. Idempotent. */
    @Override
    void close();

    /** Receives payloads and connection-loss notifications. */
    interface Handler {
        void onMessage(byte[] payload);

        void onDisconnect(Throwable cause);
    }
}
