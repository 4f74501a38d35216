package com.netctl.fib.ingress;

import com.netctl.fib.api.IngressException;
import com.netctl.fib.api.RouteIngress;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * {@link RouteIngress} subscribed to an {@link InProcessRouteBus}. Only
 * {@code inproc://} endpoints are accepted. May be reconnected after a
 * disconnect; each connect replaces the previous subscription.
 */
public final class InProcessRouteIngress implements RouteIngress {
    private static final Logger log = LogManager.getLogger(InProcessRouteIngress.class);

    public static final String SCHEME = "inproc://";

    private final InProcessRouteBus bus;

    private String endpoint;
    private Subscription current;

    InProcessRouteIngress(InProcessRouteBus bus) {
        this.bus = bus;
    }

    @Override
    public synchronized void connect(String endpoint, Handler handler) throws IngressException {
        if (endpoint == null || !endpoint.startsWith(SCHEME))
            throw new IngressException("unsupported endpoint '" + endpoint + "', expected " + SCHEME + "<name>");
        if (endpoint.length() == SCHEME.length())
            throw new IngressException("endpoint has no name: " + endpoint);
        dropSubscription();
        Subscription sub = new Subscription(handler);
        bus.subscribe(endpoint, sub);
        this.endpoint = endpoint;
        this.current = sub;
        log.info("Subscribed to {}", endpoint);
    }

    @Override
    public synchronized boolean isConnected() {
        return current != null && current.live;
    }

    @Override
    public synchronized void close() {
        if (dropSubscription())
            log.info("Unsubscribed from {}", endpoint);
    }

    private boolean dropSubscription() {
        Subscription sub = current;
        current = null;
        if (sub == null)
            return false;
        sub.live = false;
        return bus.unsubscribe(endpoint, sub);
    }

    /** Wraps the caller's handler so a dead subscription stops delivering. */
    private static final class Subscription implements Handler {
        private final Handler delegate;
        private volatile boolean live = true;

        Subscription(Handler delegate) {
            this.delegate = delegate;
        }

        @Override
        public void onMessage(byte[] payload) {
            if (live)
                delegate.onMessage(payload);
        }

        @Override
        public void onDisconnect(Throwable cause) {
            if (!live)
                return;
            live = false;
            delegate.onDisconnect(cause);
        }
    }
}
