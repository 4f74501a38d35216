package com.netctl.fib.ingress;

import com.netctl.fib.api.IngressException;
import com.netctl.fib.api.RouteIngress;
import com.netctl.fib.io.RouteSnapshotCodec;
import com.netctl.fib.model.RouteSnapshot;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Publish/subscribe channel between a route producer and FIB pipelines
 * running in the same JVM. Endpoints are plain names such as
 * {@code inproc://decision-pub}.
 *
 * <p>
 * Delivery happens on the publisher's thread and is at-most-once: a message
 * published while nobody is subscribed is dropped. {@link #setReachable} and
 * {@link #disconnectAll} simulate transport outages.
 */
public final class InProcessRouteBus {
    private static final Logger log = LogManager.getLogger(InProcessRouteBus.class);

    private final Map<String, List<RouteIngress.Handler>> subscribers = new ConcurrentHashMap<>();
    private final RouteSnapshotCodec codec;
    private volatile boolean reachable = true;

    public InProcessRouteBus() {
        this(new RouteSnapshotCodec());
    }

    public InProcessRouteBus(RouteSnapshotCodec codec) {
        this.codec = codec;
    }

    /** Creates an unconnected ingress bound to this bus. */
    public InProcessRouteIngress newIngress() {
        return new InProcessRouteIngress(this);
    }

    /**
     * @return number of subscribers the payload was delivered to
     */
    public int publish(String endpoint, byte[] payload) {
        List<RouteIngress.Handler> subs = subscribers.get(endpoint);
        if (subs == null || subs.isEmpty()) {
            log.debug("No subscribers on {}, message dropped", endpoint);
            return 0;
        }
        int delivered = 0;
        for (RouteIngress.Handler h : subs) {
            h.onMessage(payload);
            delivered++;
        }
        return delivered;
    }

    public int publish(String endpoint, RouteSnapshot snapshot) {
        return publish(endpoint, codec.encode(snapshot));
    }

    /** Drops every subscription on {@code endpoint}, notifying each handler. */
    public void disconnectAll(String endpoint, Throwable cause) {
        List<RouteIngress.Handler> subs = subscribers.remove(endpoint);
        if (subs == null)
            return;
        log.info("Disconnecting {} subscriber(s) from {}", subs.size(), endpoint);
        for (RouteIngress.Handler h : subs)
            h.onDisconnect(cause);
    }

    /** While unreachable, new subscriptions fail. Existing ones are unaffected. */
    public void setReachable(boolean reachable) {
        this.reachable = reachable;
    }

    public int subscriberCount(String endpoint) {
        List<RouteIngress.Handler> subs = subscribers.get(endpoint);
        return subs == null ? 0 : subs.size();
    }

    void subscribe(String endpoint, RouteIngress.Handler handler) throws IngressException {
        if (!reachable)
            throw new IngressException("endpoint unreachable: " + endpoint);
        subscribers.computeIfAbsent(endpoint, k -> new CopyOnWriteArrayList<>()).add(handler);
    }

    /** @return true if the handler was still subscribed */
    boolean unsubscribe(String endpoint, RouteIngress.Handler handler) {
        List<RouteIngress.Handler> subs = subscribers.get(endpoint);
        return subs != null && subs.remove(handler);
    }
}
