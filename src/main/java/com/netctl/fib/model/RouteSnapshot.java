package com.netctl.fib.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * A complete description of the routes one node should forward with, as
 * computed upstream. Every list is copied on construction, so a snapshot is
 * immutable once ingested even if the publisher keeps mutating its own
 * buffers.
 *
 * <p>
 * {@code perfEvents} carries optional upstream timing, prepended to the
 * pass's {@link PerfTrace}.
 */
public record RouteSnapshot(String nodeName, List<UnicastRoute> unicastRoutes, List<PerfEvent> perfEvents) {

    @JsonCreator
    public RouteSnapshot(@JsonProperty("nodeName") String nodeName,
            @JsonProperty("unicastRoutes") List<UnicastRoute> unicastRoutes,
            @JsonProperty("perfEvents") List<PerfEvent> perfEvents) {
        this.nodeName = nodeName;
        this.unicastRoutes = copyOf(unicastRoutes, "route");
        this.perfEvents = copyOf(perfEvents, "perf event");
    }

    /** Immutable copy; a null element is malformed input, not a programming error. */
    static <T> List<T> copyOf(List<T> list, String what) {
        if (list == null)
            return List.of();
        for (T item : list) {
            if (item == null)
                throw new MalformedSnapshotException("null " + what + " entry");
        }
        return List.copyOf(list);
    }

    public RouteSnapshot(String nodeName, Collection<UnicastRoute> unicastRoutes) {
        this(nodeName, new ArrayList<>(unicastRoutes), List.of());
    }

    public static RouteSnapshot empty(String nodeName) {
        return new RouteSnapshot(nodeName, List.of(), List.of());
    }

    public int size() {
        return unicastRoutes.size();
    }

    @Override
    public String toString() {
        return "RouteSnapshot[" + nodeName + ", " + unicastRoutes.size() + " routes]";
    }
}
