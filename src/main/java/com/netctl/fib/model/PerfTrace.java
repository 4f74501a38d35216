package com.netctl.fib.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The ordered perf events of one pipeline pass, from the upstream publisher's
 * events (if any) through ingest, debounce and programming.
 */
public record PerfTrace(List<PerfEvent> events) {

    @JsonCreator
    public PerfTrace(@JsonProperty("events") List<PerfEvent> events) {
        this.events = events == null ? List.of() : List.copyOf(events);
    }

    public static PerfTrace empty() {
        return new PerfTrace(List.of());
    }

    /** Returns a new trace with {@code event} appended. */
    public PerfTrace with(PerfEvent event) {
        List<PerfEvent> next = new ArrayList<>(events.size() + 1);
        next.addAll(events);
        next.add(event);
        return new PerfTrace(next);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return events.isEmpty();
    }

    /**
     * Time spent between consecutive events, keyed by the later event's name.
     * Clock steps backwards are clamped to zero.
     */
    public Map<String, Long> durationsMs() {
        Map<String, Long> out = new LinkedHashMap<>();
        for (int i = 1; i < events.size(); i++) {
            long d = events.get(i).unixTs() - events.get(i - 1).unixTs();
            out.merge(events.get(i).eventDescr(), Math.max(0, d), Long::sum);
        }
        return out;
    }

    /** Total span from first to last event, 0 for traces with fewer than two events. */
    public long totalMs() {
        if (events.size() < 2)
            return 0;
        return Math.max(0, events.get(events.size() - 1).unixTs() - events.get(0).unixTs());
    }
}
