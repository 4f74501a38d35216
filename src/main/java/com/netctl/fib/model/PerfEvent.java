package com.netctl.fib.model;

/**
 * A named wall-clock timestamp (epoch millis) emitted by one node.
 */
public record PerfEvent(String nodeName, String eventDescr, long unixTs) {
}
