package com.netctl.fib.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An egress path: interface, gateway address and optional weight.
 *
 * <p>
 * The diff engine treats next-hops as opaque values and only compares them for
 * equality. {@code weight == 0} means "unset".
 */
public record NextHop(String ifName, String address, int weight) {

    @JsonCreator
    public NextHop(@JsonProperty("ifName") String ifName,
            @JsonProperty("address") String address,
            @JsonProperty("weight") int weight) {
        if (address == null || address.isBlank())
            throw new MalformedSnapshotException("next-hop address is empty");
        if (weight < 0)
            throw new MalformedSnapshotException("negative next-hop weight " + weight);
        this.ifName = ifName;
        this.address = address;
        this.weight = weight;
    }

    public static NextHop of(String ifName, String address) {
        return new NextHop(ifName, address, 0);
    }

    @Override
    public String toString() {
        return address + "@" + (ifName == null ? "-" : ifName) + (weight > 0 ? " w=" + weight : "");
    }
}
