package com.netctl.fib.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.netctl.fib.model.MalformedSnapshotException;
import com.netctl.fib.model.RouteSnapshot;

import java.io.IOException;

/**
 * JSON wire format of {@link RouteSnapshot}, as published on the ingress
 * channel. Thread-safe.
 */
public final class RouteSnapshotCodec {

    private final ObjectMapper mapper;

    public RouteSnapshotCodec() {
        this(new ObjectMapper());
    }

    public RouteSnapshotCodec(ObjectMapper mapper) {
        this.mapper = mapper.copy().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public byte[] encode(RouteSnapshot snapshot) {
        try {
            return mapper.writeValueAsBytes(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode " + snapshot, e);
        }
    }

    /**
     * @throws MalformedSnapshotException if the payload is empty, not JSON, or
     *         names an invalid prefix or next hop
     */
    public RouteSnapshot decode(byte[] payload) {
        if (payload == null || payload.length == 0)
            throw new MalformedSnapshotException("empty payload");
        try {
            RouteSnapshot s = mapper.readValue(payload, RouteSnapshot.class);
            if (s == null)
                throw new MalformedSnapshotException("null snapshot");
            return s;
        } catch (IOException e) {
            // value constructors throw MalformedSnapshotException, which Jackson wraps
            for (Throwable c = e.getCause(); c != null; c = c.getCause()) {
                if (c instanceof MalformedSnapshotException)
                    throw (MalformedSnapshotException) c;
            }
            String reason = e instanceof JsonProcessingException
                    ? ((JsonProcessingException) e).getOriginalMessage()
                    : e.getMessage();
            throw new MalformedSnapshotException("undecodable snapshot: " + reason);
        }
    }
}
