package com.netctl.fib.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.netctl.fib.api.FibAgent;
import com.netctl.fib.api.FibAgentException;
import com.netctl.fib.model.IpPrefix;
import com.netctl.fib.model.UnicastRoute;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link FibAgent} over the agent's JSON/HTTP programming API.
 *
 * <pre>
 * POST /routes/add     {"clientId":786,"routes":[...]}
 * POST /routes/delete  {"clientId":786,"prefixes":["10.0.0.0/24",...]}
 * POST /routes/sync    {"clientId":786,"routes":[...]}
 * GET  /routes?clientId=786          -&gt; [route, ...]
 * GET  /alive-since                  -&gt; {"aliveSince":1700000000000}
 * </pre>
 *
 * Any non-2xx status, transport failure or unparseable body becomes a
 * {@link FibAgentException}. Timeouts and retries are the caller's business;
 * the request timeout here only bounds a hung connection.
 */
public final class HttpFibAgentClient implements FibAgent {
    private static final Logger log = LogManager.getLogger(HttpFibAgentClient.class);
    private static final TypeReference<List<UnicastRoute>> ROUTE_LIST = new TypeReference<>() {
    };

    private final URI base;
    private final HttpClient http;
    private final ObjectMapper mapper;
    private final Duration requestTimeout;

    public HttpFibAgentClient(String baseUrl, Duration requestTimeout) {
        this(baseUrl, requestTimeout, new ObjectMapper());
    }

    public HttpFibAgentClient(String baseUrl, Duration requestTimeout, ObjectMapper mapper) {
        if (baseUrl == null || baseUrl.isBlank())
            throw new IllegalArgumentException("agent endpoint is empty");
        this.base = URI.create(baseUrl.endsWith("/") ? baseUrl : baseUrl + "/");
        this.requestTimeout = requestTimeout;
        this.mapper = mapper;
        this.http = HttpClient.newBuilder()
                .connectTimeout(requestTimeout)
                .build();
        log.info("FIB agent client targeting {}", base);
    }

    @Override
    public void addOrUpdateRoutes(int clientId, List<UnicastRoute> routes) throws FibAgentException {
        post("routes/add", body(clientId, "routes", routes));
    }

    @Override
    public void deleteRoutes(int clientId, List<IpPrefix> prefixes) throws FibAgentException {
        post("routes/delete", body(clientId, "prefixes", prefixes));
    }

    @Override
    public List<UnicastRoute> getRouteTable(int clientId) throws FibAgentException {
        String json = get("routes?clientId=" + clientId);
        List<UnicastRoute> table;
        try {
            table = mapper.readValue(json, ROUTE_LIST);
        } catch (JsonProcessingException | RuntimeException e) {
            throw new FibAgentException("getRouteTable: unparseable response", e);
        }
        // Jackson hands back an ArrayList, so contains(null) is safe here
        if (table == null || table.contains(null))
            throw new FibAgentException("getRouteTable: null table or route in response");
        return table;
    }

    @Override
    public void syncRoutes(int clientId, List<UnicastRoute> routes) throws FibAgentException {
        post("routes/sync", body(clientId, "routes", routes));
    }

    @Override
    public long aliveSince() throws FibAgentException {
        String json = get("alive-since");
        try {
            JsonNode node = mapper.readTree(json).get("aliveSince");
            if (node == null || !node.canConvertToLong())
                throw new FibAgentException("aliveSince: missing field");
            return node.asLong();
        } catch (JsonProcessingException e) {
            throw new FibAgentException("aliveSince: unparseable response", e);
        }
    }

    private Map<String, Object> body(int clientId, String field, Object value) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("clientId", clientId);
        body.put(field, value);
        return body;
    }

    private void post(String path, Object body) throws FibAgentException {
        byte[] payload;
        try {
            payload = mapper.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            throw new FibAgentException(path + ": cannot encode request", e);
        }
        HttpRequest req = HttpRequest.newBuilder(base.resolve(path))
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(payload))
                .build();
        send(path, req);
    }

    private String get(String path) throws FibAgentException {
        HttpRequest req = HttpRequest.newBuilder(base.resolve(path))
                .timeout(requestTimeout)
                .header("Accept", "application/json")
                .GET()
                .build();
        return send(path, req);
    }

    private String send(String path, HttpRequest req) throws FibAgentException {
        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new FibAgentException(path + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FibAgentException(path + ": interrupted", e);
        }
        int status = resp.statusCode();
        if (status / 100 != 2)
            throw new FibAgentException(path + ": agent returned HTTP " + status + " " + resp.body());
        return resp.body();
    }
}
