package io.clype.reactorinstances.service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.zip.GZIPInputStream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.clype.reactorinstances.transport.InstancesTransport;
import io.clype.reactorinstances.transport.TransportResponse;

/**
 * In-memory instances backend. Each request is decoded, recorded and answered by a responder.
 */
class ScriptedTransport implements InstancesTransport {

    static final ObjectMapper MAPPER = new ObjectMapper();

    record Request(String endpointPath, JsonNode body, Map<String, String> headers, boolean gzipped) {

        List<String> externalIds() {
            List<String> ids = new ArrayList<>();
            body.path("items").forEach(item -> ids.add(item.path("externalId").asText()));
            return ids;
        }

        int itemCount() {
            return body.path("items").size();
        }
    }

    @FunctionalInterface
    interface Responder {
        TransportResponse respond(Request request, int callIndex) throws IOException;
    }

    private final Responder responder;
    private final List<Request> requests = new ArrayList<>();
    private final AtomicInteger calls = new AtomicInteger();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();

    ScriptedTransport(Responder responder) {
        this.responder = responder;
    }

    @Override
    public TransportResponse send(String endpointPath, byte[] body, Map<String, String> headers) throws IOException {
        boolean gzipped = "gzip".equals(headers.get("Content-Encoding"));
        Request request = new Request(endpointPath, MAPPER.readTree(gzipped ? gunzip(body) : body), headers, gzipped);
        synchronized (requests) {
            requests.add(request);
        }
        int index = calls.getAndIncrement();
        int current = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(current, Math::max);
        try {
            return responder.respond(request, index);
        } finally {
            inFlight.decrementAndGet();
        }
    }

    List<Request> requests() {
        synchronized (requests) {
            return List.copyOf(requests);
        }
    }

    int calls() {
        return calls.get();
    }

    int maxInFlight() {
        return maxInFlight.get();
    }

    /**
     * A 200 whose {@code items} echo the request items with write metadata added.
     */
    static TransportResponse echo(Request request) {
        ObjectNode root = MAPPER.createObjectNode();
        ArrayNode items = root.putArray("items");
        for (JsonNode item : request.body().path("items")) {
            ObjectNode result = items.addObject();
            result.put("instanceType", item.path("instanceType").asText());
            result.put("space", item.path("space").asText());
            result.put("externalId", item.path("externalId").asText());
            result.put("version", 1);
            result.put("wasModified", true);
            result.put("createdTime", 1_700_000_000_000L);
            result.put("lastUpdatedTime", 1_700_000_000_000L);
        }
        return TransportResponse.of(200, root.toString());
    }

    static TransportResponse error(int status, String message) {
        return TransportResponse.of(status, "{\"error\":{\"code\":" + status + ",\"message\":\"" + message + "\"}}");
    }

    private static byte[] gunzip(byte[] body) {
        try (GZIPInputStream in = new GZIPInputStream(new ByteArrayInputStream(body))) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
