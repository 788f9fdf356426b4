package io.clype.reactorinstances.service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.zip.GZIPOutputStream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.clype.reactorinstances.model.NonFiniteValueException;
import io.clype.reactorinstances.transport.TransportResponse;

/**
 * JSON encoding of request bodies and decoding of responses for the instances API.
 *
 * <p>Request bodies are {@code {"items": [...], <parameters>}}. Non-finite numbers are rejected
 * with {@link NonFiniteValueException} before anything is sent.</p>
 */
public class PayloadEncoder {

    private final ObjectMapper objectMapper;
    private final boolean compress;

    public PayloadEncoder(ObjectMapper objectMapper, boolean compress) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
        this.compress = compress;
    }

    /**
     * A request body ready to send.
     *
     * @param json       the uncompressed JSON text, attached to errors for diagnosis
     * @param body       the bytes to send (gzip-compressed if {@link #compressed()})
     * @param compressed whether {@code body} is gzip-compressed
     */
    public record EncodedRequest(String json, byte[] body, boolean compressed) {

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof EncodedRequest other)) {
                return false;
            }
            return compressed == other.compressed
                    && json.equals(other.json)
                    && Arrays.equals(body, other.body);
        }

        @Override
        public int hashCode() {
            return 31 * Objects.hash(json, compressed) + Arrays.hashCode(body);
        }

        @Override
        public String toString() {
            return "EncodedRequest{json=" + json + ", body=" + body.length + " bytes, compressed=" + compressed + "}";
        }
    }

    /**
     * Builds and encodes the body of one request.
     *
     * @param items      the task items
     * @param itemMapper maps an item to a Jackson-serializable value
     * @param parameters top-level request fields sent next to {@code items}
     * @param <T>        item type
     * @return the encoded request
     * @throws NonFiniteValueException if any number in the body is NaN or infinite
     * @throws UncheckedIOException    if serialization fails for any other reason
     */
    public <T> EncodedRequest encode(List<T> items, Function<? super T, ?> itemMapper, Map<String, Object> parameters) {
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode array = root.putArray("items");
        for (T item : items) {
            array.add(toTree(itemMapper.apply(item)));
        }
        parameters.forEach((name, value) -> root.set(name, toTree(value)));

        rejectNonFinite(root, "");

        String json;
        try {
            json = objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize request body", e);
        }
        byte[] raw = json.getBytes(StandardCharsets.UTF_8);
        return new EncodedRequest(json, compress ? gzip(raw) : raw, compress);
    }

    /**
     * Returns the {@code items} array of a successful response. An empty body yields no items.
     *
     * @param response the response
     * @return the result entries
     * @throws UncheckedIOException if the body is not JSON
     */
    public List<JsonNode> decodeItems(TransportResponse response) {
        if (response.body().length == 0) {
            return List.of();
        }
        JsonNode root = readTree(response);
        List<JsonNode> results = new ArrayList<>();
        for (JsonNode item : root.path("items")) {
            results.add(item);
        }
        return results;
    }

    /**
     * Extracts the server error message: {@code error.message} when {@code error} is an object,
     * {@code error} itself when it is a string, else the raw body.
     *
     * @param response an error response
     * @return the message, verbatim
     */
    public String errorMessage(TransportResponse response) {
        String raw = response.bodyAsString();
        JsonNode root;
        try {
            root = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            return raw.isEmpty() ? "HTTP " + response.statusCode() : raw;
        }
        JsonNode error = root == null ? null : root.get("error");
        if (error == null || error.isNull()) {
            return raw.isEmpty() ? "HTTP " + response.statusCode() : raw;
        }
        if (error.isTextual()) {
            return error.asText();
        }
        if (error.hasNonNull("message")) {
            return error.get("message").asText();
        }
        return error.toString();
    }

    public boolean isCompressing() {
        return compress;
    }

    private JsonNode toTree(Object value) {
        try {
            return objectMapper.valueToTree(value);
        } catch (IllegalArgumentException e) {
            throw new UncheckedIOException("Failed to serialize request body",
                    new IOException(e.getMessage(), e));
        }
    }

    private JsonNode readTree(TransportResponse response) {
        try {
            return objectMapper.readTree(response.body());
        } catch (IOException e) {
            throw new UncheckedIOException("Response of status " + response.statusCode() + " is not valid JSON", e);
        }
    }

    private static void rejectNonFinite(JsonNode node, String path) {
        if (node.isFloatingPointNumber()) {
            if (!Double.isFinite(node.doubleValue())) {
                throw new NonFiniteValueException(path.isEmpty() ? "/" : path);
            }
        } else if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                rejectNonFinite(field.getValue(), path + "/" + field.getKey());
            }
        } else if (node.isArray()) {
            for (int i = 0; i < node.size(); i++) {
                rejectNonFinite(node.get(i), path + "/" + i);
            }
        }
    }

    private static byte[] gzip(byte[] raw) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(32, raw.length / 4));
        try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
            gzip.write(raw);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to compress request body", e);
        }
        return out.toByteArray();
    }
}
