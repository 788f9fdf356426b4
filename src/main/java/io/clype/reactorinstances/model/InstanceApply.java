package io.clype.reactorinstances.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A node or edge to upsert.
 *
 * <p>The writer only interprets the identity. Everything else (sources, edge type,
 * start and end nodes, existing version) travels in {@code properties} as an opaque JSON
 * object that is merged with the identity fields when the request body is built.
 * Values may be any Jackson-serializable type; {@code NaN} and infinite numbers are rejected
 * when the request is encoded.</p>
 *
 * <pre>{@code
 * InstanceApply pump = InstanceApply.node("plant", "pump-17", Map.of(
 *     "sources", List.of(Map.of(
 *         "source", Map.of("type", "view", "space", "plant", "externalId", "Pump", "version", "v1"),
 *         "properties", Map.of("name", "Pump 17", "flowRate", 12.5)))));
 * }</pre>
 *
 * @param id         the identity of the instance
 * @param properties the remaining fields of the instance write object (never null, copied)
 */
public record InstanceApply(
    InstanceId id,
    Map<String, Object> properties
) {
    public InstanceApply {
        Objects.requireNonNull(id, "id cannot be null");
        properties = properties == null ? Map.of() : unmodifiableCopy(properties);
        for (String reserved : new String[] {"instanceType", "space", "externalId"}) {
            if (properties.containsKey(reserved)) {
                throw new IllegalArgumentException(
                        "properties must not contain identity field '" + reserved + "'");
            }
        }
    }

    public static InstanceApply node(String space, String externalId, Map<String, Object> properties) {
        return new InstanceApply(InstanceId.node(space, externalId), properties);
    }

    public static InstanceApply edge(String space, String externalId, Map<String, Object> properties) {
        return new InstanceApply(InstanceId.edge(space, externalId), properties);
    }

    /**
     * Returns the JSON-ready representation: identity fields first, then the opaque properties.
     *
     * @return a new mutable map
     */
    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>(properties.size() + 3);
        payload.put("instanceType", id.instanceType().value());
        payload.put("space", id.space());
        payload.put("externalId", id.externalId());
        payload.putAll(properties);
        return payload;
    }

    // Map.copyOf rejects null values, which are legal JSON
    private static Map<String, Object> unmodifiableCopy(Map<String, Object> source) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
