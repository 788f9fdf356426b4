package io.clype.reactorinstances.model;

import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Identity of a node or edge: {@code (space, externalId, instanceType)}.
 *
 * <p>Used as the delete request item and as the key of
 * {@link CompoundInstanceException#getFailed()}. Two identities are equal iff all three
 * fields match.</p>
 *
 * @param space        the space the instance lives in (required, non-empty)
 * @param externalId   the external id, unique within the space and instance type (required, non-empty)
 * @param instanceType node or edge
 */
public record InstanceId(
    String space,
    String externalId,
    InstanceType instanceType
) {
    public InstanceId {
        Objects.requireNonNull(space, "space cannot be null");
        Objects.requireNonNull(externalId, "externalId cannot be null");
        Objects.requireNonNull(instanceType, "instanceType cannot be null");
        if (space.isEmpty()) {
            throw new IllegalArgumentException("space cannot be empty");
        }
        if (externalId.isEmpty()) {
            throw new IllegalArgumentException("externalId cannot be empty");
        }
    }

    public static InstanceId node(String space, String externalId) {
        return new InstanceId(space, externalId, InstanceType.NODE);
    }

    public static InstanceId edge(String space, String externalId) {
        return new InstanceId(space, externalId, InstanceType.EDGE);
    }

    /**
     * Decodes an identity from a JSON object carrying {@code instanceType}, {@code space}
     * and {@code externalId}.
     *
     * @param json the JSON object
     * @return the identity
     * @throws IllegalStateException    if the {@code instanceType} key is missing
     * @throws IllegalArgumentException if {@code instanceType} is not node or edge
     */
    public static InstanceId fromJson(JsonNode json) {
        if (json == null || !json.hasNonNull("instanceType")) {
            throw new IllegalStateException("Resource must contain 'instanceType' key");
        }
        InstanceType type = InstanceType.fromValue(json.get("instanceType").asText());
        return new InstanceId(json.path("space").asText(), json.path("externalId").asText(), type);
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("instanceType", instanceType.value());
        node.put("space", space);
        node.put("externalId", externalId);
        return node;
    }

    @Override
    public String toString() {
        return instanceType.value() + ":" + space + ":" + externalId;
    }
}
