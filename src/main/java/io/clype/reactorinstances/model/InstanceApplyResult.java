package io.clype.reactorinstances.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Result entry of a successful upsert.
 *
 * @param id              the identity of the written instance
 * @param version         the instance version after the write
 * @param wasModified     whether the write changed the stored instance
 * @param createdTime     creation time, epoch millis
 * @param lastUpdatedTime last update time, epoch millis
 */
public record InstanceApplyResult(
    InstanceId id,
    long version,
    boolean wasModified,
    long createdTime,
    long lastUpdatedTime
) {

    /**
     * Decodes one entry of the upsert response {@code items} array.
     *
     * @param json the result entry
     * @return the typed result
     * @throws IllegalStateException    if {@code instanceType} is missing
     * @throws IllegalArgumentException if {@code instanceType} is not node or edge
     */
    public static InstanceApplyResult fromJson(JsonNode json) {
        return new InstanceApplyResult(
                InstanceId.fromJson(json),
                json.path("version").asLong(),
                json.path("wasModified").asBoolean(false),
                json.path("createdTime").asLong(),
                json.path("lastUpdatedTime").asLong());
    }
}
