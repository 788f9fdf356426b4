package io.clype.reactorinstances.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request-level flags of an upsert. They are sent with every request, including the
 * smaller requests produced when a batch is split.
 *
 * @param autoCreateStartNodes      create missing start nodes of edges
 * @param autoCreateEndNodes        create missing end nodes of edges
 * @param autoCreateDirectRelations create missing direct relation targets
 * @param skipOnVersionConflict     skip, rather than fail, items whose {@code existingVersion} does not match
 * @param replace                   replace existing property values instead of merging
 */
public record ApplyOptions(
    boolean autoCreateStartNodes,
    boolean autoCreateEndNodes,
    boolean autoCreateDirectRelations,
    boolean skipOnVersionConflict,
    boolean replace
) {

    public static ApplyOptions defaults() {
        return new ApplyOptions(false, false, true, false, false);
    }

    public Map<String, Object> toParameters() {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("autoCreateStartNodes", autoCreateStartNodes);
        parameters.put("autoCreateEndNodes", autoCreateEndNodes);
        parameters.put("autoCreateDirectRelations", autoCreateDirectRelations);
        parameters.put("skipOnVersionConflict", skipOnVersionConflict);
        parameters.put("replace", replace);
        return parameters;
    }
}
