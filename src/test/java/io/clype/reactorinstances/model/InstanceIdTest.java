package io.clype.reactorinstances.model;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class InstanceIdTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void shouldCompareAllThreeFields() {
        assertEquals(InstanceId.node("s", "a"), new InstanceId("s", "a", InstanceType.NODE));
        assertNotEquals(InstanceId.node("s", "a"), InstanceId.edge("s", "a"));
        assertNotEquals(InstanceId.node("s", "a"), InstanceId.node("t", "a"));
    }

    @Test
    void shouldRejectMissingFields() {
        assertThrows(NullPointerException.class, () -> new InstanceId(null, "a", InstanceType.NODE));
        assertThrows(IllegalArgumentException.class, () -> InstanceId.node("", "a"));
        assertThrows(IllegalArgumentException.class, () -> InstanceId.edge("s", ""));
    }

    @Test
    void shouldDecodeFromJson() throws Exception {
        JsonNode json = mapper.readTree("{\"instanceType\":\"edge\",\"space\":\"s\",\"externalId\":\"flows-to\",\"version\":2}");

        assertEquals(InstanceId.edge("s", "flows-to"), InstanceId.fromJson(json));
    }

    @Test
    void shouldRequireInstanceTypeKey() throws Exception {
        JsonNode json = mapper.readTree("{\"space\":\"s\",\"externalId\":\"a\"}");

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> InstanceId.fromJson(json));
        assertEquals("Resource must contain 'instanceType' key", e.getMessage());
    }

    @Test
    void shouldRejectUnknownInstanceType() throws Exception {
        JsonNode json = mapper.readTree("{\"instanceType\":\"view\",\"space\":\"s\",\"externalId\":\"a\"}");

        assertThrows(IllegalArgumentException.class, () -> InstanceId.fromJson(json));
    }

    @Test
    void shouldEncodeIdentityFieldsOnly() {
        assertEquals("{\"instanceType\":\"node\",\"space\":\"s\",\"externalId\":\"a\"}",
                InstanceId.node("s", "a").toJson().toString());
        assertEquals("node:s:a", InstanceId.node("s", "a").toString());
    }
}
