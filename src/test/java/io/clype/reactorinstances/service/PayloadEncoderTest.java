package io.clype.reactorinstances.service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.GZIPInputStream;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.clype.reactorinstances.model.ApplyOptions;
import io.clype.reactorinstances.model.InstanceApply;
import io.clype.reactorinstances.model.NonFiniteValueException;
import io.clype.reactorinstances.transport.TransportResponse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PayloadEncoderTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final PayloadEncoder encoder = new PayloadEncoder(mapper, false);

    @Test
    void shouldWrapItemsAndParameters() throws IOException {
        List<InstanceApply> items = List.of(InstanceApply.node("plant", "pump-1", Map.of("existingVersion", 3)));

        PayloadEncoder.EncodedRequest request = encoder.encode(items, InstanceApply::toPayload,
                ApplyOptions.defaults().toParameters());

        JsonNode body = mapper.readTree(request.json());
        assertEquals("node", body.at("/items/0/instanceType").asText());
        assertEquals("pump-1", body.at("/items/0/externalId").asText());
        assertEquals(3, body.at("/items/0/existingVersion").asInt());
        assertThat(body.path("autoCreateDirectRelations").asBoolean()).isTrue();
        assertThat(body.path("replace").asBoolean()).isFalse();
        assertThat(request.compressed()).isFalse();
        assertEquals(request.json(), new String(request.body(), StandardCharsets.UTF_8));
    }

    @Test
    void shouldReportPathOfFirstNonFiniteValue() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("sources", List.of(Map.of("properties", Map.of("flow", Double.NaN))));
        List<InstanceApply> items = List.of(
                InstanceApply.node("plant", "ok", Map.of()),
                InstanceApply.node("plant", "bad", properties));

        NonFiniteValueException e = assertThrows(NonFiniteValueException.class,
                () -> encoder.encode(items, InstanceApply::toPayload, Map.of()));

        assertEquals("/items/1/sources/0/properties/flow", e.getPath());
        assertThat(e.getMessage()).startsWith(
                "Out of range float values are not JSON compliant. Make sure your data does not contain NaN(s) or +/- Inf!");
    }

    @Test
    void shouldRejectNonFiniteFloat() {
        List<InstanceApply> items = List.of(InstanceApply.node("plant", "p", Map.of("level", Float.NEGATIVE_INFINITY)));

        assertThrows(NonFiniteValueException.class, () -> encoder.encode(items, InstanceApply::toPayload, Map.of()));
    }

    @Test
    void shouldGzipBodyWhenCompressing() throws IOException {
        PayloadEncoder gzipEncoder = new PayloadEncoder(mapper, true);

        PayloadEncoder.EncodedRequest request = gzipEncoder.encode(
                List.of(InstanceApply.node("plant", "p", Map.of())), InstanceApply::toPayload, Map.of());

        assertThat(request.compressed()).isTrue();
        try (GZIPInputStream in = new GZIPInputStream(new ByteArrayInputStream(request.body()))) {
            assertEquals(request.json(), new String(in.readAllBytes(), StandardCharsets.UTF_8));
        }
    }

    @Test
    void shouldCompareEncodedRequestsByContent() {
        PayloadEncoder gzipEncoder = new PayloadEncoder(mapper, true);
        List<InstanceApply> items = List.of(InstanceApply.node("plant", "p", Map.of("flow", 2.5)));

        PayloadEncoder.EncodedRequest first = gzipEncoder.encode(items, InstanceApply::toPayload, Map.of());
        PayloadEncoder.EncodedRequest second = gzipEncoder.encode(items, InstanceApply::toPayload, Map.of());

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertThat(first.toString()).contains("compressed=true").doesNotContain("[B@");
    }

    @Test
    void shouldDecodeItemsOfResponse() {
        TransportResponse response = TransportResponse.of(200,
                "{\"items\":[{\"instanceType\":\"node\",\"space\":\"s\",\"externalId\":\"a\"},"
                        + "{\"instanceType\":\"edge\",\"space\":\"s\",\"externalId\":\"b\"}]}");

        List<JsonNode> items = encoder.decodeItems(response);

        assertThat(items).extracting(item -> item.path("externalId").asText()).containsExactly("a", "b");
    }

    @Test
    void shouldDecodeEmptyBodyAsNoItems() {
        assertThat(encoder.decodeItems(TransportResponse.of(204, ""))).isEmpty();
    }

    @Test
    void shouldExtractServerErrorMessage() {
        assertEquals("Invalid space",
                encoder.errorMessage(TransportResponse.of(400, "{\"error\":{\"code\":400,\"message\":\"Invalid space\"}}")));
        assertEquals("Rate limited", encoder.errorMessage(TransportResponse.of(429, "{\"error\":\"Rate limited\"}")));
        assertEquals("upstream down", encoder.errorMessage(TransportResponse.of(502, "upstream down")));
        assertEquals("HTTP 503", encoder.errorMessage(TransportResponse.of(503, "")));
    }
}
