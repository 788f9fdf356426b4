package io.clype.reactorinstances.transport;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Status, headers and raw body of a response.
 *
 * @param statusCode the HTTP status
 * @param headers    response headers; names are matched case-insensitively by {@link #header(String)}
 * @param body       raw body bytes (never null)
 */
public record TransportResponse(
    int statusCode,
    Map<String, List<String>> headers,
    byte[] body
) {
    public TransportResponse {
        headers = headers == null ? Map.of() : headers;
        body = body == null ? new byte[0] : body;
    }

    public static TransportResponse of(int statusCode, String body) {
        return new TransportResponse(statusCode, Map.of(), body.getBytes(StandardCharsets.UTF_8));
    }

    public static TransportResponse of(int statusCode, String body, Map<String, List<String>> headers) {
        return new TransportResponse(statusCode, headers, body.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Returns the first value of a header.
     *
     * @param name header name, case-insensitive
     * @return the first value, if present
     */
    public Optional<String> header(String name) {
        Objects.requireNonNull(name, "name");
        return headers.entrySet().stream()
                .filter(e -> e.getKey() != null && e.getKey().equalsIgnoreCase(name))
                .flatMap(e -> e.getValue().stream())
                .findFirst();
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public boolean isSuccessful() {
        return statusCode == 200 || statusCode == 201 || statusCode == 202 || statusCode == 204;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TransportResponse other)) {
            return false;
        }
        return statusCode == other.statusCode
                && headers.equals(other.headers)
                && Arrays.equals(body, other.body);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(statusCode, headers) + Arrays.hashCode(body);
    }

    @Override
    public String toString() {
        return "TransportResponse{statusCode=" + statusCode + ", headers=" + headers
                + ", body=" + body.length + " bytes}";
    }
}
