package io.clype.reactorinstances.model;

import java.util.Optional;

/**
 * Raised when the instances endpoint answers with a status the writer does not resolve by
 * itself: any non-retryable status, or a retryable one after the status retry budget is spent.
 *
 * <p>{@link #getMessage()} is the server's error message, verbatim. The request payload that
 * was in flight is attached for diagnosis.</p>
 */
public class InstanceApiException extends RuntimeException {

    private final int statusCode;
    private final String requestId;
    private final String payload;

    /**
     * Creates a new InstanceApiException.
     *
     * @param statusCode the HTTP status of the response
     * @param message    the server error message
     * @param requestId  the {@code x-request-id} response header, may be null
     * @param payload    the JSON request body that was sent, may be null
     */
    public InstanceApiException(int statusCode, String message, String requestId, String payload) {
        super(message);
        this.statusCode = statusCode;
        this.requestId = requestId;
        this.payload = payload;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public Optional<String> getRequestId() {
        return Optional.ofNullable(requestId);
    }

    /**
     * Returns the JSON request body that was in flight when the error occurred.
     *
     * @return the request payload, or null if not attached
     */
    public String getPayload() {
        return payload;
    }
}
