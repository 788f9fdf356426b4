package io.clype.reactorinstances.model;

/**
 * HTTP 401 from the instances endpoint. Never retried.
 */
public class NoAccessException extends InstanceApiException {

    public NoAccessException(String message, String requestId, String payload) {
        super(401, message, requestId, payload);
    }
}
