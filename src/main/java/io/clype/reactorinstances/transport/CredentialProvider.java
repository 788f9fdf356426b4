package io.clype.reactorinstances.transport;

import java.util.Map;

/**
 * Keeps the authorization header of an ongoing operation valid.
 *
 * <p>Called once before the first request and again before every backoff pause. Must be
 * idempotent and cheap when the current credential is still valid.</p>
 */
@FunctionalInterface
public interface CredentialProvider {

    /**
     * Writes a valid authorization header into {@code headers}, replacing any previous value.
     *
     * @param headers the mutable request headers of the operation
     */
    void refreshHeader(Map<String, String> headers);
}
