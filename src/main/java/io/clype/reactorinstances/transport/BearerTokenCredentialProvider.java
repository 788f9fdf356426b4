package io.clype.reactorinstances.transport;

import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Sets {@code Authorization: Bearer <token>} from a token supplier.
 *
 * <p>The supplier is asked on every refresh; it is expected to cache the token and only
 * fetch a new one when the current one is about to expire.</p>
 */
public class BearerTokenCredentialProvider implements CredentialProvider {

    public static final String AUTHORIZATION_HEADER = "Authorization";

    private final Supplier<String> tokenSupplier;

    public BearerTokenCredentialProvider(Supplier<String> tokenSupplier) {
        this.tokenSupplier = Objects.requireNonNull(tokenSupplier, "tokenSupplier cannot be null");
    }

    /**
     * Creates a provider for a fixed token.
     *
     * @param token the bearer token
     * @return the provider
     */
    public static BearerTokenCredentialProvider ofToken(String token) {
        Objects.requireNonNull(token, "token cannot be null");
        return new BearerTokenCredentialProvider(() -> token);
    }

    @Override
    public void refreshHeader(Map<String, String> headers) {
        String token = tokenSupplier.get();
        if (token == null || token.isBlank()) {
            throw new IllegalStateException("Token supplier returned no token");
        }
        headers.put(AUTHORIZATION_HEADER, "Bearer " + token);
    }
}
