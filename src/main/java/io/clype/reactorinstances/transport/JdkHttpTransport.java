package io.clype.reactorinstances.transport;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link InstancesTransport} over the JDK {@link HttpClient}.
 *
 * <p>A single client (and thus one connection pool) is reused for every request. Redirects are
 * not followed and nothing is retried here. I/O failures are translated into
 * {@link ReadTimeoutException} and {@link ConnectionFailedException} so the writer can apply its
 * per-category retry budget.</p>
 */
public class JdkHttpTransport implements InstancesTransport {

    private static final Logger log = LoggerFactory.getLogger(JdkHttpTransport.class);

    /** Headers the JDK client manages itself and refuses to accept. */
    private static final Set<String> RESTRICTED_HEADERS = Set.of(
            "connection", "content-length", "expect", "host", "upgrade");

    private final HttpClient httpClient;
    private final URI baseUri;
    private final Duration timeout;

    /**
     * Creates a transport with its own HTTP client.
     *
     * @param baseUri API base, e.g. {@code https://api.example.com/api/v1/projects/my-project}
     * @param timeout connect and response timeout of each request
     */
    public JdkHttpTransport(URI baseUri, Duration timeout) {
        this(HttpClient.newBuilder()
                        .connectTimeout(Objects.requireNonNull(timeout, "timeout cannot be null"))
                        .followRedirects(HttpClient.Redirect.NEVER)
                        .build(),
                baseUri, timeout);
    }

    public JdkHttpTransport(HttpClient httpClient, URI baseUri, Duration timeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient cannot be null");
        this.baseUri = Objects.requireNonNull(baseUri, "baseUri cannot be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout cannot be null");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }

    @Override
    public TransportResponse send(String endpointPath, byte[] body, Map<String, String> headers) throws IOException {
        HttpRequest.Builder builder = HttpRequest.newBuilder(resolve(endpointPath))
                .timeout(timeout)
                .POST(HttpRequest.BodyPublishers.ofByteArray(body));
        headers.forEach((name, value) -> {
            if (!RESTRICTED_HEADERS.contains(name.toLowerCase())) {
                builder.header(name, value);
            }
        });

        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
        } catch (HttpConnectTimeoutException e) {
            throw new ConnectionFailedException("Connect timed out for " + endpointPath, e);
        } catch (HttpTimeoutException e) {
            throw new ReadTimeoutException("Read timed out for " + endpointPath, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectionFailedException("Interrupted while waiting for " + endpointPath, e);
        } catch (IOException e) {
            throw new ConnectionFailedException("Connection failed for " + endpointPath + ": " + e.getMessage(), e);
        }

        log.debug("POST {} -> {}", endpointPath, response.statusCode());
        return new TransportResponse(response.statusCode(), response.headers().map(), response.body());
    }

    URI resolve(String endpointPath) {
        String base = baseUri.toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + (endpointPath.startsWith("/") ? endpointPath : "/" + endpointPath));
    }
}
