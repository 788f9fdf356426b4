package io.clype.reactorinstances.transport;

import java.io.IOException;
import java.util.Map;

/**
 * Sends one request to the instances API.
 *
 * <p>Implementations must not retry on their own: every retry decision belongs to the
 * caller. One instance is shared by all requests of a writer and must be thread-safe.</p>
 */
public interface InstancesTransport {

    /**
     * POSTs a body to an endpoint.
     *
     * @param endpointPath path relative to the API base, e.g. {@code /models/instances/delete}
     * @param body         the encoded request body
     * @param headers      request headers, including authorization
     * @return the response, whatever its status
     * @throws ReadTimeoutException       if no response arrived in time
     * @throws ConnectionFailedException  if the connection failed or was interrupted
     * @throws IOException                for any other I/O failure, which is not retried
     */
    TransportResponse send(String endpointPath, byte[] body, Map<String, String> headers) throws IOException;
}
