package io.clype.reactorinstances.transport;

import java.io.IOException;

/**
 * The request went out but no response arrived within the timeout.
 */
public class ReadTimeoutException extends IOException {

    public ReadTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
