package io.clype.reactorinstances.transport;

import java.io.IOException;

/**
 * The connection could not be established, was dropped, or the calling thread was interrupted
 * while waiting.
 */
public class ConnectionFailedException extends IOException {

    public ConnectionFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
