package io.clype.reactorinstances.retry;

/**
 * Class of transient fault. Each category has its own retry budget.
 */
public enum FailureCategory {
    /** The request was sent but no response arrived in time. */
    READ,
    /** The connection could not be established or was lost. */
    CONNECT,
    /** The server answered 429, 502, 503 or 504. */
    STATUS
}
