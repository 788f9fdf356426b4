package io.clype.reactorinstances.model;

/**
 * Thrown when a request body contains {@code NaN} or an infinite number, which JSON cannot
 * represent. This is a data error in the caller's input and is never retried.
 */
public class NonFiniteValueException extends IllegalArgumentException {

    static final String MESSAGE = "Out of range float values are not JSON compliant. "
            + "Make sure your data does not contain NaN(s) or +/- Inf!";

    private final String path;

    /**
     * @param path JSON pointer of the first offending value, e.g. {@code /items/3/sources/0/properties/flow}
     */
    public NonFiniteValueException(String path) {
        super(MESSAGE + " First offending value at " + path);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
