package io.clype.reactorinstances.model;

/**
 * Discriminator of a graph instance, serialized as the {@code instanceType} field.
 */
public enum InstanceType {

    NODE("node"),
    EDGE("edge");

    private final String value;

    InstanceType(String value) {
        this.value = value;
    }

    /**
     * Returns the wire value ({@code "node"} or {@code "edge"}).
     *
     * @return the wire value
     */
    public String value() {
        return value;
    }

    /**
     * Decodes a wire value.
     *
     * @param value the {@code instanceType} field value
     * @return the matching instance type
     * @throws IllegalArgumentException if the value is neither {@code node} nor {@code edge}
     */
    public static InstanceType fromValue(String value) {
        for (InstanceType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown instanceType '" + value + "'. Expected 'node' or 'edge'");
    }
}
