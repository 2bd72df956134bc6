package com.shapekit.core.codegen;

/**
 * Which side of a service the generated code implements.
 */
public enum CodegenTarget {
    /** Code that calls the service. */
    CLIENT,
    /** Code that implements the service. */
    SERVER;

    /**
     * Returns whether unions get an {@code Unknown} variant.
     *
     * <p>Clients must tolerate variants added to the model after they were generated; servers
     * reject anything they do not know.
     *
     * @return true for clients
     */
    public boolean renderUnknownVariant() {
        return this == CLIENT;
    }
}
