package com.circuit.sfg.io;

/**
 * A graph definition could not be read or is structurally incomplete.
 */
public class GraphDefinitionException extends RuntimeException {

    public GraphDefinitionException(String message) {
        super(message);
    }

    public GraphDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
