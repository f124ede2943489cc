package com.circuit.sfg.algebra;

/**
 * Raised when a weight string cannot be parsed or an operation is outside what
 * the polynomial algebra supports (division by a multi-term expression,
 * division by zero).
 */
public class ExpressionException extends IllegalArgumentException {

    public ExpressionException(String message) {
        super(message);
    }

    public ExpressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
