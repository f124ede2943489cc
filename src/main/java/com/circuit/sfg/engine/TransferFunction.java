package com.circuit.sfg.engine;

import com.circuit.sfg.algebra.Expression;

/**
 * Result of Mason's rule between two nodes.
 *
 * @param startId        Input node.
 * @param endId          Output node.
 * @param numerator      Sum of forward path gains times cofactors.
 * @param denominator    Graph determinant.
 * @param bodePhase      Phase formula, numerator phase minus denominator phase.
 * @param bodeMagnitude  Magnitude formula in dB.
 */
public record TransferFunction(
        String startId,
        String endId,
        Expression numerator,
        Expression denominator,
        String bodePhase,
        String bodeMagnitude) {

    static TransferFunction of(String startId, String endId, Expression numerator, Expression denominator) {
        String phase = numerator.phase() + " - " + denominator.phase();
        String magnitude = "20 * log10 ( (" + numerator.magnitude() + ") / (" + denominator.magnitude() + "))";
        return new TransferFunction(startId, endId, numerator, denominator, phase, magnitude);
    }

    /** {@code end/start = (numerator) / (denominator)} */
    public String describe() {
        return endId + "/" + startId + " = (" + numerator + ") / (" + denominator + ")";
    }
}
