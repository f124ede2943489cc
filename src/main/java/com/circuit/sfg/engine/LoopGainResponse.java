package com.circuit.sfg.engine;

import com.circuit.sfg.algebra.Expression;

/**
 * Open-loop response derived from the determinant: {@code delta - 1}.
 */
public record LoopGainResponse(Expression loopGain, String phase, String bodeMagnitude) {

    static LoopGainResponse of(Expression delta) {
        Expression loopGain = delta.subtract(1);
        return new LoopGainResponse(loopGain, loopGain.phase(), "20 * log10 (" + loopGain.magnitude() + ")");
    }
}
