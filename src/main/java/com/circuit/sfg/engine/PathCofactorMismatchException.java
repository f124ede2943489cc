package com.circuit.sfg.engine;

/**
 * The numerator could not be assembled because forward paths and cofactors
 * did not pair up one to one.
 */
public class PathCofactorMismatchException extends IllegalStateException {
    private final int pathCount;
    private final int cofactorCount;

    public PathCofactorMismatchException(int pathCount, int cofactorCount) {
        super("Forward path count " + pathCount + " does not match cofactor count " + cofactorCount);
        this.pathCount = pathCount;
        this.cofactorCount = cofactorCount;
    }

    public int pathCount() {
        return pathCount;
    }

    public int cofactorCount() {
        return cofactorCount;
    }
}
