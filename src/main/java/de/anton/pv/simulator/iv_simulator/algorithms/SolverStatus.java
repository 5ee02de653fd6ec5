package de.anton.pv.simulator.iv_simulator.algorithms;

/**
 * How a Newton solve for one voltage sample ended.
 */
public enum SolverStatus {
    /** Step magnitude dropped below the tolerance. */
    CONVERGED,
    /** Iterate was reset to zero twice in a row; the solution lies below the negative slack. */
    PINNED_AT_ZERO,
    /** Iteration cap reached; the last iterate is returned. */
    MAX_ITERATIONS,
    /** A step produced NaN/Infinity; current was reset to zero. */
    NON_FINITE;

    public boolean isConverged() { return this == CONVERGED || this == PINNED_AT_ZERO; }
}
