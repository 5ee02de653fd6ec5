package de.anton.pv.simulator.iv_simulator.algorithms;

import java.util.Objects;

/**
 * Current found for one voltage sample, with the iteration count and how the solve ended.
 */
public final class NewtonRaphsonResult {

    private final double current;
    private final int iterations;
    private final SolverStatus status;

    public NewtonRaphsonResult(double current, int iterations, SolverStatus status) {
        this.current = current;
        this.iterations = iterations;
        this.status = Objects.requireNonNull(status);
    }

    public double getCurrent() { return current; }
    public int getIterations() { return iterations; }
    public SolverStatus getStatus() { return status; }

    @Override
    public String toString() { return "NewtonRaphsonResult[I=" + current + ", iterations=" + iterations + ", status=" + status + "]"; }
}
