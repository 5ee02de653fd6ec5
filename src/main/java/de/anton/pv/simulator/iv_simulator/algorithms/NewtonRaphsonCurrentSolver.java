package de.anton.pv.simulator.iv_simulator.algorithms;

/**
 * Newton-Raphson solve of {@link SingleDiodeEquation} for the current at a given voltage.
 * <p>
 * Shared by the curve sweep and the calibration scoring. Never throws: the exponent
 * argument is clamped, the derivative floored and a non-finite iterate resets the current to zero.
 */
public final class NewtonRaphsonCurrentSolver {

    public static final int MAX_ITERATIONS = 80;
    public static final double STEP_TOLERANCE = 1e-8;
    static final double EXPONENT_LIMIT = 50.0;
    static final double MIN_DERIVATIVE = 1e-12;
    static final double NEGATIVE_CURRENT_SLACK = -0.1;
    static final double CURRENT_CAP_FACTOR = 1.2;

    private NewtonRaphsonCurrentSolver() { throw new IllegalStateException("Utility class"); }

    /**
     * Solves F(I) = 0 at voltage {@code voltage}.
     *
     * @param equation     the diode equation of the current condition
     * @param voltage      terminal voltage (V)
     * @param initialGuess starting current, normally the result at the previous (lower) voltage
     * @return the current clipped to [0, 1.2·IL] with the iteration outcome
     */
    public static NewtonRaphsonResult solve(SingleDiodeEquation equation, double voltage, double initialGuess) {
        double il = equation.getPhotoCurrent();
        double io = equation.getSaturationCurrent();
        double nvt = equation.getModifiedThermalVoltage();
        double rs = equation.getSeriesResistance();
        double rsh = equation.getShuntResistance();
        double cap = CURRENT_CAP_FACTOR * Math.max(il, 0);

        double current = clip(Double.isFinite(initialGuess) ? initialGuess : il, cap);
        SolverStatus status = SolverStatus.MAX_ITERATIONS;
        int iterations = 0;
        boolean previousReset = false;

        while (iterations < MAX_ITERATIONS) {
            iterations++;
            double diodeVoltage = voltage + current * rs;
            double arg = Math.min(Math.max(diodeVoltage / nvt, -EXPONENT_LIMIT), EXPONENT_LIMIT);
            double expArg = Math.exp(arg);

            double f = current - il + io * (expArg - 1) + diodeVoltage / rsh;
            double df = 1 + io * expArg * (rs / nvt) + rs / rsh;
            double step = f / Math.max(df, MIN_DERIVATIVE);
            current -= step;

            if (!Double.isFinite(current)) {
                current = 0;
                status = SolverStatus.NON_FINITE;
                break;
            }
            boolean reset = false;
            if (current < NEGATIVE_CURRENT_SLACK) {
                current = 0;
                reset = true;
            } else if (current > cap) {
                current = cap;
            }
            if (Math.abs(step) < STEP_TOLERANCE) {
                status = SolverStatus.CONVERGED;
                break;
            }
            if (reset && previousReset) {
                status = SolverStatus.PINNED_AT_ZERO;
                break;
            }
            previousReset = reset;
        }
        return new NewtonRaphsonResult(clip(current, cap), iterations, status);
    }

    private static double clip(double current, double cap) {
        return Math.min(Math.max(current, 0), cap);
    }
}
