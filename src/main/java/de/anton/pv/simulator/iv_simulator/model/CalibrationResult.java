package de.anton.pv.simulator.iv_simulator.model;

import java.util.Objects;

/**
 * Outcome of a calibration run. {@link #getParameters()} is the parameter set the caller
 * should use: the improved triplet when it was adopted, otherwise the unchanged input.
 */
public final class CalibrationResult {

    private final DiodeModelParams initialParameters;
    private final DiodeModelParams parameters;
    private final double initialDistance;
    private final double bestDistance;
    private final boolean adopted;
    private final int evaluations;

    public CalibrationResult(DiodeModelParams initialParameters, DiodeModelParams parameters,
                             double initialDistance, double bestDistance, boolean adopted, int evaluations) {
        this.initialParameters = Objects.requireNonNull(initialParameters);
        this.parameters = Objects.requireNonNull(parameters);
        this.initialDistance = initialDistance;
        this.bestDistance = bestDistance;
        this.adopted = adopted;
        this.evaluations = evaluations;
    }

    /** Result for a run that was not attempted (e.g. condition not near STC). */
    public static CalibrationResult unchanged(DiodeModelParams parameters, double distance) {
        return new CalibrationResult(parameters, parameters, distance, distance, false, 0);
    }

    public DiodeModelParams getInitialParameters() { return initialParameters; }
    public DiodeModelParams getParameters() { return parameters; }
    /** Euclidean MPP distance to the nameplate (Vmpp, Impp) before calibration. */
    public double getInitialDistance() { return initialDistance; }
    /** Best distance found by the search; equals the distance of {@link #getParameters()} when adopted. */
    public double getBestDistance() { return bestDistance; }
    public boolean isAdopted() { return adopted; }
    public int getEvaluations() { return evaluations; }

    @Override
    public String toString() {
        return String.format("CalibrationResult[adopted=%s, %s -> %s, distance %.4f -> %.4f, evaluations=%d]",
                adopted, initialParameters, parameters, initialDistance, bestDistance, evaluations);
    }
}
