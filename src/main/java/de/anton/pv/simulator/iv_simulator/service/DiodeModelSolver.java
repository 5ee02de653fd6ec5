package de.anton.pv.simulator.iv_simulator.service;

import de.anton.pv.simulator.iv_simulator.algorithms.NewtonRaphsonCurrentSolver;
import de.anton.pv.simulator.iv_simulator.algorithms.NewtonRaphsonResult;
import de.anton.pv.simulator.iv_simulator.algorithms.SingleDiodeEquation;
import de.anton.pv.simulator.iv_simulator.model.Curve;
import de.anton.pv.simulator.iv_simulator.model.CurvePoint;
import de.anton.pv.simulator.iv_simulator.model.DiodeModelParams;
import de.anton.pv.simulator.iv_simulator.model.ModuleSpec;
import de.anton.pv.simulator.iv_simulator.model.OperatingCondition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Produces I-V curves from the single-diode model. An instance is bound to one module,
 * one parameter set and one resolution; {@link #computeCurve(double, double)} is pure,
 * so the same solver can be used from several threads for different conditions.
 */
public class DiodeModelSolver {

    private static final Logger logger = LoggerFactory.getLogger(DiodeModelSolver.class);

    static final int MIN_RESOLUTION = 10;
    static final double VOLTAGE_HEADROOM = 1.02;

    private final ModuleSpec moduleSpec;
    private final DiodeModelParams params;
    private final int resolution;
    private final ConditionAdjuster conditionAdjuster;

    /** Receives every solved sample of a voltage sweep. */
    private interface SampleSink {
        void accept(double voltage, NewtonRaphsonResult result);
    }

    public DiodeModelSolver(ModuleSpec moduleSpec, DiodeModelParams params, int resolution) {
        this.moduleSpec = Objects.requireNonNull(moduleSpec, "ModuleSpec cannot be null");
        this.params = Objects.requireNonNull(params, "DiodeModelParams cannot be null");
        this.resolution = resolution;
        this.conditionAdjuster = new ConditionAdjuster(moduleSpec, params);
    }

    public double adjustedIsc(double irradiance, double temperatureC) { return conditionAdjuster.adjustedIsc(irradiance, temperatureC); }
    public double adjustedVoc(double irradiance, double temperatureC) { return conditionAdjuster.adjustedVoc(irradiance, temperatureC); }

    public Curve computeCurve(OperatingCondition condition) {
        return computeCurve(condition.getIrradiance(), condition.getTemperature());
    }

    /**
     * Samples the curve from 0 V to 1.02·max(VocG, Voc_ref) in {@code resolution} steps.
     *
     * @return {@code resolution + 1} points plus IL and VocG
     * @throws IllegalArgumentException if irradiance or temperature is not finite
     */
    public Curve computeCurve(double irradiance, double temperatureC) {
        OperatingCondition condition = new OperatingCondition(Math.max(requireFinite(irradiance, "Irradiance"), 0), temperatureC);
        int steps = Math.max(resolution, 0);
        List<CurvePoint> points = new ArrayList<>(steps + 1);
        int[] unconverged = {0};
        SingleDiodeEquation equation = sweep(irradiance, temperatureC, steps, (v, result) -> {
            points.add(new CurvePoint(v, result.getCurrent()));
            if (!result.getStatus().isConverged()) unconverged[0]++;
        });
        if (unconverged[0] > 0) {
            logger.debug("Curve at G={}, T={}: {} of {} samples did not converge.", irradiance, temperatureC, unconverged[0], points.size());
        }
        return new Curve(condition, points,
                         equation.getPhotoCurrent(), adjustedVoc(irradiance, temperatureC), unconverged[0]);
    }

    /**
     * Sweeps the curve without building it and returns the sample of maximal power
     * (first occurrence on ties). Used for calibration scoring.
     *
     * @throws IllegalArgumentException if irradiance or temperature is not finite
     */
    public CurvePoint findMaximumPowerPoint(double irradiance, double temperatureC) {
        requireFinite(irradiance, "Irradiance");
        requireFinite(temperatureC, "Temperature");
        double[] best = {0, 0, Double.NEGATIVE_INFINITY};
        sweep(irradiance, temperatureC, Math.max(resolution, 0), (v, result) -> {
            double p = v * result.getCurrent();
            if (p > best[2]) {
                best[0] = v;
                best[1] = result.getCurrent();
                best[2] = p;
            }
        });
        return new CurvePoint(best[0], best[1]);
    }

    private SingleDiodeEquation sweep(double irradiance, double temperatureC, int steps, SampleSink sink) {
        double il = adjustedIsc(irradiance, temperatureC);
        double vocG = adjustedVoc(irradiance, temperatureC);
        SingleDiodeEquation equation = SingleDiodeEquation.create(params, moduleSpec.getCellsSeries(), temperatureC, il, vocG);

        double vMax = Math.max(vocG, moduleSpec.getVocRef()) * VOLTAGE_HEADROOM;
        double dV = vMax / Math.max(steps, MIN_RESOLUTION);
        logger.trace("Sweep G={}, T={}: IL={}, VocG={}, Io={}, Vmax={}", irradiance, temperatureC, il, vocG,
                     equation.getSaturationCurrent(), vMax);

        double previousCurrent = il;
        for (int i = 0; i <= steps; i++) {
            double v = i * dV;
            NewtonRaphsonResult result = NewtonRaphsonCurrentSolver.solve(equation, v, previousCurrent);
            sink.accept(v, result);
            previousCurrent = result.getCurrent();
        }
        return equation;
    }

    private static double requireFinite(double value, String name) {
        if (!Double.isFinite(value)) throw new IllegalArgumentException(name + " must be finite, was " + value);
        return value;
    }

    public ModuleSpec getModuleSpec() { return moduleSpec; }
    public DiodeModelParams getParams() { return params; }
    public int getResolution() { return resolution; }
}
