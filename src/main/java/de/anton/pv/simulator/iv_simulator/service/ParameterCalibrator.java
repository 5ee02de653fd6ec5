package de.anton.pv.simulator.iv_simulator.service;

import de.anton.pv.simulator.iv_simulator.model.CalibrationResult;
import de.anton.pv.simulator.iv_simulator.model.CurvePoint;
import de.anton.pv.simulator.iv_simulator.model.DiodeModelParams;
import de.anton.pv.simulator.iv_simulator.model.ModuleSpec;
import de.anton.pv.simulator.iv_simulator.model.OperatingCondition;
import de.anton.pv.simulator.iv_simulator.model.PhysicalConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Two-stage grid search over (n, Rs, Rsh) that moves the model's STC maximum power point
 * towards the nameplate (Vmpp, Impp).
 * <p>
 * Stage 1 scans a fixed coarse grid (6 × 7 × 7). Stage 2 refines around the best grid
 * triplet (5 × 5 × 5). The incoming parameters only seed the best score and are never a
 * search centre, so the searched grid does not depend on them: a second call after an
 * adoption finds the same optimum and leaves the parameters untouched.
 */
public class ParameterCalibrator {

    private static final Logger logger = LoggerFactory.getLogger(ParameterCalibrator.class);

    public static final int SCORING_RESOLUTION = 140;
    static final double MIN_IMPROVEMENT = 1e-3;

    static final double[] COARSE_N = {1.1, 1.2, 1.3, 1.4, 1.5, 1.6};
    static final double[] COARSE_RS = {0.02, 0.05, 0.1, 0.15, 0.2, 0.3, 0.4};
    static final double[] COARSE_RSH = {200, 500, 1000, 2000, 5000, 10000, 20000};

    static final double[] FINE_N_OFFSETS = {-0.05, -0.02, 0.0, 0.02, 0.05};
    static final double[] FINE_RS_FACTORS = {0.7, 0.85, 1.0, 1.15, 1.3};
    static final double[] FINE_RSH_FACTORS = {0.5, 0.75, 1.0, 1.25, 1.6};

    // n is kept strictly inside (1, 2)
    static final double N_MIN = 1.001;
    static final double N_MAX = 1.999;
    static final double RS_MIN = 0.005;
    static final double RS_MAX = 1.0;
    static final double RSH_MIN = 50;
    static final double RSH_MAX = 100000;

    private static final class Candidate {
        DiodeModelParams params;
        double distance;

        Candidate(DiodeModelParams params, double distance) {
            this.params = params;
            this.distance = distance;
        }

        void offer(DiodeModelParams other, double otherDistance) {
            if (otherDistance < distance) {
                params = other;
                distance = otherDistance;
            }
        }
    }

    /**
     * Calibrates when {@code condition} is near STC; otherwise returns the parameters unchanged.
     *
     * @param moduleSpec module whose nameplate MPP is the target
     * @param params     current parameters
     * @param condition  current operating condition of the caller
     */
    public CalibrationResult calibrate(ModuleSpec moduleSpec, DiodeModelParams params, OperatingCondition condition) {
        Objects.requireNonNull(condition, "Operating condition cannot be null");
        if (!condition.isNearStc()) {
            logger.debug("Calibration skipped: {} is not near STC.", condition);
            return CalibrationResult.unchanged(params, Double.NaN);
        }
        return calibrate(moduleSpec, params);
    }

    /**
     * Runs both search stages and adopts the best triplet if it improves the MPP distance by more than 1e-3.
     */
    public CalibrationResult calibrate(ModuleSpec moduleSpec, DiodeModelParams params) {
        Objects.requireNonNull(moduleSpec, "ModuleSpec cannot be null");
        Objects.requireNonNull(params, "DiodeModelParams cannot be null");
        long start = System.nanoTime();

        double initialDistance = mppDistance(moduleSpec, params);
        Candidate best = new Candidate(params, initialDistance);
        Candidate bestOnGrid = new Candidate(null, Double.POSITIVE_INFINITY);
        int evaluations = 1;

        for (double n : COARSE_N) {
            for (double rs : COARSE_RS) {
                for (double rsh : COARSE_RSH) {
                    DiodeModelParams candidate = new DiodeModelParams(n, rs, rsh);
                    double distance = mppDistance(moduleSpec, candidate);
                    evaluations++;
                    bestOnGrid.offer(candidate, distance);
                    best.offer(candidate, distance);
                }
            }
        }
        logger.debug("Calibration stage 1: grid winner {} (distance {}), overall best distance {}",
                     bestOnGrid.params, bestOnGrid.distance, best.distance);

        DiodeModelParams centre = bestOnGrid.params;
        for (double dn : FINE_N_OFFSETS) {
            for (double frs : FINE_RS_FACTORS) {
                for (double frsh : FINE_RSH_FACTORS) {
                    DiodeModelParams candidate = new DiodeModelParams(
                            clamp(centre.getN() + dn, N_MIN, N_MAX),
                            clamp(centre.getRs() * frs, RS_MIN, RS_MAX),
                            clamp(centre.getRsh() * frsh, RSH_MIN, RSH_MAX));
                    best.offer(candidate, mppDistance(moduleSpec, candidate));
                    evaluations++;
                }
            }
        }

        boolean adopted = best.distance < initialDistance - MIN_IMPROVEMENT;
        long ms = (System.nanoTime() - start) / 1_000_000;
        if (adopted) {
            logger.info("Calibration adopted {} (MPP distance {} -> {}) after {} evaluations in {} ms.",
                        best.params, String.format("%.4f", initialDistance), String.format("%.4f", best.distance), evaluations, ms);
            return new CalibrationResult(params, best.params, initialDistance, best.distance, true, evaluations);
        }
        logger.info("Calibration kept {} (distance {}, best found {}) after {} evaluations in {} ms.",
                    params, String.format("%.4f", initialDistance), String.format("%.4f", best.distance), evaluations, ms);
        return new CalibrationResult(params, params, initialDistance, best.distance, false, evaluations);
    }

    /**
     * Euclidean distance between the model's STC maximum power point (140-step sweep)
     * and the nameplate (Vmpp, Impp).
     */
    public double mppDistance(ModuleSpec moduleSpec, DiodeModelParams params) {
        CurvePoint mpp = new DiodeModelSolver(moduleSpec, params, SCORING_RESOLUTION)
                .findMaximumPowerPoint(PhysicalConstants.STC_IRRADIANCE, PhysicalConstants.STC_TEMPERATURE);
        double dv = mpp.getVoltage() - moduleSpec.getVmppRef();
        double di = mpp.getCurrent() - moduleSpec.getImppRef();
        return Math.sqrt(dv * dv + di * di);
    }

    private static double clamp(double value, double min, double max) {
        return Math.min(Math.max(value, min), max);
    }
}
