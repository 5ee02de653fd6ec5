package de.anton.pv.simulator.iv_simulator.service;

import de.anton.pv.simulator.iv_simulator.model.Curve;
import de.anton.pv.simulator.iv_simulator.model.CurveFamily;
import de.anton.pv.simulator.iv_simulator.model.OperatingCondition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Computes families of curves in parallel. Each member is an independent, pure solve,
 * so members are submitted to a fixed thread pool and collected in request order.
 */
public class CurveFamilyService {

    private static final Logger logger = LoggerFactory.getLogger(CurveFamilyService.class);

    public static final double[] IRRADIANCE_LEVELS = {1000, 800, 600, 400, 200};
    public static final double[] TEMPERATURE_LEVELS = {75, 65, 55, 45, 35, 25};
    /** Temperature held fixed for irradiance families. */
    public static final double FAMILY_TEMPERATURE = 25;
    /** Irradiance held fixed for temperature families. */
    public static final double FAMILY_IRRADIANCE = 1000;

    private final int threads;

    public CurveFamilyService() {
        this(Math.max(1, Runtime.getRuntime().availableProcessors()));
    }

    public CurveFamilyService(int threads) {
        if (threads < 1) throw new IllegalArgumentException("Thread count must be positive, was " + threads);
        this.threads = threads;
    }

    /**
     * Computes one curve per value of {@code variable}, the other variable held at {@code fixedValue}.
     *
     * @throws InterruptedException  if interrupted while waiting for a member
     * @throws IllegalStateException if a member solve failed
     */
    public CurveFamily computeFamily(DiodeModelSolver solver, CurveFamily.Variable variable,
                                     double[] values, double fixedValue) throws InterruptedException {
        Objects.requireNonNull(solver, "Solver cannot be null");
        Objects.requireNonNull(variable, "Variable cannot be null");
        if (values == null || values.length == 0) {
            logger.warn("No values given for {} family.", variable.name());
            return new CurveFamily(variable, fixedValue, List.of());
        }

        long start = System.nanoTime();
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(threads, values.length));
        try {
            List<Future<Curve>> futures = new ArrayList<>(values.length);
            for (double value : values) {
                OperatingCondition condition = variable == CurveFamily.Variable.IRRADIANCE
                        ? new OperatingCondition(value, fixedValue)
                        : new OperatingCondition(fixedValue, value);
                Callable<Curve> task = () -> solver.computeCurve(condition);
                futures.add(executor.submit(task));
            }

            List<Curve> curves = new ArrayList<>(values.length);
            for (Future<Curve> future : futures) {
                try {
                    curves.add(future.get());
                } catch (ExecutionException e) {
                    throw new IllegalStateException("Curve computation failed for " + variable.name() + " family", e.getCause());
                }
            }
            logger.debug("{} family with {} curves computed in {} ms.", variable.name(), curves.size(),
                         (System.nanoTime() - start) / 1_000_000);
            return new CurveFamily(variable, fixedValue, curves);
        } finally {
            executor.shutdownNow();
        }
    }
}
