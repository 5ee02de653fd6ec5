package de.anton.pv.simulator.iv_simulator.service;

import de.anton.pv.simulator.iv_simulator.model.DiodeModelParams;
import de.anton.pv.simulator.iv_simulator.model.ModuleSpec;
import de.anton.pv.simulator.iv_simulator.model.OperatingCondition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Immutable configuration object holding all inputs for a simulation run.
 * Resolutions below 10 steps are raised to 10.
 */
public record SimulationConfiguration(
    ModuleSpec moduleSpec,
    DiodeModelParams diodeParams,
    OperatingCondition condition,
    int resolution,
    boolean autoCalibrate // calibrate first when the condition is near STC
) {
    public static final int MIN_RESOLUTION = 10;
    public static final int DEFAULT_RESOLUTION = 140;

    private static final Logger logger = LoggerFactory.getLogger(SimulationConfiguration.class);

    public SimulationConfiguration {
        Objects.requireNonNull(moduleSpec, "ModuleSpec cannot be null");
        Objects.requireNonNull(diodeParams, "DiodeModelParams cannot be null");
        Objects.requireNonNull(condition, "Operating condition cannot be null");
        if (resolution < MIN_RESOLUTION) {
            logger.warn("Resolution {} below minimum, using {}.", resolution, MIN_RESOLUTION);
            resolution = MIN_RESOLUTION;
        }
    }

    public SimulationConfiguration withDiodeParams(DiodeModelParams params) {
        return new SimulationConfiguration(moduleSpec, params, condition, resolution, autoCalibrate);
    }
}
