package de.anton.pv.simulator.iv_simulator.service;

import de.anton.pv.simulator.iv_simulator.model.CalibrationResult;
import de.anton.pv.simulator.iv_simulator.model.Curve;
import de.anton.pv.simulator.iv_simulator.model.CurveAnalysis;
import de.anton.pv.simulator.iv_simulator.model.CurveFamily;
import de.anton.pv.simulator.iv_simulator.model.DiodeModelParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Runs the simulation pipeline for one configuration: optional calibration near STC,
 * curve computation and analysis. Stateless; every call works on its own configuration.
 */
public class SimulationService {

    private static final Logger logger = LoggerFactory.getLogger(SimulationService.class);

    private final ParameterCalibrator calibrator;
    private final CurveAnalyzer analyzer;
    private final CurveFamilyService familyService;

    /**
     * Result of one simulation run. {@code calibration} is null when no calibration was attempted.
     */
    public static class SimulationResult {
        public final SimulationConfiguration configuration; // with the parameters actually used
        public final CalibrationResult calibration;
        public final Curve curve;
        public final CurveAnalysis analysis;

        private SimulationResult(SimulationConfiguration configuration, CalibrationResult calibration, Curve curve, CurveAnalysis analysis) {
            this.configuration = configuration;
            this.calibration = calibration;
            this.curve = curve;
            this.analysis = analysis;
        }

        public DiodeModelParams getEffectiveParams() { return configuration.diodeParams(); }
        public boolean wasCalibrated() { return calibration != null && calibration.isAdopted(); }
    }

    public SimulationService() {
        this(new ParameterCalibrator(), new CurveAnalyzer(), new CurveFamilyService());
    }

    public SimulationService(ParameterCalibrator calibrator, CurveAnalyzer analyzer, CurveFamilyService familyService) {
        this.calibrator = Objects.requireNonNull(calibrator);
        this.analyzer = Objects.requireNonNull(analyzer);
        this.familyService = Objects.requireNonNull(familyService);
    }

    /**
     * Executes the pipeline. Calibration runs only if enabled and the condition is near STC;
     * an adopted parameter set is used for the curve and reported in the result.
     */
    public SimulationResult runSimulation(SimulationConfiguration config) {
        Objects.requireNonNull(config, "Configuration cannot be null");
        logger.info("Service: Starting simulation for {} with {} (resolution {}, autoCalibrate={}).",
                    config.condition(), config.diodeParams(), config.resolution(), config.autoCalibrate());

        SimulationConfiguration effective = config;
        CalibrationResult calibration = null;
        if (config.autoCalibrate() && config.condition().isNearStc()) {
            calibration = calibrator.calibrate(config.moduleSpec(), config.diodeParams(), config.condition());
            if (calibration.isAdopted()) {
                effective = config.withDiodeParams(calibration.getParameters());
            }
        }

        Curve curve = new DiodeModelSolver(effective.moduleSpec(), effective.diodeParams(), effective.resolution())
                .computeCurve(effective.condition());
        CurveAnalysis analysis = analyzer.analyze(curve, effective.moduleSpec());
        logger.info("Service: Simulation finished: Pmpp={} W at {} V, FF={}, eff={}.",
                    String.format("%.2f", analysis.getMaximumPowerPoint().getPower()),
                    String.format("%.2f", analysis.getMaximumPowerPoint().getVoltage()),
                    String.format("%.4f", analysis.getFillFactor()),
                    String.format("%.4f", analysis.getEfficiency()));
        return new SimulationResult(effective, calibration, curve, analysis);
    }

    /**
     * Computes the comparison families (irradiance at 25 °C, temperature at 1000 W/m²)
     * for the configuration's module and parameters.
     *
     * @throws InterruptedException if interrupted while waiting for the parallel solves
     */
    public List<CurveFamily> computeStandardFamilies(SimulationConfiguration config) throws InterruptedException {
        Objects.requireNonNull(config, "Configuration cannot be null");
        DiodeModelSolver solver = new DiodeModelSolver(config.moduleSpec(), config.diodeParams(), config.resolution());
        return List.of(
                familyService.computeFamily(solver, CurveFamily.Variable.IRRADIANCE, CurveFamilyService.IRRADIANCE_LEVELS, CurveFamilyService.FAMILY_TEMPERATURE),
                familyService.computeFamily(solver, CurveFamily.Variable.TEMPERATURE, CurveFamilyService.TEMPERATURE_LEVELS, CurveFamilyService.FAMILY_IRRADIANCE));
    }
}
