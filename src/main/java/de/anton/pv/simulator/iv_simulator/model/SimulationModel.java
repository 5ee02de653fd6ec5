package de.anton.pv.simulator.iv_simulator.model;

import de.anton.pv.simulator.iv_simulator.service.SimulationConfiguration;
import de.anton.pv.simulator.iv_simulator.service.SimulationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.beans.PropertyChangeListener;
import java.beans.PropertyChangeSupport;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Observable application state: the current module, diode parameters, operating condition
 * and the results of the last runs. The model never computes on its own; the controller
 * runs the services and stores their results here, which fires property change events.
 */
public class SimulationModel {
    private static final Logger logger = LoggerFactory.getLogger(SimulationModel.class);

    // ELGIN ELG590-M72HEP datasheet
    public static final ModuleSpec DEFAULT_MODULE = ModuleSpec.fromDatasheet(52.0, 14.31, 43.55, 13.55, 2.648, 144, 0.046, -0.26);
    public static final DiodeModelParams DEFAULT_PARAMS = new DiodeModelParams(1.3, 0.2, 1000);

    // Configuration
    private ModuleSpec moduleSpec = DEFAULT_MODULE;
    private DiodeModelParams diodeParams = DEFAULT_PARAMS;
    private OperatingCondition condition = OperatingCondition.STC;
    private int resolution = SimulationConfiguration.DEFAULT_RESOLUTION;
    private boolean autoCalibrate = true;

    // Results
    private SimulationService.SimulationResult lastResult = null;
    private List<CurveFamily> curveFamilies = Collections.emptyList();

    private final PropertyChangeSupport support = new PropertyChangeSupport(this);

    public SimulationModel() { logger.info("SimulationModel created."); }
    public void addPropertyChangeListener(PropertyChangeListener pcl) { support.addPropertyChangeListener(pcl); }
    public void removePropertyChangeListener(PropertyChangeListener pcl) { support.removePropertyChangeListener(pcl); }

    /** Snapshot of the current inputs for a service run. */
    public SimulationConfiguration toConfiguration() {
        return new SimulationConfiguration(moduleSpec, diodeParams, condition, resolution, autoCalibrate);
    }

    // --- Getters ---
    public ModuleSpec getModuleSpec() { return moduleSpec; }
    public DiodeModelParams getDiodeParams() { return diodeParams; }
    public OperatingCondition getCondition() { return condition; }
    public int getResolution() { return resolution; }
    public boolean isAutoCalibrate() { return autoCalibrate; }
    public SimulationService.SimulationResult getLastResult() { return lastResult; }
    public boolean isResultAvailable() { return lastResult != null; }
    public List<CurveFamily> getCurveFamilies() { return curveFamilies; }

    // --- Setters (fire events; inputs invalidate the last result) ---
    public void setModuleSpec(ModuleSpec spec) {
        Objects.requireNonNull(spec, "ModuleSpec cannot be null");
        if (!spec.equals(this.moduleSpec)) { ModuleSpec old = this.moduleSpec; this.moduleSpec = spec; logger.info("Model: Module set to {}", spec); clearResults(); support.firePropertyChange("moduleSpec", old, spec); }
    }

    public void setDiodeParams(DiodeModelParams params) {
        Objects.requireNonNull(params, "DiodeModelParams cannot be null");
        if (!params.equals(this.diodeParams)) { DiodeModelParams old = this.diodeParams; this.diodeParams = params; logger.info("Model: Diode parameters set to {}", params); clearResults(); support.firePropertyChange("diodeParams", old, params); }
    }

    public void setCondition(OperatingCondition newCondition) {
        Objects.requireNonNull(newCondition, "Operating condition cannot be null");
        if (!newCondition.equals(this.condition)) { OperatingCondition old = this.condition; this.condition = newCondition; logger.info("Model: Condition set to {}", newCondition); clearResults(); support.firePropertyChange("condition", old, newCondition); }
    }

    public void setResolution(int newResolution) {
        int effective = Math.max(newResolution, SimulationConfiguration.MIN_RESOLUTION);
        if (effective != this.resolution) { int old = this.resolution; this.resolution = effective; logger.info("Model: Resolution set to {}", effective); clearResults(); support.firePropertyChange("resolution", old, effective); }
    }

    public void setAutoCalibrate(boolean enabled) {
        if (enabled != this.autoCalibrate) { boolean old = this.autoCalibrate; this.autoCalibrate = enabled; support.firePropertyChange("autoCalibrate", old, enabled); }
    }

    /**
     * Stores a finished run. Parameters adopted by a calibration replace the current ones
     * without clearing the result they produced.
     */
    public void updateSimulationResult(SimulationService.SimulationResult result) {
        SimulationService.SimulationResult old = this.lastResult;
        if (result != null && !result.getEffectiveParams().equals(this.diodeParams)) {
            DiodeModelParams oldParams = this.diodeParams;
            this.diodeParams = result.getEffectiveParams();
            logger.info("Model: Diode parameters replaced by calibration: {}", this.diodeParams);
            support.firePropertyChange("diodeParams", oldParams, this.diodeParams);
        }
        this.lastResult = result;
        logger.debug("Model updated with simulation result: {}", result != null ? result.analysis : null);
        support.firePropertyChange("simulationResult", old, result);
    }

    public void updateCurveFamilies(List<CurveFamily> families) {
        List<CurveFamily> old = this.curveFamilies;
        this.curveFamilies = families != null ? List.copyOf(families) : Collections.emptyList();
        support.firePropertyChange("curveFamilies", old, this.curveFamilies);
    }

    private void clearResults() {
        if (lastResult != null) {
            SimulationService.SimulationResult old = lastResult;
            lastResult = null;
            logger.debug("Cleared simulation result after input change.");
            support.firePropertyChange("simulationResult", old, null);
        }
        if (!curveFamilies.isEmpty()) {
            List<CurveFamily> old = curveFamilies;
            curveFamilies = Collections.emptyList();
            support.firePropertyChange("curveFamilies", old, curveFamilies);
        }
    }
}
