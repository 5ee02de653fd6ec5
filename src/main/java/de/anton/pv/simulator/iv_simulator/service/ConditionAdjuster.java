package de.anton.pv.simulator.iv_simulator.service;

import de.anton.pv.simulator.iv_simulator.algorithms.SingleDiodeEquation;
import de.anton.pv.simulator.iv_simulator.model.DiodeModelParams;
import de.anton.pv.simulator.iv_simulator.model.ModuleSpec;
import de.anton.pv.simulator.iv_simulator.model.PhysicalConstants;

import java.util.Objects;

/**
 * Translates the nameplate Isc and Voc from STC to an arbitrary irradiance and cell temperature.
 * Pure and immutable.
 */
public class ConditionAdjuster {

    static final double MIN_IRRADIANCE_FOR_LOG = 1.0;
    static final double MIN_OPEN_CIRCUIT_VOLTAGE = 0.1;

    private final ModuleSpec moduleSpec;
    private final DiodeModelParams params;

    public ConditionAdjuster(ModuleSpec moduleSpec, DiodeModelParams params) {
        this.moduleSpec = Objects.requireNonNull(moduleSpec, "ModuleSpec cannot be null");
        this.params = Objects.requireNonNull(params, "DiodeModelParams cannot be null");
    }

    /**
     * Isc' = Isc_ref · G/Gref · (1 + α·(Tc - Tref)).
     */
    public double adjustedIsc(double irradiance, double temperatureC) {
        return moduleSpec.getIscRef()
                * (irradiance / PhysicalConstants.STC_IRRADIANCE)
                * (1 + moduleSpec.getAlphaIsc() * (temperatureC - PhysicalConstants.STC_TEMPERATURE));
    }

    /**
     * Voc' = Voc_ref · (1 + β·(Tc - Tref)) + nvt · ln(G/Gref), floored at 0.1 V.
     * G is floored at 1 W/m² before the logarithm.
     */
    public double adjustedVoc(double irradiance, double temperatureC) {
        double thermal = moduleSpec.getVocRef()
                * (1 + moduleSpec.getBetaVoc() * (temperatureC - PhysicalConstants.STC_TEMPERATURE));
        double nvt = SingleDiodeEquation.modifiedThermalVoltage(params.getN(), moduleSpec.getCellsSeries(), temperatureC);
        double logTerm = nvt * Math.log(Math.max(irradiance, MIN_IRRADIANCE_FOR_LOG) / PhysicalConstants.STC_IRRADIANCE);
        return Math.max(thermal + logTerm, MIN_OPEN_CIRCUIT_VOLTAGE);
    }

    public ModuleSpec getModuleSpec() { return moduleSpec; }
    public DiodeModelParams getParams() { return params; }
}
