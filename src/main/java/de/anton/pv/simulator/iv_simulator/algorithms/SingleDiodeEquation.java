package de.anton.pv.simulator.iv_simulator.algorithms;

import de.anton.pv.simulator.iv_simulator.model.DiodeModelParams;
import de.anton.pv.simulator.iv_simulator.model.PhysicalConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The implicit single-diode relation for one operating condition:
 * <pre>
 *   F(I) = I - IL + Io·(exp((V + I·Rs) / nvt) - 1) + (V + I·Rs) / Rsh = 0
 * </pre>
 * All coefficients are fixed at construction, so an instance can be shared between threads.
 */
public final class SingleDiodeEquation {

    private static final Logger logger = LoggerFactory.getLogger(SingleDiodeEquation.class);

    static final double MIN_THERMAL_VOLTAGE = 1e-9;
    static final double MIN_SHUNT_RESISTANCE_FOR_IO = 1e-6;
    static final double MIN_SHUNT_RESISTANCE = 1e-9;
    static final double MIN_SATURATION_CURRENT = 1e-12;

    private final double photoCurrent;        // IL
    private final double saturationCurrent;   // Io
    private final double modifiedThermalVoltage; // nvt, floored
    private final double seriesResistance;
    private final double shuntResistance;     // floored

    private SingleDiodeEquation(double photoCurrent, double saturationCurrent, double modifiedThermalVoltage,
                                double seriesResistance, double shuntResistance) {
        this.photoCurrent = photoCurrent;
        this.saturationCurrent = saturationCurrent;
        this.modifiedThermalVoltage = modifiedThermalVoltage;
        this.seriesResistance = seriesResistance;
        this.shuntResistance = shuntResistance;
    }

    /**
     * Builds the equation for a condition whose IL and open-circuit voltage are already adjusted.
     * Io is chosen so that I(VocG) = 0 on the ideal (Rs = 0) curve.
     */
    public static SingleDiodeEquation create(DiodeModelParams params, int cellsSeries, double temperatureC,
                                             double photoCurrent, double openCircuitVoltage) {
        double nvt = modifiedThermalVoltage(params.getN(), cellsSeries, temperatureC);
        double flooredNvt = Math.max(nvt, MIN_THERMAL_VOLTAGE);

        double denom = Math.exp(Math.max(openCircuitVoltage, 0) / flooredNvt) - 1;
        double numer = photoCurrent - openCircuitVoltage / Math.max(params.getRsh(), MIN_SHUNT_RESISTANCE_FOR_IO);
        double io = Math.max(denom > 0 ? numer / denom : 0, MIN_SATURATION_CURRENT);
        logger.trace("Equation: nvt={}, IL={}, VocG={}, Io={}", nvt, photoCurrent, openCircuitVoltage, io);

        return new SingleDiodeEquation(photoCurrent, io, flooredNvt, params.getRs(),
                                       Math.max(params.getRsh(), MIN_SHUNT_RESISTANCE));
    }

    /** n · kT/q · cells: the module-level thermal voltage of the diode term (not floored). */
    public static double modifiedThermalVoltage(double n, int cellsSeries, double temperatureC) {
        return n * PhysicalConstants.thermalVoltage(temperatureC) * Math.max(cellsSeries, 1);
    }

    public double getPhotoCurrent() { return photoCurrent; }
    public double getSaturationCurrent() { return saturationCurrent; }
    public double getModifiedThermalVoltage() { return modifiedThermalVoltage; }
    public double getSeriesResistance() { return seriesResistance; }
    public double getShuntResistance() { return shuntResistance; }
}
