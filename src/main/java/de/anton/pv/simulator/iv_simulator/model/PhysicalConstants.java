package de.anton.pv.simulator.iv_simulator.model;

/**
 * Physical constants and reference conditions used by the single-diode model.
 */
public final class PhysicalConstants {

    /** Elementary charge in Coulomb. */
    public static final double ELEMENTARY_CHARGE = 1.602176634e-19;
    /** Boltzmann constant in J/K. */
    public static final double BOLTZMANN = 1.380649e-23;
    public static final double KELVIN_OFFSET = 273.15;

    /** Standard Test Conditions: irradiance in W/m². */
    public static final double STC_IRRADIANCE = 1000.0;
    /** Standard Test Conditions: cell temperature in °C. */
    public static final double STC_TEMPERATURE = 25.0;

    private PhysicalConstants() { throw new IllegalStateException("Utility class"); }

    /**
     * Per-cell thermal voltage kT/q.
     *
     * @param temperatureC cell temperature in °C
     * @return thermal voltage in Volts
     */
    public static double thermalVoltage(double temperatureC) {
        return BOLTZMANN * (temperatureC + KELVIN_OFFSET) / ELEMENTARY_CHARGE;
    }
}
