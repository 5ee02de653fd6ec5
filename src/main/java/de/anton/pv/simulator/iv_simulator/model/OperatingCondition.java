package de.anton.pv.simulator.iv_simulator.model;

import java.util.Objects;

/**
 * Irradiance (W/m²) and cell temperature (°C) a curve is computed for.
 */
public final class OperatingCondition {

    public static final OperatingCondition STC =
            new OperatingCondition(PhysicalConstants.STC_IRRADIANCE, PhysicalConstants.STC_TEMPERATURE);

    // Near-STC window: ±2 % irradiance, ±1 °C temperature
    private static final double NEAR_STC_IRRADIANCE_FRACTION = 0.02;
    private static final double NEAR_STC_TEMPERATURE_DELTA = 1.0;

    private final double irradiance;
    private final double temperature;

    public OperatingCondition(double irradiance, double temperature) {
        if (!Double.isFinite(irradiance) || irradiance < 0) {
            throw new IllegalArgumentException("Irradiance must be finite and non-negative, was " + irradiance);
        }
        if (!Double.isFinite(temperature)) {
            throw new IllegalArgumentException("Temperature must be finite, was " + temperature);
        }
        this.irradiance = irradiance;
        this.temperature = temperature;
    }

    public double getIrradiance() { return irradiance; }
    public double getTemperature() { return temperature; }

    /**
     * True within ±2 % of 1000 W/m² and ±1 °C of 25 °C. Gates both the nameplate
     * diagnostics and automatic calibration.
     */
    public boolean isNearStc() {
        return Math.abs(irradiance - PhysicalConstants.STC_IRRADIANCE) <= PhysicalConstants.STC_IRRADIANCE * NEAR_STC_IRRADIANCE_FRACTION
            && Math.abs(temperature - PhysicalConstants.STC_TEMPERATURE) <= NEAR_STC_TEMPERATURE_DELTA;
    }

    @Override
    public String toString() { return String.format("OperatingCondition[G=%.1f W/m², T=%.1f °C]", irradiance, temperature); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OperatingCondition that = (OperatingCondition) o;
        return Double.compare(that.irradiance, irradiance) == 0 && Double.compare(that.temperature, temperature) == 0;
    }

    @Override
    public int hashCode() { return Objects.hash(irradiance, temperature); }
}
