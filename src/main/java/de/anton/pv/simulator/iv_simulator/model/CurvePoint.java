package de.anton.pv.simulator.iv_simulator.model;

import java.util.Objects;

/**
 * One sample of an I-V curve. Power is always V·I.
 */
public final class CurvePoint {

    private final double voltage;
    private final double current;
    private final double power;

    public CurvePoint(double voltage, double current) {
        this.voltage = voltage;
        this.current = current;
        this.power = voltage * current;
    }

    public double getVoltage() { return voltage; }
    public double getCurrent() { return current; }
    public double getPower() { return power; }

    @Override
    public String toString() { return String.format("CurvePoint[V=%.3f, I=%.4f, P=%.2f]", voltage, current, power); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CurvePoint that = (CurvePoint) o;
        return Double.compare(that.voltage, voltage) == 0 && Double.compare(that.current, current) == 0;
    }

    @Override
    public int hashCode() { return Objects.hash(voltage, current); }
}
