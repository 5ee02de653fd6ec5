package de.anton.pv.simulator.iv_simulator.model;

import java.util.List;
import java.util.Objects;

/**
 * A sampled I-V / P-V curve for one operating condition, ordered by increasing voltage,
 * together with the light-generated current IL and the condition-adjusted Voc it was built from.
 */
public final class Curve {

    private final OperatingCondition condition;
    private final List<CurvePoint> points;
    private final double photoCurrent;     // IL
    private final double openCircuitVoltage; // VocG
    private final int unconvergedSamples;

    public Curve(OperatingCondition condition, List<CurvePoint> points, double photoCurrent,
                 double openCircuitVoltage, int unconvergedSamples) {
        this.condition = Objects.requireNonNull(condition, "Operating condition cannot be null");
        Objects.requireNonNull(points, "Curve points cannot be null");
        this.points = List.copyOf(points);
        this.photoCurrent = photoCurrent;
        this.openCircuitVoltage = openCircuitVoltage;
        this.unconvergedSamples = unconvergedSamples;
    }

    public OperatingCondition getCondition() { return condition; }
    public List<CurvePoint> getPoints() { return points; }
    public int size() { return points.size(); }
    public boolean isEmpty() { return points.isEmpty(); }
    public CurvePoint getFirstPoint() { return points.isEmpty() ? null : points.get(0); }
    public CurvePoint getLastPoint() { return points.isEmpty() ? null : points.get(points.size() - 1); }
    public double getPhotoCurrent() { return photoCurrent; }
    public double getOpenCircuitVoltage() { return openCircuitVoltage; }

    /** Number of samples where the Newton iteration stopped without meeting its step tolerance. */
    public int getUnconvergedSamples() { return unconvergedSamples; }

    @Override
    public String toString() {
        return String.format("Curve[%s, %d points, IL=%.4f A, VocG=%.3f V, unconverged=%d]",
                condition, points.size(), photoCurrent, openCircuitVoltage, unconvergedSamples);
    }
}
