package de.anton.pv.simulator.iv_simulator.model;

import java.util.List;
import java.util.Objects;

/**
 * A set of curves varying one operating variable while the other is held fixed,
 * e.g. I-V curves at several irradiance levels at 25 °C.
 */
public final class CurveFamily {

    public enum Variable {
        IRRADIANCE("Einstrahlung", "W/m²"),
        TEMPERATURE("Temperatur", "°C");

        private final String displayName;
        private final String unit;

        Variable(String displayName, String unit) {
            this.displayName = displayName;
            this.unit = unit;
        }

        public String getUnit() { return unit; }

        /** Value of this variable in the given condition. */
        public double valueOf(OperatingCondition condition) {
            return this == IRRADIANCE ? condition.getIrradiance() : condition.getTemperature();
        }

        @Override
        public String toString() { return displayName; }
    }

    private final Variable variable;
    private final double fixedValue;
    private final List<Curve> curves;

    public CurveFamily(Variable variable, double fixedValue, List<Curve> curves) {
        this.variable = Objects.requireNonNull(variable);
        this.fixedValue = fixedValue;
        this.curves = curves != null ? List.copyOf(curves) : List.of();
    }

    public Variable getVariable() { return variable; }
    /** Value of the variable held constant (temperature for irradiance families and vice versa). */
    public double getFixedValue() { return fixedValue; }
    public List<Curve> getCurves() { return curves; }

    /** Legend label of a member, e.g. "800 W/m²". */
    public String labelFor(Curve curve) {
        return String.format("%.0f %s", variable.valueOf(curve.getCondition()), variable.getUnit());
    }

    @Override
    public String toString() { return "CurveFamily[" + variable.name() + ", " + curves.size() + " curves]"; }
}
