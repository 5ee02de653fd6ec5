package de.anton.pv.simulator.iv_simulator.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Scalar indicators and diagnostics derived from a {@link Curve}.
 */
public final class CurveAnalysis {

    private final CurvePoint maximumPowerPoint;
    private final double shortCircuitCurrent;
    private final double openCircuitVoltage;
    private final double fillFactor;
    private final double efficiency;
    private final List<Diagnostic> diagnostics;

    public CurveAnalysis(CurvePoint maximumPowerPoint, double shortCircuitCurrent, double openCircuitVoltage,
                         double fillFactor, double efficiency, List<Diagnostic> diagnostics) {
        this.maximumPowerPoint = Objects.requireNonNull(maximumPowerPoint, "MPP cannot be null");
        this.shortCircuitCurrent = shortCircuitCurrent;
        this.openCircuitVoltage = openCircuitVoltage;
        this.fillFactor = fillFactor;
        this.efficiency = efficiency;
        this.diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
    }

    public CurvePoint getMaximumPowerPoint() { return maximumPowerPoint; }
    public double getShortCircuitCurrent() { return shortCircuitCurrent; }
    public double getOpenCircuitVoltage() { return openCircuitVoltage; }
    public double getFillFactor() { return fillFactor; }
    public double getEfficiency() { return efficiency; }
    public List<Diagnostic> getDiagnostics() { return diagnostics; }

    public boolean allDiagnosticsPassed() { return diagnostics.stream().allMatch(Diagnostic::isPassed); }

    public List<Diagnostic> getFailedDiagnostics() {
        return diagnostics.stream().filter(d -> !d.isPassed()).collect(Collectors.toList());
    }

    public Optional<Diagnostic> findDiagnostic(String name) {
        return diagnostics.stream().filter(d -> d.getName().equals(name)).findFirst();
    }

    @Override
    public String toString() {
        return String.format("CurveAnalysis[MPP=%s, Isc=%.3f A, Voc=%.3f V, FF=%.4f, eff=%.4f, failed=%d/%d]",
                maximumPowerPoint, shortCircuitCurrent, openCircuitVoltage, fillFactor, efficiency,
                getFailedDiagnostics().size(), diagnostics.size());
    }
}
