package de.anton.pv.simulator.iv_simulator.model;

import java.util.Objects;

/**
 * Tunable electrical parameters of the single-diode model: ideality factor n,
 * series resistance Rs and shunt resistance Rsh.
 * <p>
 * Physically implausible but finite values are accepted; the solver guards its ratios
 * with floors instead of rejecting them.
 */
public final class DiodeModelParams {

    private final double n;
    private final double rs;  // Ohm
    private final double rsh; // Ohm

    public DiodeModelParams(double n, double rs, double rsh) {
        if (!Double.isFinite(n) || !Double.isFinite(rs) || !Double.isFinite(rsh)) {
            throw new IllegalArgumentException(String.format(
                "Diode parameters must be finite: n=%s, Rs=%s, Rsh=%s", n, rs, rsh));
        }
        this.n = n;
        this.rs = rs;
        this.rsh = rsh;
    }

    public double getN() { return n; }
    public double getRs() { return rs; }
    public double getRsh() { return rsh; }

    public DiodeModelParams withN(double newN) { return new DiodeModelParams(newN, rs, rsh); }
    public DiodeModelParams withRs(double newRs) { return new DiodeModelParams(n, newRs, rsh); }
    public DiodeModelParams withRsh(double newRsh) { return new DiodeModelParams(n, rs, newRsh); }

    @Override
    public String toString() {
        return String.format("DiodeModelParams[n=%.4f, Rs=%.4f Ω, Rsh=%.1f Ω]", n, rs, rsh);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DiodeModelParams that = (DiodeModelParams) o;
        return Double.compare(that.n, n) == 0 &&
               Double.compare(that.rs, rs) == 0 &&
               Double.compare(that.rsh, rsh) == 0;
    }

    @Override
    public int hashCode() { return Objects.hash(n, rs, rsh); }
}
