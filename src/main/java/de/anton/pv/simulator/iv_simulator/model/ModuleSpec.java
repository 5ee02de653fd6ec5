package de.anton.pv.simulator.iv_simulator.model;

import java.util.Objects;

/**
 * Nameplate data of a PV module, measured at Standard Test Conditions.
 * Thermal coefficients are stored as fractions per °C (datasheets list them in %/°C,
 * see {@link #fromDatasheet}).
 * This class is immutable.
 */
public final class ModuleSpec {

    private final double vocRef;   // Open-circuit voltage (V)
    private final double iscRef;   // Short-circuit current (A)
    private final double vmppRef;  // Voltage at MPP (V)
    private final double imppRef;  // Current at MPP (A)
    private final double area;     // Module area (m²)
    private final int cellsSeries;
    private final double alphaIsc; // fraction/°C, positive
    private final double betaVoc;  // fraction/°C, negative

    /**
     * Constructor for ModuleSpec.
     *
     * @throws IllegalArgumentException if a nameplate value is not finite or not positive,
     *                                  or the cell count is below one.
     */
    public ModuleSpec(double vocRef, double iscRef, double vmppRef, double imppRef,
                      double area, int cellsSeries, double alphaIsc, double betaVoc) {
        if (!isPositive(vocRef) || !isPositive(iscRef) || !isPositive(vmppRef) || !isPositive(imppRef) || !isPositive(area)) {
            throw new IllegalArgumentException(String.format(
                "Module nameplate values must be positive: Voc=%.3f, Isc=%.3f, Vmpp=%.3f, Impp=%.3f, Area=%.3f",
                vocRef, iscRef, vmppRef, imppRef, area));
        }
        if (cellsSeries < 1) {
            throw new IllegalArgumentException("Number of cells in series must be at least 1, was " + cellsSeries);
        }
        if (!Double.isFinite(alphaIsc) || !Double.isFinite(betaVoc)) {
            throw new IllegalArgumentException("Thermal coefficients must be finite.");
        }
        this.vocRef = vocRef;
        this.iscRef = iscRef;
        this.vmppRef = vmppRef;
        this.imppRef = imppRef;
        this.area = area;
        this.cellsSeries = cellsSeries;
        this.alphaIsc = alphaIsc;
        this.betaVoc = betaVoc;
    }

    /**
     * Creates a spec from datasheet values where the thermal coefficients are given in %/°C.
     */
    public static ModuleSpec fromDatasheet(double vocRef, double iscRef, double vmppRef, double imppRef,
                                           double area, int cellsSeries, double alphaIscPercent, double betaVocPercent) {
        return new ModuleSpec(vocRef, iscRef, vmppRef, imppRef, area, cellsSeries,
                              alphaIscPercent / 100.0, betaVocPercent / 100.0);
    }

    private static boolean isPositive(double value) { return Double.isFinite(value) && value > 0; }

    // --- Getters ---
    public double getVocRef() { return vocRef; }
    public double getIscRef() { return iscRef; }
    public double getVmppRef() { return vmppRef; }
    public double getImppRef() { return imppRef; }
    public double getPmppRef() { return vmppRef * imppRef; }
    public double getArea() { return area; }
    public int getCellsSeries() { return cellsSeries; }
    public double getAlphaIsc() { return alphaIsc; }
    public double getBetaVoc() { return betaVoc; }

    @Override
    public String toString() {
        return String.format(
            "ModuleSpec[Voc=%.2f V, Isc=%.2f A, Vmpp=%.2f V, Impp=%.2f A, Area=%.3f m², Cells=%d, α=%.5f/°C, β=%.5f/°C]",
            vocRef, iscRef, vmppRef, imppRef, area, cellsSeries, alphaIsc, betaVoc);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ModuleSpec that = (ModuleSpec) o;
        return Double.compare(that.vocRef, vocRef) == 0 &&
               Double.compare(that.iscRef, iscRef) == 0 &&
               Double.compare(that.vmppRef, vmppRef) == 0 &&
               Double.compare(that.imppRef, imppRef) == 0 &&
               Double.compare(that.area, area) == 0 &&
               cellsSeries == that.cellsSeries &&
               Double.compare(that.alphaIsc, alphaIsc) == 0 &&
               Double.compare(that.betaVoc, betaVoc) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(vocRef, iscRef, vmppRef, imppRef, area, cellsSeries, alphaIsc, betaVoc);
    }
}
