package de.anton.pv.simulator.iv_simulator.service;

import de.anton.pv.simulator.iv_simulator.model.Curve;
import de.anton.pv.simulator.iv_simulator.model.CurveAnalysis;
import de.anton.pv.simulator.iv_simulator.model.CurvePoint;
import de.anton.pv.simulator.iv_simulator.model.Diagnostic;
import de.anton.pv.simulator.iv_simulator.model.ModuleSpec;
import de.anton.pv.simulator.iv_simulator.model.OperatingCondition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reduces a curve to MPP, fill factor and efficiency and runs the advisory sanity checks.
 * None of the checks stops curve production; failures are only reported.
 */
public class CurveAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(CurveAnalyzer.class);

    public static final String DIAG_SHORT_CIRCUIT = "Kurzschlussstrom";
    public static final String DIAG_OPEN_CIRCUIT = "Leerlaufstrom";
    public static final String DIAG_MONOTONIC = "Monotonie";
    public static final String DIAG_MPP_BOUNDS = "MPP-Grenzen";
    public static final String DIAG_VMPP_NAMEPLATE = "Vmpp (Datenblatt)";
    public static final String DIAG_IMPP_NAMEPLATE = "Impp (Datenblatt)";
    public static final String DIAG_CONVERGENCE = "Newton-Konvergenz";

    private static final double MIN_FILL_FACTOR_DENOMINATOR = 1e-9;
    private static final double ISC_ABS_TOLERANCE = 0.5;
    private static final double ISC_REL_TOLERANCE = 0.05;
    private static final double OPEN_CIRCUIT_ABS_TOLERANCE = 0.3;
    private static final double OPEN_CIRCUIT_REL_TOLERANCE = 0.03;
    private static final double MONOTONIC_TOLERANCE = 1e-3;
    private static final double NAMEPLATE_REL_TOLERANCE = 0.05;

    /**
     * Finds the point of maximal power; the first one wins on ties.
     * Returns a zero point for an empty list.
     */
    public static CurvePoint findMaximumPowerPoint(List<CurvePoint> points) {
        CurvePoint best = null;
        for (CurvePoint p : points) {
            if (best == null || p.getPower() > best.getPower()) best = p;
        }
        return best != null ? best : new CurvePoint(0, 0);
    }

    /**
     * Analyzes a curve against the module's nameplate data.
     *
     * @param curve      curve produced by {@link DiodeModelSolver}
     * @param moduleSpec nameplate reference (area for efficiency, Vmpp/Impp for the near-STC checks)
     */
    public CurveAnalysis analyze(Curve curve, ModuleSpec moduleSpec) {
        Objects.requireNonNull(curve, "Curve cannot be null");
        Objects.requireNonNull(moduleSpec, "ModuleSpec cannot be null");

        OperatingCondition condition = curve.getCondition();
        double isc = curve.getPhotoCurrent();
        double voc = curve.getOpenCircuitVoltage();
        CurvePoint mpp = findMaximumPowerPoint(curve.getPoints());

        double fillFactor = mpp.getPower() / Math.max(voc * isc, MIN_FILL_FACTOR_DENOMINATOR);
        double incidentPower = condition.getIrradiance() * moduleSpec.getArea();
        double efficiency = incidentPower > 0 ? mpp.getPower() / incidentPower : 0;

        List<Diagnostic> diagnostics = runDiagnostics(curve, moduleSpec, mpp, isc, voc);
        CurveAnalysis analysis = new CurveAnalysis(mpp, isc, voc, fillFactor, efficiency, diagnostics);

        List<Diagnostic> failed = analysis.getFailedDiagnostics();
        if (!failed.isEmpty()) {
            logger.warn("{} of {} diagnostics failed for {}: {}", failed.size(), diagnostics.size(), condition, failed);
        }
        logger.debug("Analysis for {}: {}", condition, analysis);
        return analysis;
    }

    private List<Diagnostic> runDiagnostics(Curve curve, ModuleSpec spec, CurvePoint mpp, double isc, double voc) {
        List<Diagnostic> result = new ArrayList<>();
        if (curve.isEmpty()) {
            result.add(new Diagnostic(DIAG_SHORT_CIRCUIT, false, "Kennlinie enthält keine Punkte"));
            return result;
        }

        double iAtZero = curve.getFirstPoint().getCurrent();
        double iscTolerance = Math.max(ISC_ABS_TOLERANCE, ISC_REL_TOLERANCE * isc);
        result.add(new Diagnostic(DIAG_SHORT_CIRCUIT, Math.abs(iAtZero - isc) <= iscTolerance,
                String.format("I(0 V) = %.3f A, Isc' = %.3f A (Toleranz ±%.3f A)", iAtZero, isc, iscTolerance)));

        double iAtEnd = curve.getLastPoint().getCurrent();
        double endTolerance = Math.max(OPEN_CIRCUIT_ABS_TOLERANCE, OPEN_CIRCUIT_REL_TOLERANCE * isc);
        result.add(new Diagnostic(DIAG_OPEN_CIRCUIT, Math.abs(iAtEnd) <= endTolerance,
                String.format("I(%.2f V) = %.3f A (Toleranz ±%.3f A)", curve.getLastPoint().getVoltage(), iAtEnd, endTolerance)));

        result.add(checkMonotonic(curve.getPoints()));

        boolean inside = mpp.getVoltage() > 0 && mpp.getVoltage() < voc && mpp.getCurrent() > 0 && mpp.getCurrent() < isc;
        result.add(new Diagnostic(DIAG_MPP_BOUNDS, inside,
                String.format("MPP (%.2f V, %.3f A) innerhalb (0, %.2f V) × (0, %.3f A)", mpp.getVoltage(), mpp.getCurrent(), voc, isc)));

        if (curve.getCondition().isNearStc()) {
            result.add(nameplateCheck(DIAG_VMPP_NAMEPLATE, mpp.getVoltage(), spec.getVmppRef(), "V"));
            result.add(nameplateCheck(DIAG_IMPP_NAMEPLATE, mpp.getCurrent(), spec.getImppRef(), "A"));
        }

        int unconverged = curve.getUnconvergedSamples();
        result.add(new Diagnostic(DIAG_CONVERGENCE, unconverged == 0,
                unconverged == 0 ? "Alle Punkte konvergiert" : unconverged + " von " + curve.size() + " Punkten nicht konvergiert"));
        return result;
    }

    private Diagnostic checkMonotonic(List<CurvePoint> points) {
        for (int i = 1; i < points.size(); i++) {
            double rise = points.get(i).getCurrent() - points.get(i - 1).getCurrent();
            if (rise > MONOTONIC_TOLERANCE) {
                return new Diagnostic(DIAG_MONOTONIC, false,
                        String.format("Strom steigt bei %.2f V um %.4f A", points.get(i).getVoltage(), rise));
            }
        }
        return new Diagnostic(DIAG_MONOTONIC, true, "Strom fällt monoton mit der Spannung");
    }

    private Diagnostic nameplateCheck(String name, double actual, double reference, String unit) {
        double deviation = Math.abs(actual - reference) / reference;
        return new Diagnostic(name, deviation <= NAMEPLATE_REL_TOLERANCE,
                String.format("Modell %.3f %s, Datenblatt %.3f %s (Abweichung %.1f %%)", actual, unit, reference, unit, deviation * 100));
    }
}
