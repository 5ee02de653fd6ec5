package de.anton.pv.simulator.iv_simulator.service;

import de.anton.pv.simulator.iv_simulator.model.Curve;
import de.anton.pv.simulator.iv_simulator.model.CurvePoint;
import de.anton.pv.simulator.iv_simulator.model.DiodeModelParams;
import de.anton.pv.simulator.iv_simulator.model.ModuleSpec;
import de.anton.pv.simulator.iv_simulator.model.OperatingCondition;
import de.anton.pv.simulator.iv_simulator.model.SimulationModel;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DiodeModelSolverTest {

    private final ModuleSpec spec = SimulationModel.DEFAULT_MODULE;
    private final DiodeModelSolver solver = new DiodeModelSolver(spec, new DiodeModelParams(1.3, 0.2, 1000), 140);

    @Test
    void stcCurveHasExpectedShape() {
        Curve curve = solver.computeCurve(OperatingCondition.STC);

        assertEquals(141, curve.size());
        assertEquals(0.0, curve.getFirstPoint().getVoltage());
        assertEquals(52.0 * 1.02, curve.getLastPoint().getVoltage(), 1e-9);
        assertEquals(14.307, curve.getFirstPoint().getCurrent(), 1e-3);
        assertEquals(0.0, curve.getLastPoint().getCurrent());
        assertEquals(14.31, curve.getPhotoCurrent(), 1e-12);
        assertEquals(52.0, curve.getOpenCircuitVoltage(), 1e-12);
        assertEquals(0, curve.getUnconvergedSamples());
    }

    @Test
    void currentDecreasesWithVoltage() {
        List<CurvePoint> points = solver.computeCurve(OperatingCondition.STC).getPoints();

        for (int i = 1; i < points.size(); i++) {
            assertTrue(points.get(i).getCurrent() <= points.get(i - 1).getCurrent() + 1e-3,
                    "current rises at " + points.get(i).getVoltage() + " V");
            assertTrue(points.get(i).getCurrent() >= 0);
        }
    }

    @Test
    void stepIsUniform() {
        List<CurvePoint> points = solver.computeCurve(1000, 25).getPoints();
        double dV = 52.0 * 1.02 / 140;

        for (int i = 0; i < points.size(); i++) {
            assertEquals(i * dV, points.get(i).getVoltage(), 1e-9);
            assertEquals(points.get(i).getVoltage() * points.get(i).getCurrent(), points.get(i).getPower(), 1e-12);
        }
    }

    @Test
    void voltageRangeUsesNameplateVocAtLowIrradiance() {
        Curve curve = solver.computeCurve(200, 25);

        assertTrue(curve.getOpenCircuitVoltage() < 52.0);
        assertEquals(52.0 * 1.02, curve.getLastPoint().getVoltage(), 1e-9);
    }

    @Test
    void sameInputsGiveIdenticalCurves() {
        Curve first = solver.computeCurve(800, 40);
        Curve second = solver.computeCurve(800, 40);

        assertEquals(first.getPoints(), second.getPoints());
    }

    @Test
    void darkCurveIsZero() {
        Curve curve = solver.computeCurve(0, 25);

        assertEquals(141, curve.size());
        for (CurvePoint p : curve.getPoints()) {
            assertEquals(0.0, p.getCurrent());
            assertTrue(Double.isFinite(p.getVoltage()));
        }
    }

    @Test
    void resolutionControlsSampleCount() {
        DiodeModelSolver coarse = new DiodeModelSolver(spec, new DiodeModelParams(1.3, 0.2, 1000), 10);

        assertEquals(11, coarse.computeCurve(OperatingCondition.STC).size());
    }

    @Test
    void lightweightMppMatchesCurveMpp() {
        CurvePoint fromCurve = CurveAnalyzer.findMaximumPowerPoint(solver.computeCurve(1000, 25).getPoints());
        CurvePoint fromSweep = solver.findMaximumPowerPoint(1000, 25);

        assertEquals(fromCurve, fromSweep);
        assertEquals(493.4, fromSweep.getPower(), 0.5);
        assertEquals(39.02, fromSweep.getVoltage(), 0.01);
    }

    @Test
    void defaultCurveIsFinite() {
        Curve curve = solver.computeCurve(OperatingCondition.STC);

        assertEquals(141, curve.size());
        for (CurvePoint p : curve.getPoints()) {
            assertTrue(Double.isFinite(p.getVoltage()) && Double.isFinite(p.getCurrent()) && Double.isFinite(p.getPower()));
        }
    }

    @Test
    void unconvergedSamplesAreCountedAndStayBounded() {
        ModuleSpec oneCell = new ModuleSpec(0.6, 9, 0.5, 8.5, 0.025, 1, 0.0005, -0.003);
        Curve curve = new DiodeModelSolver(oneCell, new DiodeModelParams(1.0, 1.0, 1000), 140).computeCurve(OperatingCondition.STC);

        assertEquals(141, curve.size());
        assertEquals(4, curve.getUnconvergedSamples());
        for (CurvePoint p : curve.getPoints()) {
            assertTrue(Double.isFinite(p.getCurrent()));
            assertTrue(p.getCurrent() >= 0 && p.getCurrent() <= 1.2 * 9);
        }
    }

    @Test
    void nonFiniteConditionFailsBeforeSweeping() {
        assertThrows(IllegalArgumentException.class, () -> solver.computeCurve(1000, Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> solver.computeCurve(Double.POSITIVE_INFINITY, 25));
        assertThrows(IllegalArgumentException.class, () -> solver.findMaximumPowerPoint(Double.NaN, 25));
        assertThrows(IllegalArgumentException.class, () -> solver.findMaximumPowerPoint(1000, Double.NEGATIVE_INFINITY));
    }
}
