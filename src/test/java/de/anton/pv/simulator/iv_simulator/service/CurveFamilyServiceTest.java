package de.anton.pv.simulator.iv_simulator.service;

import de.anton.pv.simulator.iv_simulator.model.Curve;
import de.anton.pv.simulator.iv_simulator.model.CurveFamily;
import de.anton.pv.simulator.iv_simulator.model.SimulationModel;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CurveFamilyServiceTest {

    private final DiodeModelSolver solver = new DiodeModelSolver(SimulationModel.DEFAULT_MODULE, SimulationModel.DEFAULT_PARAMS, 100);

    @Test
    void irradianceFamilyKeepsRequestOrder() throws InterruptedException {
        CurveFamily family = new CurveFamilyService(3).computeFamily(solver, CurveFamily.Variable.IRRADIANCE,
                CurveFamilyService.IRRADIANCE_LEVELS, CurveFamilyService.FAMILY_TEMPERATURE);

        List<Curve> curves = family.getCurves();
        assertEquals(5, curves.size());
        for (int i = 0; i < curves.size(); i++) {
            assertEquals(CurveFamilyService.IRRADIANCE_LEVELS[i], curves.get(i).getCondition().getIrradiance());
            assertEquals(25.0, curves.get(i).getCondition().getTemperature());
        }
        assertEquals("800 W/m²", family.labelFor(curves.get(1)));
        // lower irradiance, lower short-circuit current
        for (int i = 1; i < curves.size(); i++) {
            assertTrue(curves.get(i).getPhotoCurrent() < curves.get(i - 1).getPhotoCurrent());
        }
    }

    @Test
    void parallelResultEqualsSequentialSolve() throws InterruptedException {
        CurveFamily family = new CurveFamilyService(4).computeFamily(solver, CurveFamily.Variable.TEMPERATURE,
                CurveFamilyService.TEMPERATURE_LEVELS, CurveFamilyService.FAMILY_IRRADIANCE);

        assertEquals(6, family.getCurves().size());
        assertEquals(1000.0, family.getFixedValue());
        for (int i = 0; i < CurveFamilyService.TEMPERATURE_LEVELS.length; i++) {
            Curve expected = solver.computeCurve(1000, CurveFamilyService.TEMPERATURE_LEVELS[i]);
            assertEquals(expected.getPoints(), family.getCurves().get(i).getPoints());
        }
        assertEquals("75 °C", family.labelFor(family.getCurves().get(0)));
    }

    @Test
    void emptyValuesGiveEmptyFamily() throws InterruptedException {
        CurveFamily family = new CurveFamilyService(2).computeFamily(solver, CurveFamily.Variable.IRRADIANCE, new double[0], 25);

        assertTrue(family.getCurves().isEmpty());
    }

    @Test
    void rejectsNonPositiveThreadCount() {
        assertThrows(IllegalArgumentException.class, () -> new CurveFamilyService(0));
    }
}
