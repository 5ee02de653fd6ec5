package de.anton.pv.simulator.iv_simulator.algorithms;

import de.anton.pv.simulator.iv_simulator.model.DiodeModelParams;
import de.anton.pv.simulator.iv_simulator.model.PhysicalConstants;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SingleDiodeEquationTest {

    @Test
    void modifiedThermalVoltageScalesWithCellsAndIdeality() {
        double vt = PhysicalConstants.thermalVoltage(25);
        assertEquals(0.025693, vt, 1e-5);
        assertEquals(1.3 * vt * 144, SingleDiodeEquation.modifiedThermalVoltage(1.3, 144, 25), 1e-12);
        // cell count is floored at one
        assertEquals(1.3 * vt, SingleDiodeEquation.modifiedThermalVoltage(1.3, 0, 25), 1e-12);
    }

    @Test
    void saturationCurrentPutsIdealCurveThroughOpenCircuit() {
        DiodeModelParams params = new DiodeModelParams(1.3, 0.0, 1000);
        SingleDiodeEquation eq = SingleDiodeEquation.create(params, 144, 25, 14.31, 52.0);

        double f = 0 - eq.getPhotoCurrent()
                + eq.getSaturationCurrent() * (Math.exp(52.0 / eq.getModifiedThermalVoltage()) - 1)
                + 52.0 / eq.getShuntResistance();
        assertEquals(0.0, f, 1e-9);
        assertTrue(eq.getSaturationCurrent() > 0);
    }

    @Test
    void saturationCurrentIsFloored() {
        // shunt current at Voc exceeds IL, numerator negative
        DiodeModelParams params = new DiodeModelParams(1.3, 0.2, 1.0);
        SingleDiodeEquation eq = SingleDiodeEquation.create(params, 144, 25, 14.31, 52.0);

        assertEquals(1e-12, eq.getSaturationCurrent());
    }

    @Test
    void degenerateParametersAreFloored() {
        DiodeModelParams params = new DiodeModelParams(0.0, 0.2, 0.0);
        SingleDiodeEquation eq = SingleDiodeEquation.create(params, 144, 25, 14.31, 52.0);

        assertEquals(1e-9, eq.getModifiedThermalVoltage());
        assertEquals(1e-9, eq.getShuntResistance());
        assertTrue(Double.isFinite(eq.getSaturationCurrent()));
    }
}
