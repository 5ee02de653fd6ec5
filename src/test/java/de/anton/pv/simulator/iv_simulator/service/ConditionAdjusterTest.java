package de.anton.pv.simulator.iv_simulator.service;

import de.anton.pv.simulator.iv_simulator.model.DiodeModelParams;
import de.anton.pv.simulator.iv_simulator.model.ModuleSpec;
import de.anton.pv.simulator.iv_simulator.model.SimulationModel;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConditionAdjusterTest {

    private final ModuleSpec spec = SimulationModel.DEFAULT_MODULE;
    private final ConditionAdjuster adjuster = new ConditionAdjuster(spec, new DiodeModelParams(1.3, 0.2, 1000));

    @Test
    void stcReturnsNameplateValues() {
        assertEquals(14.31, adjuster.adjustedIsc(1000, 25), 1e-12);
        assertEquals(52.0, adjuster.adjustedVoc(1000, 25), 1e-12);
    }

    @Test
    void halfIrradianceHalvesIscAndLowersVocLogarithmically() {
        assertEquals(7.155, adjuster.adjustedIsc(500, 25), 1e-9);
        double voc = adjuster.adjustedVoc(500, 25);
        assertEquals(48.666, voc, 1e-2);
        assertTrue(voc < 52.0);
    }

    @Test
    void heatRaisesIscAndLowersVoc() {
        assertEquals(14.31 * (1 + 0.00046 * 50), adjuster.adjustedIsc(1000, 75), 1e-9);
        assertEquals(52.0 * (1 - 0.0026 * 50), adjuster.adjustedVoc(1000, 75), 1e-9);
    }

    @Test
    void zeroIrradianceGivesZeroIscAndFiniteVoc() {
        assertEquals(0.0, adjuster.adjustedIsc(0, 25));
        double voc = adjuster.adjustedVoc(0, 25);
        // G floored at 1 W/m² before the logarithm
        assertEquals(adjuster.adjustedVoc(1, 25), voc, 1e-12);
        assertTrue(Double.isFinite(voc) && voc > 0);
    }

    @Test
    void openCircuitVoltageIsFloored() {
        ModuleSpec hot = ModuleSpec.fromDatasheet(52.0, 14.31, 43.55, 13.55, 2.648, 144, 0.046, -5.0);
        ConditionAdjuster extreme = new ConditionAdjuster(hot, new DiodeModelParams(1.3, 0.2, 1000));

        assertEquals(0.1, extreme.adjustedVoc(1000, 100), 1e-12);
    }
}
