package de.anton.pv.simulator.iv_simulator.service;

import de.anton.pv.simulator.iv_simulator.model.DiodeModelParams;
import de.anton.pv.simulator.iv_simulator.model.OperatingCondition;
import de.anton.pv.simulator.iv_simulator.model.SimulationModel;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SimulationConfigurationTest {

    @Test
    void lowResolutionIsRaisedToMinimum() {
        SimulationConfiguration config = new SimulationConfiguration(SimulationModel.DEFAULT_MODULE,
                SimulationModel.DEFAULT_PARAMS, OperatingCondition.STC, 3, false);

        assertEquals(SimulationConfiguration.MIN_RESOLUTION, config.resolution());
    }

    @Test
    void withDiodeParamsKeepsOtherFields() {
        SimulationConfiguration config = new SimulationConfiguration(SimulationModel.DEFAULT_MODULE,
                SimulationModel.DEFAULT_PARAMS, new OperatingCondition(800, 40), 200, true);
        DiodeModelParams other = new DiodeModelParams(1.2, 0.1, 5000);

        SimulationConfiguration changed = config.withDiodeParams(other);

        assertEquals(other, changed.diodeParams());
        assertEquals(config.moduleSpec(), changed.moduleSpec());
        assertEquals(config.condition(), changed.condition());
        assertEquals(200, changed.resolution());
        assertTrue(changed.autoCalibrate());
    }

    @Test
    void rejectsMissingInputs() {
        assertThrows(NullPointerException.class, () -> new SimulationConfiguration(null,
                SimulationModel.DEFAULT_PARAMS, OperatingCondition.STC, 140, false));
        assertThrows(NullPointerException.class, () -> new SimulationConfiguration(SimulationModel.DEFAULT_MODULE,
                SimulationModel.DEFAULT_PARAMS, null, 140, false));
    }
}
