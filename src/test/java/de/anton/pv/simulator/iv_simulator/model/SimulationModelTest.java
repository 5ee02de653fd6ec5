package de.anton.pv.simulator.iv_simulator.model;

import de.anton.pv.simulator.iv_simulator.service.SimulationConfiguration;
import de.anton.pv.simulator.iv_simulator.service.SimulationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.beans.PropertyChangeEvent;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SimulationModelTest {

    private SimulationModel model;
    private final List<PropertyChangeEvent> events = new ArrayList<>();

    @BeforeEach
    void setUp() {
        model = new SimulationModel();
        model.addPropertyChangeListener(events::add);
    }

    private List<String> eventNames() {
        List<String> names = new ArrayList<>();
        events.forEach(e -> names.add(e.getPropertyName()));
        return names;
    }

    @Test
    void startsWithDefaults() {
        SimulationConfiguration config = model.toConfiguration();

        assertEquals(SimulationModel.DEFAULT_MODULE, config.moduleSpec());
        assertEquals(SimulationModel.DEFAULT_PARAMS, config.diodeParams());
        assertEquals(OperatingCondition.STC, config.condition());
        assertEquals(SimulationConfiguration.DEFAULT_RESOLUTION, config.resolution());
        assertTrue(config.autoCalibrate());
        assertFalse(model.isResultAvailable());
    }

    @Test
    void settersFireOnlyOnChange() {
        model.setCondition(OperatingCondition.STC);
        assertTrue(events.isEmpty());

        model.setCondition(new OperatingCondition(800, 40));
        model.setResolution(200);
        model.setAutoCalibrate(false);

        assertEquals(List.of("condition", "resolution", "autoCalibrate"), eventNames());
    }

    @Test
    void resolutionIsFloored() {
        model.setResolution(2);

        assertEquals(SimulationConfiguration.MIN_RESOLUTION, model.getResolution());
    }

    @Test
    void calibratedResultReplacesParameters() {
        SimulationService.SimulationResult result = new SimulationService().runSimulation(model.toConfiguration());
        assertTrue(result.wasCalibrated());

        model.updateSimulationResult(result);

        assertEquals(List.of("diodeParams", "simulationResult"), eventNames());
        assertEquals(result.getEffectiveParams(), model.getDiodeParams());
        assertSame(result, model.getLastResult());
    }

    @Test
    void inputChangeClearsResult() {
        model.setAutoCalibrate(false);
        model.updateSimulationResult(new SimulationService().runSimulation(model.toConfiguration()));
        events.clear();

        model.setDiodeParams(new DiodeModelParams(1.2, 0.1, 2000));

        assertFalse(model.isResultAvailable());
        assertEquals(List.of("simulationResult", "diodeParams"), eventNames());
        assertNull(events.get(0).getNewValue());
    }

    @Test
    void rejectsNullInputs() {
        assertThrows(NullPointerException.class, () -> model.setModuleSpec(null));
        assertThrows(NullPointerException.class, () -> model.setDiodeParams(null));
    }
}
