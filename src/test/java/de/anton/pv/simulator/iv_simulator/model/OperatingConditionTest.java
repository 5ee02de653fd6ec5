package de.anton.pv.simulator.iv_simulator.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OperatingConditionTest {

    @Test
    void nearStcWindow() {
        assertTrue(OperatingCondition.STC.isNearStc());
        assertTrue(new OperatingCondition(1020, 26).isNearStc());
        assertTrue(new OperatingCondition(980, 24).isNearStc());
        assertFalse(new OperatingCondition(1021, 25).isNearStc());
        assertFalse(new OperatingCondition(1000, 26.5).isNearStc());
        assertFalse(new OperatingCondition(500, 25).isNearStc());
    }

    @Test
    void rejectsNegativeOrNonFiniteValues() {
        assertThrows(IllegalArgumentException.class, () -> new OperatingCondition(-1, 25));
        assertThrows(IllegalArgumentException.class, () -> new OperatingCondition(Double.NaN, 25));
        assertThrows(IllegalArgumentException.class, () -> new OperatingCondition(1000, Double.POSITIVE_INFINITY));
    }

    @Test
    void zeroIrradianceIsAllowed() {
        OperatingCondition dark = new OperatingCondition(0, -10);

        assertEquals(0.0, dark.getIrradiance());
        assertEquals(-10.0, dark.getTemperature());
    }
}
