package de.anton.pv.simulator.iv_simulator.view;

import de.anton.pv.simulator.iv_simulator.model.DiodeModelParams;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MainViewTest {

    // Rs as produced by calibration: 0.02 · 0.7
    private final DiodeModelParams calibrated = new DiodeModelParams(1.1 - 0.05, 0.02 * 0.7, 20000 * 1.6);

    @Test
    void roundedDisplayStillMatchesExactParameters() {
        String rs = MainView.formatValue(calibrated.getRs());

        assertNotEquals(calibrated.getRs(), Double.parseDouble(rs.replace(',', '.')));
        assertTrue(MainView.matchesDisplayed(calibrated, MainView.formatValue(calibrated.getN()), " " + rs + " ", MainView.formatValue(calibrated.getRsh())));
    }

    @Test
    void editedFieldNoLongerMatches() {
        String n = MainView.formatValue(calibrated.getN());
        String rsh = MainView.formatValue(calibrated.getRsh());

        assertFalse(MainView.matchesDisplayed(calibrated, n, MainView.formatValue(0.02), rsh));
        assertFalse(MainView.matchesDisplayed(calibrated, n, "", rsh));
        assertFalse(MainView.matchesDisplayed(null, n, MainView.formatValue(calibrated.getRs()), rsh));
    }
}
