package de.anton.pv.simulator.iv_simulator.view;

import de.anton.pv.simulator.iv_simulator.model.CurveFamily;

import org.jfree.chart.ChartPanel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.swing.*;
import java.awt.*;
import java.util.List;

/**
 * Dialog showing the comparison families (irradiance and temperature) side by side.
 */
public class CurveFamilyDialog extends JDialog {

    private static final Logger logger = LoggerFactory.getLogger(CurveFamilyDialog.class);

    private final JPanel chartContainer;

    public CurveFamilyDialog(Frame owner) {
        super(owner, "Kennlinienscharen", false);
        chartContainer = new JPanel(new GridLayout(1, 0, 5, 5));
        setContentPane(chartContainer);
        setSize(1300, 520); setMinimumSize(new Dimension(700, 350)); setLocationRelativeTo(owner);
    }

    public void updateFamilies(List<CurveFamily> families) {
        if (!SwingUtilities.isEventDispatchThread()) { SwingUtilities.invokeLater(() -> updateFamilies(families)); return; }
        chartContainer.removeAll();
        if (families != null) {
            for (CurveFamily family : families) {
                ChartPanel panel = new ChartPanel(CurveChartFactory.createFamilyChart(family));
                panel.setMouseWheelEnabled(true);
                chartContainer.add(panel);
            }
        }
        logger.debug("Family dialog updated with {} charts.", chartContainer.getComponentCount());
        chartContainer.revalidate(); chartContainer.repaint();
    }
}
