package de.anton.pv.simulator.iv_simulator;

import de.anton.pv.simulator.iv_simulator.controller.AppController;
import de.anton.pv.simulator.iv_simulator.model.SimulationModel;
import de.anton.pv.simulator.iv_simulator.view.MainView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.swing.*;

/**
 * Main application class. Sets up the MVC components and starts the GUI.
 */
public class App {
    private static final Logger logger = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        try {
            UIManager.setLookAndFeel(UIManager.getSystemLookAndFeelClassName());
            logger.debug("System Look and Feel set successfully.");
        } catch (UnsupportedLookAndFeelException | ClassNotFoundException | InstantiationException | IllegalAccessException e) {
            logger.warn("Could not set system look and feel, using default.", e);
        }

        SwingUtilities.invokeLater(App::createAndShowGUI);
    }

    /**
     * Creates the model, view, and controller, links them, and shows the main window.
     * Must be called on the Event Dispatch Thread.
     */
    private static void createAndShowGUI() {
        try {
            logger.info("Creating application components...");
            SimulationModel simulationModel = new SimulationModel();
            MainView mainView = new MainView();
            new AppController(simulationModel, mainView);
            logger.debug("AppController created and linked MVC components.");

            mainView.setLocationRelativeTo(null);
            mainView.setVisible(true);
            logger.info("Application GUI started and shown.");
        } catch (Exception e) {
            logger.error("Critical error during application startup", e);
            JOptionPane.showMessageDialog(null,
                    "Ein kritischer Fehler ist beim Start der Anwendung aufgetreten:\n" +
                            e.getClass().getSimpleName() + ": " + e.getMessage() +
                            "\n\nDie Anwendung wird beendet.",
                    "Startfehler", JOptionPane.ERROR_MESSAGE);
            System.exit(1);
        }
    }
}
