package de.anton.pv.simulator.iv_simulator.controller;

import de.anton.pv.simulator.iv_simulator.model.CalibrationResult;
import de.anton.pv.simulator.iv_simulator.model.CurveExcelExporter;
import de.anton.pv.simulator.iv_simulator.model.CurveFamily;
import de.anton.pv.simulator.iv_simulator.model.DiodeModelParams;
import de.anton.pv.simulator.iv_simulator.model.ModuleSpec;
import de.anton.pv.simulator.iv_simulator.model.OperatingCondition;
import de.anton.pv.simulator.iv_simulator.model.SimulationModel;
import de.anton.pv.simulator.iv_simulator.service.ParameterCalibrator;
import de.anton.pv.simulator.iv_simulator.service.SimulationConfiguration;
import de.anton.pv.simulator.iv_simulator.service.SimulationService;
import de.anton.pv.simulator.iv_simulator.view.CurveFamilyDialog;
import de.anton.pv.simulator.iv_simulator.view.MainView;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.swing.*;
import java.awt.*;
import java.beans.PropertyChangeEvent;
import java.beans.PropertyChangeListener;
import java.io.File;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;

/**
 * Controller. Handles UI events, runs the solver pipeline in background workers,
 * updates the model with the results and lets the view follow the model.
 */
public class AppController implements PropertyChangeListener {

    private static final Logger logger = LoggerFactory.getLogger(AppController.class);

    private final SimulationModel simulationModel;
    private final MainView mainView;
    private final SimulationService simulationService;
    private final ParameterCalibrator calibrator;
    private final CurveExcelExporter exporter;

    private JDialog progressDialog;
    private JProgressBar progressBar;
    private JLabel progressLabel;
    private JButton cancelButton;
    private volatile SwingWorker<?, ?> activeWorker = null;

    private CurveFamilyDialog familyDialog = null;

    public AppController(SimulationModel model, MainView view) {
        this.simulationModel = Objects.requireNonNull(model);
        this.mainView = Objects.requireNonNull(view);
        this.simulationService = new SimulationService();
        this.calibrator = new ParameterCalibrator();
        this.exporter = new CurveExcelExporter();
        this.simulationModel.addPropertyChangeListener(this);
        initializeListeners();
        updateViewInitialState();
        createProgressDialog();
        logger.debug("AppController initialized with Services.");
    }

    private void initializeListeners() {
        logger.debug("Initializing UI listeners...");
        mainView.getComputeButton().addActionListener(e -> handleCompute());
        mainView.getCalibrateButton().addActionListener(e -> handleCalibrate());
        mainView.getShowFamiliesButton().addActionListener(e -> handleShowFamilies());
        mainView.getExportExcelButton().addActionListener(e -> handleExportExcel());
        mainView.getAutoCalibrateCheckBox().addActionListener(e -> simulationModel.setAutoCalibrate(mainView.getAutoCalibrateCheckBox().isSelected()));
        logger.debug("UI listeners initialized.");
    }

    private void updateViewInitialState() {
        SwingUtilities.invokeLater(() -> {
            mainView.showInputs(simulationModel.getModuleSpec(), simulationModel.getCondition(), simulationModel.getDiodeParams(), simulationModel.getResolution(), simulationModel.isAutoCalibrate());
            mainView.showResult(null);
            updateButtonStates();
            mainView.setStatusLabel("Bereit. Eingaben prüfen und 'Berechnen' wählen.");
        });
    }

    // --- Progress dialog ---
    private void createProgressDialog() { if (!SwingUtilities.isEventDispatchThread()) { SwingUtilities.invokeLater(this::createProgressDialog); return; } if (progressDialog == null) { progressDialog = new JDialog(mainView, "Verarbeitung", true); progressBar = new JProgressBar(); progressBar.setIndeterminate(true); progressBar.setStringPainted(true); progressLabel = new JLabel("Initialisiere..."); cancelButton = new JButton("Abbrechen"); cancelButton.addActionListener(e -> handleCancelAction()); JPanel panel = new JPanel(new BorderLayout(5, 5)); panel.setBorder(BorderFactory.createEmptyBorder(10, 10, 10, 10)); panel.add(progressLabel, BorderLayout.NORTH); panel.add(progressBar, BorderLayout.CENTER); panel.add(cancelButton, BorderLayout.SOUTH); progressDialog.setContentPane(panel); progressDialog.setDefaultCloseOperation(WindowConstants.DO_NOTHING_ON_CLOSE); progressDialog.pack(); } }
    private void handleCancelAction() { SwingWorker<?, ?> workerToCancel = this.activeWorker; if (workerToCancel != null && !workerToCancel.isDone()) { logger.info("Cancel requested for worker {}", workerToCancel.getClass().getSimpleName()); workerToCancel.cancel(true); mainView.setStatusLabel("Vorgang wird abgebrochen..."); } hideProgressDialog(); }
    private void showProgressDialog(String message, SwingWorker<?, ?> worker) { createProgressDialog(); this.activeWorker = worker; progressBar.setString(message); progressLabel.setText(message); cancelButton.setEnabled(true); progressDialog.pack(); progressDialog.setLocationRelativeTo(mainView); mainView.setBusyState(true); if (!worker.isDone()) { progressDialog.setVisible(true); } }
    private void hideProgressDialog() { if (!SwingUtilities.isEventDispatchThread()) { SwingUtilities.invokeLater(this::hideProgressDialog); return; } if (progressDialog != null && progressDialog.isVisible()) { progressDialog.setVisible(false); } this.activeWorker = null; mainView.setBusyState(false); updateButtonStates(); }

    /** Reads all input fields into the model. Returns {@code false} and shows an error dialog on invalid input. */
    private boolean applyInputsToModel() {
        try {
            ModuleSpec spec = ModuleSpec.fromDatasheet(parse(mainView.getVocRefTextField(), "Voc"), parse(mainView.getIscRefTextField(), "Isc"), parse(mainView.getVmppRefTextField(), "Vmpp"), parse(mainView.getImppRefTextField(), "Impp"),
                    parse(mainView.getAreaTextField(), "Fläche"), parseInt(mainView.getCellsTextField(), "Zellen"), parse(mainView.getAlphaIscTextField(), "α Isc"), parse(mainView.getBetaVocTextField(), "β Voc"));
            OperatingCondition condition = new OperatingCondition(parse(mainView.getIrradianceTextField(), "Einstrahlung"), parse(mainView.getTemperatureTextField(), "Temperatur"));
            // untouched fields keep the exact model values instead of their rounded display text
            DiodeModelParams params = mainView.isShowingDiodeParams(simulationModel.getDiodeParams()) ? simulationModel.getDiodeParams()
                    : new DiodeModelParams(parse(mainView.getNTextField(), "n"), parse(mainView.getRsTextField(), "Rs"), parse(mainView.getRshTextField(), "Rsh"));
            int resolution = parseInt(mainView.getResolutionTextField(), "Auflösung");
            simulationModel.setModuleSpec(spec); simulationModel.setCondition(condition); simulationModel.setDiodeParams(params); simulationModel.setResolution(resolution);
            simulationModel.setAutoCalibrate(mainView.getAutoCalibrateCheckBox().isSelected());
            return true;
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid input: {}", e.getMessage());
            showErrorDialogOnEDT("Ungültige Eingabe:\n" + e.getMessage());
            return false;
        }
    }

    private static double parse(JTextField field, String name) { String text = field.getText() == null ? "" : field.getText().trim().replace(',', '.'); try { return Double.parseDouble(text); } catch (NumberFormatException e) { throw new IllegalArgumentException("'" + name + "' ist keine Zahl: " + text, e); } }
    private static int parseInt(JTextField field, String name) { String text = field.getText() == null ? "" : field.getText().trim(); try { return Integer.parseInt(text); } catch (NumberFormatException e) { throw new IllegalArgumentException("'" + name + "' ist keine ganze Zahl: " + text, e); } }

    private void handleCompute() {
        logger.debug("handleCompute triggered.");
        if (!applyInputsToModel()) return;
        SimulationConfiguration config = simulationModel.toConfiguration();
        mainView.setStatusLabel("Berechne Kennlinie...");
        SwingWorker<SimulationService.SimulationResult, Void> worker = new SwingWorker<>() {
            @Override protected SimulationService.SimulationResult doInBackground() { return simulationService.runSimulation(config); }
            @Override protected void done() {
                hideProgressDialog();
                try {
                    SimulationService.SimulationResult result = get();
                    simulationModel.updateSimulationResult(result);
                    mainView.setStatusLabel(result.wasCalibrated() ? "Berechnung abgeschlossen (Parameter kalibriert)." : "Berechnung abgeschlossen.");
                } catch (CancellationException e) { logger.info("Simulation cancelled."); mainView.setStatusLabel("Berechnung abgebrochen.");
                } catch (InterruptedException e) { Thread.currentThread().interrupt(); mainView.setStatusLabel("Berechnung unterbrochen.");
                } catch (ExecutionException e) { handleWorkerFailure("Berechnung", e); }
            }
        };
        worker.execute();
        showProgressDialog("Berechne Kennlinie...", worker);
    }

    private void handleCalibrate() {
        logger.debug("handleCalibrate triggered.");
        if (!applyInputsToModel()) return;
        OperatingCondition condition = simulationModel.getCondition();
        if (!condition.isNearStc()) { showWarningDialogOnEDT("Kalibrierung ist nur nahe STC (1000 W/m², 25 °C) möglich.\nAktuell: " + condition); return; }
        ModuleSpec spec = simulationModel.getModuleSpec(); DiodeModelParams params = simulationModel.getDiodeParams();
        mainView.setStatusLabel("Kalibriere Diodenparameter...");
        SwingWorker<CalibrationResult, Void> worker = new SwingWorker<>() {
            @Override protected CalibrationResult doInBackground() { return calibrator.calibrate(spec, params, condition); }
            @Override protected void done() {
                hideProgressDialog();
                try {
                    CalibrationResult result = get();
                    if (result.isAdopted()) { simulationModel.setDiodeParams(result.getParameters()); mainView.setStatusLabel(String.format("Kalibriert: MPP-Abstand %.3f -> %.3f", result.getInitialDistance(), result.getBestDistance())); }
                    else { mainView.setStatusLabel("Kalibrierung ohne Verbesserung, Parameter unverändert."); }
                } catch (CancellationException e) { mainView.setStatusLabel("Kalibrierung abgebrochen.");
                } catch (InterruptedException e) { Thread.currentThread().interrupt(); mainView.setStatusLabel("Kalibrierung unterbrochen.");
                } catch (ExecutionException e) { handleWorkerFailure("Kalibrierung", e); }
            }
        };
        worker.execute();
        showProgressDialog("Kalibriere Diodenparameter...", worker);
    }

    private void handleShowFamilies() {
        logger.debug("handleShowFamilies triggered.");
        if (!applyInputsToModel()) return;
        SimulationConfiguration config = simulationModel.toConfiguration();
        mainView.setStatusLabel("Berechne Kennlinienscharen...");
        SwingWorker<List<CurveFamily>, Void> worker = new SwingWorker<>() {
            @Override protected List<CurveFamily> doInBackground() throws InterruptedException { return simulationService.computeStandardFamilies(config); }
            @Override protected void done() {
                hideProgressDialog();
                try { simulationModel.updateCurveFamilies(get()); mainView.setStatusLabel("Kennlinienscharen berechnet.");
                } catch (CancellationException e) { mainView.setStatusLabel("Berechnung der Kennlinienscharen abgebrochen.");
                } catch (InterruptedException e) { Thread.currentThread().interrupt(); mainView.setStatusLabel("Berechnung unterbrochen.");
                } catch (ExecutionException e) { handleWorkerFailure("Kennlinienscharen", e); }
            }
        };
        worker.execute();
        showProgressDialog("Berechne Kennlinienscharen...", worker);
    }

    private void handleExportExcel() {
        logger.debug("handleExportExcel triggered.");
        SimulationService.SimulationResult result = simulationModel.getLastResult();
        if (result == null) { showWarningDialogOnEDT("Keine Kennlinie vorhanden. Bitte zuerst berechnen."); return; }
        File file = mainView.chooseExportFile();
        if (file == null) return;
        String path = file.getAbsolutePath(); if (!path.toLowerCase().endsWith(".xlsx")) path += ".xlsx";
        final String targetPath = path;
        mainView.setStatusLabel("Exportiere nach " + targetPath + "...");
        SwingWorker<Void, Void> worker = new SwingWorker<>() {
            @Override protected Void doInBackground() throws Exception { exporter.exportResult(result, targetPath); return null; }
            @Override protected void done() {
                hideProgressDialog();
                try { get(); mainView.setStatusLabel("Export abgeschlossen: " + targetPath);
                } catch (CancellationException e) { mainView.setStatusLabel("Export abgebrochen.");
                } catch (InterruptedException e) { Thread.currentThread().interrupt(); mainView.setStatusLabel("Export unterbrochen.");
                } catch (ExecutionException e) { handleWorkerFailure("Export", e); }
            }
        };
        worker.execute();
        showProgressDialog("Exportiere Kennlinie...", worker);
    }

    private void handleWorkerFailure(String task, ExecutionException e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        logger.error("{} failed: {}", task, cause.getMessage(), cause);
        mainView.setStatusLabel(task + " fehlgeschlagen.");
        showErrorDialogOnEDT(task + " fehlgeschlagen:\n" + cause.getClass().getSimpleName() + ": " + cause.getMessage());
    }

    @Override
    public void propertyChange(PropertyChangeEvent evt) {
        String propertyName = evt.getPropertyName();
        logger.trace("Model property changed: {}", propertyName);
        SwingUtilities.invokeLater(() -> {
            switch (propertyName) {
                case "diodeParams": mainView.showDiodeParams(simulationModel.getDiodeParams()); break;
                case "simulationResult": mainView.showResult(simulationModel.getLastResult()); updateButtonStates(); break;
                case "curveFamilies": showFamilyDialog(simulationModel.getCurveFamilies()); break;
                default: break;
            }
        });
    }

    private void showFamilyDialog(List<CurveFamily> families) {
        if (families == null || families.isEmpty()) return;
        if (familyDialog == null) { familyDialog = new CurveFamilyDialog(mainView); }
        familyDialog.updateFamilies(families);
        familyDialog.setLocationRelativeTo(mainView);
        familyDialog.setVisible(true);
    }

    private void updateButtonStates() { mainView.getExportExcelButton().setEnabled(simulationModel.isResultAvailable()); }

    private void showErrorDialogOnEDT(String message) { SwingUtilities.invokeLater(() -> JOptionPane.showMessageDialog(mainView, message, "Fehler", JOptionPane.ERROR_MESSAGE)); }
    private void showWarningDialogOnEDT(String message) { SwingUtilities.invokeLater(() -> JOptionPane.showMessageDialog(mainView, message, "Hinweis", JOptionPane.WARNING_MESSAGE)); }
}
