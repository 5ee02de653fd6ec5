package de.anton.pv.simulator.iv_simulator.view;

import de.anton.pv.simulator.iv_simulator.model.CurveAnalysis;
import de.anton.pv.simulator.iv_simulator.model.CurvePoint;
import de.anton.pv.simulator.iv_simulator.model.Diagnostic;
import de.anton.pv.simulator.iv_simulator.model.DiodeModelParams;
import de.anton.pv.simulator.iv_simulator.model.ModuleSpec;
import de.anton.pv.simulator.iv_simulator.model.OperatingCondition;
import de.anton.pv.simulator.iv_simulator.service.SimulationService;

import org.jfree.chart.ChartPanel;

import javax.swing.*;
import javax.swing.border.EmptyBorder;
import javax.swing.border.EtchedBorder;
import java.awt.*;
import java.io.File;
import java.text.DecimalFormat;
import java.util.List;

/**
 * Main GUI View. Input fields for the module datasheet, the operating condition and the
 * diode parameters; I-V and P-V charts; indicators and diagnostics; export and family buttons.
 */
public class MainView extends JFrame {

    private static final DecimalFormat FMT_POWER = new DecimalFormat("#,##0.0");
    private static final DecimalFormat FMT_PERCENT = new DecimalFormat("#0.00");
    private static final DecimalFormat FMT_VALUE = new DecimalFormat("#0.####");

    // --- UI Components ---
    private JTextField txtVocRef, txtIscRef, txtVmppRef, txtImppRef, txtArea, txtCells, txtAlphaIsc, txtBetaVoc;
    private JTextField txtIrradiance, txtTemperature;
    private JTextField txtN, txtRs, txtRsh, txtResolution;
    private JCheckBox chkAutoCalibrate;
    private JButton btnCompute, btnCalibrate, btnShowFamilies, btnExportExcel;
    private JFileChooser exportChooser;
    private ChartPanel ivChartPanel, pvChartPanel;
    private JLabel lblPmpp, lblEfficiency, lblFillFactor, lblMpp;
    private DefaultListModel<String> diagnosticsListModel;
    private JLabel lblStatus;
    private JPanel pnlInputs;

    public MainView() {
        initComponents();
        layoutComponents();
        setupWindow();
    }

    private void initComponents() {
        txtVocRef = field(7, "Leerlaufspannung bei STC (V)"); txtIscRef = field(7, "Kurzschlussstrom bei STC (A)"); txtVmppRef = field(7, "MPP-Spannung bei STC (V)"); txtImppRef = field(7, "MPP-Strom bei STC (A)");
        txtArea = field(7, "Modulfläche (m²)"); txtCells = field(7, "Zellen in Serie"); txtAlphaIsc = field(7, "Temperaturkoeffizient Isc (%/°C)"); txtBetaVoc = field(7, "Temperaturkoeffizient Voc (%/°C)");
        txtIrradiance = field(7, "Einstrahlung (W/m²)"); txtTemperature = field(7, "Modultemperatur (°C)");
        txtN = field(7, "Idealitätsfaktor n (1..2)"); txtRs = field(7, "Serienwiderstand Rs (Ω)"); txtRsh = field(7, "Parallelwiderstand Rsh (Ω)"); txtResolution = field(7, "Anzahl Spannungsschritte (50..400)");
        chkAutoCalibrate = new JCheckBox("Automatisch kalibrieren (nahe STC)", true);
        btnCompute = new JButton("Berechnen"); btnCalibrate = new JButton("Kalibrieren"); btnCalibrate.setToolTipText("Passt n, Rs und Rsh an den MPP des Datenblatts an (nur nahe STC)");
        btnShowFamilies = new JButton("Kennlinienscharen..."); btnExportExcel = new JButton("Export Kennlinie...");
        exportChooser = new JFileChooser(); exportChooser.setDialogTitle("Kennlinie exportieren"); exportChooser.setFileFilter(new javax.swing.filechooser.FileNameExtensionFilter("Excel Dateien (*.xlsx)", "xlsx"));
        ivChartPanel = new ChartPanel(null); ivChartPanel.setPreferredSize(new Dimension(480, 340));
        pvChartPanel = new ChartPanel(null); pvChartPanel.setPreferredSize(new Dimension(480, 340));
        lblPmpp = new JLabel("-"); lblEfficiency = new JLabel("-"); lblFillFactor = new JLabel("-"); lblMpp = new JLabel("-");
        diagnosticsListModel = new DefaultListModel<>();
        lblStatus = new JLabel("Initialisierung...");
    }

    private JTextField field(int columns, String tooltip) { JTextField f = new JTextField(columns); f.setToolTipText(tooltip); return f; }

    private void layoutComponents() {
        Container contentPane = getContentPane(); contentPane.setLayout(new BorderLayout(5, 5));
        pnlInputs = new JPanel(); pnlInputs.setLayout(new BoxLayout(pnlInputs, BoxLayout.Y_AXIS)); pnlInputs.setBorder(new EmptyBorder(5, 10, 5, 10));
        pnlInputs.add(inputGroup("Modul (Datenblatt, STC)", new String[]{"Voc (V):", "Isc (A):", "Vmpp (V):", "Impp (A):", "Fläche (m²):", "Zellen:", "α Isc (%/°C):", "β Voc (%/°C):"},
                new JTextField[]{txtVocRef, txtIscRef, txtVmppRef, txtImppRef, txtArea, txtCells, txtAlphaIsc, txtBetaVoc}));
        pnlInputs.add(inputGroup("Betriebsbedingungen", new String[]{"Einstrahlung (W/m²):", "Temperatur (°C):"}, new JTextField[]{txtIrradiance, txtTemperature}));
        pnlInputs.add(inputGroup("Diodenmodell", new String[]{"n:", "Rs (Ω):", "Rsh (Ω):", "Auflösung:"}, new JTextField[]{txtN, txtRs, txtRsh, txtResolution}));
        JPanel pnlButtons = new JPanel(new GridLayout(0, 1, 4, 4)); pnlButtons.setBorder(BorderFactory.createTitledBorder(BorderFactory.createEtchedBorder(EtchedBorder.LOWERED), "Aktionen"));
        pnlButtons.add(chkAutoCalibrate); pnlButtons.add(btnCompute); pnlButtons.add(btnCalibrate); pnlButtons.add(btnShowFamilies); pnlButtons.add(btnExportExcel);
        pnlInputs.add(pnlButtons);
        contentPane.add(new JScrollPane(pnlInputs), BorderLayout.WEST);

        JPanel pnlCharts = new JPanel(new GridLayout(1, 2, 5, 5)); pnlCharts.add(ivChartPanel); pnlCharts.add(pvChartPanel);
        JPanel pnlIndicators = new JPanel(new GridLayout(2, 4, 10, 2)); pnlIndicators.setBorder(BorderFactory.createTitledBorder(BorderFactory.createEtchedBorder(EtchedBorder.LOWERED), "Indikatoren"));
        pnlIndicators.add(new JLabel("Pmpp:")); pnlIndicators.add(lblPmpp); pnlIndicators.add(new JLabel("Wirkungsgrad:")); pnlIndicators.add(lblEfficiency);
        pnlIndicators.add(new JLabel("Füllfaktor:")); pnlIndicators.add(lblFillFactor); pnlIndicators.add(new JLabel("MPP:")); pnlIndicators.add(lblMpp);
        JList<String> diagnosticsList = new JList<>(diagnosticsListModel); JScrollPane diagScroll = new JScrollPane(diagnosticsList); diagScroll.setBorder(BorderFactory.createTitledBorder("Diagnose")); diagScroll.setPreferredSize(new Dimension(600, 140));
        JPanel pnlResults = new JPanel(new BorderLayout(5, 5)); pnlResults.add(pnlIndicators, BorderLayout.NORTH); pnlResults.add(diagScroll, BorderLayout.CENTER);
        JPanel pnlCenter = new JPanel(new BorderLayout(5, 5)); pnlCenter.add(pnlCharts, BorderLayout.CENTER); pnlCenter.add(pnlResults, BorderLayout.SOUTH);
        contentPane.add(pnlCenter, BorderLayout.CENTER);

        JPanel pnlStatus = new JPanel(new FlowLayout(FlowLayout.LEFT)); pnlStatus.setBorder(BorderFactory.createCompoundBorder(BorderFactory.createEtchedBorder(EtchedBorder.LOWERED), new EmptyBorder(3, 5, 3, 5))); pnlStatus.add(lblStatus); contentPane.add(pnlStatus, BorderLayout.SOUTH);
    }

    private JPanel inputGroup(String title, String[] labels, JTextField[] fields) {
        JPanel panel = new JPanel(new GridBagLayout()); panel.setBorder(BorderFactory.createTitledBorder(BorderFactory.createEtchedBorder(EtchedBorder.LOWERED), title));
        GridBagConstraints gbc = new GridBagConstraints(); gbc.insets = new Insets(2, 5, 2, 5);
        for (int i = 0; i < labels.length; i++) {
            gbc.gridx = 0; gbc.gridy = i; gbc.anchor = GridBagConstraints.EAST; gbc.fill = GridBagConstraints.NONE; gbc.weightx = 0; panel.add(new JLabel(labels[i]), gbc);
            gbc.gridx = 1; gbc.anchor = GridBagConstraints.WEST; gbc.fill = GridBagConstraints.HORIZONTAL; gbc.weightx = 1.0; panel.add(fields[i], gbc);
        }
        return panel;
    }

    private void setupWindow() { setTitle("PV IV-Simulator (Eindiodenmodell)"); setDefaultCloseOperation(JFrame.EXIT_ON_CLOSE); setMinimumSize(new Dimension(1100, 650)); pack(); setLocationRelativeTo(null); }

    /** Fills the input fields from the model values. Must be called on the EDT. */
    public void showInputs(ModuleSpec spec, OperatingCondition condition, DiodeModelParams params, int resolution, boolean autoCalibrate) {
        txtVocRef.setText(FMT_VALUE.format(spec.getVocRef())); txtIscRef.setText(FMT_VALUE.format(spec.getIscRef())); txtVmppRef.setText(FMT_VALUE.format(spec.getVmppRef())); txtImppRef.setText(FMT_VALUE.format(spec.getImppRef()));
        txtArea.setText(FMT_VALUE.format(spec.getArea())); txtCells.setText(String.valueOf(spec.getCellsSeries())); txtAlphaIsc.setText(FMT_VALUE.format(spec.getAlphaIsc() * 100)); txtBetaVoc.setText(FMT_VALUE.format(spec.getBetaVoc() * 100));
        txtIrradiance.setText(FMT_VALUE.format(condition.getIrradiance())); txtTemperature.setText(FMT_VALUE.format(condition.getTemperature()));
        showDiodeParams(params); txtResolution.setText(String.valueOf(resolution)); chkAutoCalibrate.setSelected(autoCalibrate);
    }

    public void showDiodeParams(DiodeModelParams params) { txtN.setText(formatValue(params.getN())); txtRs.setText(formatValue(params.getRs())); txtRsh.setText(formatValue(params.getRsh())); }

    /** True while the n/Rs/Rsh fields still hold the rounded display text of {@code params}. */
    public boolean isShowingDiodeParams(DiodeModelParams params) { return matchesDisplayed(params, txtN.getText(), txtRs.getText(), txtRsh.getText()); }

    static String formatValue(double value) { return FMT_VALUE.format(value); }
    static boolean matchesDisplayed(DiodeModelParams params, String nText, String rsText, String rshText) {
        return params != null && formatValue(params.getN()).equals(trim(nText)) && formatValue(params.getRs()).equals(trim(rsText)) && formatValue(params.getRsh()).equals(trim(rshText));
    }
    private static String trim(String text) { return text == null ? "" : text.trim(); }

    /** Shows charts, indicators and diagnostics of a run, or clears them for {@code null}. */
    public void showResult(SimulationService.SimulationResult result) {
        if (!SwingUtilities.isEventDispatchThread()) { SwingUtilities.invokeLater(() -> showResult(result)); return; }
        diagnosticsListModel.clear();
        if (result == null) { ivChartPanel.setChart(null); pvChartPanel.setChart(null); lblPmpp.setText("-"); lblEfficiency.setText("-"); lblFillFactor.setText("-"); lblMpp.setText("-"); return; }
        CurveAnalysis analysis = result.analysis; CurvePoint mpp = analysis.getMaximumPowerPoint();
        ivChartPanel.setChart(CurveChartFactory.createIvChart(result.curve, mpp)); pvChartPanel.setChart(CurveChartFactory.createPvChart(result.curve, mpp));
        lblPmpp.setText(FMT_POWER.format(mpp.getPower()) + " W"); lblEfficiency.setText(FMT_PERCENT.format(analysis.getEfficiency() * 100) + " %"); lblFillFactor.setText(FMT_PERCENT.format(analysis.getFillFactor() * 100) + " %");
        lblMpp.setText(String.format("%.2f V / %.3f A", mpp.getVoltage(), mpp.getCurrent()));
        List<Diagnostic> diagnostics = analysis.getDiagnostics(); for (Diagnostic d : diagnostics) { diagnosticsListModel.addElement(d.toString()); }
    }

    public void setBusyState(boolean busy) { setCursor(busy ? Cursor.getPredefinedCursor(Cursor.WAIT_CURSOR) : Cursor.getDefaultCursor()); setEnabledRecursive(pnlInputs, !busy); }
    private void setEnabledRecursive(Component component, boolean enabled) { if (!(component instanceof JLabel)) { component.setEnabled(enabled); } if (component instanceof Container) { for (Component child : ((Container) component).getComponents()) { setEnabledRecursive(child, enabled); } } }
    public void setStatusLabel(String text) { if (!SwingUtilities.isEventDispatchThread()) { SwingUtilities.invokeLater(() -> lblStatus.setText(text != null ? text : "")); } else { lblStatus.setText(text != null ? text : ""); } }

    public File chooseExportFile() { int rv = exportChooser.showSaveDialog(this); return rv == JFileChooser.APPROVE_OPTION ? exportChooser.getSelectedFile() : null; }

    // --- Getters for the controller ---
    public JTextField getVocRefTextField() { return txtVocRef; } public JTextField getIscRefTextField() { return txtIscRef; } public JTextField getVmppRefTextField() { return txtVmppRef; } public JTextField getImppRefTextField() { return txtImppRef; }
    public JTextField getAreaTextField() { return txtArea; } public JTextField getCellsTextField() { return txtCells; } public JTextField getAlphaIscTextField() { return txtAlphaIsc; } public JTextField getBetaVocTextField() { return txtBetaVoc; }
    public JTextField getIrradianceTextField() { return txtIrradiance; } public JTextField getTemperatureTextField() { return txtTemperature; }
    public JTextField getNTextField() { return txtN; } public JTextField getRsTextField() { return txtRs; } public JTextField getRshTextField() { return txtRsh; } public JTextField getResolutionTextField() { return txtResolution; }
    public JCheckBox getAutoCalibrateCheckBox() { return chkAutoCalibrate; }
    public JButton getComputeButton() { return btnCompute; } public JButton getCalibrateButton() { return btnCalibrate; } public JButton getShowFamiliesButton() { return btnShowFamilies; } public JButton getExportExcelButton() { return btnExportExcel; }
}
