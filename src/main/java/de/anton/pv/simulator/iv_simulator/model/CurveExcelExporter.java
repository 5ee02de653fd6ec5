package de.anton.pv.simulator.iv_simulator.model;

import de.anton.pv.simulator.iv_simulator.service.SimulationService;
import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileOutputStream;
import java.io.IOException;
import java.util.List;

/**
 * Utility class to export a simulated curve and its indicators to an Excel file.
 */
public class CurveExcelExporter {

    private static final Logger logger = LoggerFactory.getLogger(CurveExcelExporter.class);

    public static final String SHEET_CURVE = "Kennlinie";
    public static final String SHEET_SUMMARY = "Kennwerte";
    // 1/256 character units
    private static final int COLUMN_WIDTH = 16 * 256;
    static final List<String> CURVE_COLUMNS = List.of("Spannung (V)", "Strom (A)", "Leistung (W)");

    /**
     * Writes the curve of {@code result} to sheet "Kennlinie" and module, parameters, condition,
     * indicators and diagnostics to sheet "Kennwerte".
     */
    public void exportResult(SimulationService.SimulationResult result, String filePath) throws IOException {
        if (result == null || result.curve == null || result.curve.isEmpty()) { logger.warn("No curve provided for Excel export to {}", filePath); return; }
        if (filePath == null || filePath.trim().isEmpty()) { throw new IllegalArgumentException("Output file path cannot be null or empty."); }

        logger.info("Starting Excel export process to: {}", filePath);
        try (Workbook workbook = new XSSFWorkbook(); FileOutputStream fileOut = new FileOutputStream(filePath)) {
            Font headerFont = workbook.createFont(); headerFont.setBold(true);
            CellStyle headerStyle = workbook.createCellStyle(); headerStyle.setFont(headerFont);

            writeCurveSheet(workbook.createSheet(SHEET_CURVE), headerStyle, result.curve);
            writeSummarySheet(workbook.createSheet(SHEET_SUMMARY), headerStyle, result);

            logger.debug("Writing workbook to file..."); workbook.write(fileOut); logger.info("Excel export completed successfully to: {}", filePath);
        } catch (IOException e) { logger.error("IOException during Excel export to {}", filePath, e); throw e; }
        catch (Exception e) { logger.error("Unexpected error during Excel export to {}", filePath, e); throw new IOException("Unerwarteter Fehler beim Excel-Export: " + e.getMessage(), e); }
    }

    private void writeCurveSheet(Sheet sheet, CellStyle headerStyle, Curve curve) {
        Row headerRow = sheet.createRow(0);
        for (int i = 0; i < CURVE_COLUMNS.size(); i++) { Cell cell = headerRow.createCell(i); cell.setCellValue(CURVE_COLUMNS.get(i)); cell.setCellStyle(headerStyle); }
        int rowNum = 1;
        for (CurvePoint point : curve.getPoints()) {
            Row row = sheet.createRow(rowNum++);
            createNumericCell(row, 0, point.getVoltage()); createNumericCell(row, 1, point.getCurrent()); createNumericCell(row, 2, point.getPower());
        }
        for (int i = 0; i < CURVE_COLUMNS.size(); i++) { sheet.setColumnWidth(i, COLUMN_WIDTH); }
    }

    private void writeSummarySheet(Sheet sheet, CellStyle headerStyle, SimulationService.SimulationResult result) {
        ModuleSpec spec = result.configuration.moduleSpec();
        DiodeModelParams params = result.getEffectiveParams();
        OperatingCondition condition = result.curve.getCondition();
        CurveAnalysis analysis = result.analysis;
        CurvePoint mpp = analysis.getMaximumPowerPoint();

        int[] rowNum = {0};
        header(sheet, headerStyle, rowNum, "Modul");
        value(sheet, rowNum, "Voc (V)", spec.getVocRef()); value(sheet, rowNum, "Isc (A)", spec.getIscRef());
        value(sheet, rowNum, "Vmpp (V)", spec.getVmppRef()); value(sheet, rowNum, "Impp (A)", spec.getImppRef());
        value(sheet, rowNum, "Fläche (m²)", spec.getArea()); value(sheet, rowNum, "Zellen in Serie", spec.getCellsSeries());
        header(sheet, headerStyle, rowNum, "Diodenmodell");
        value(sheet, rowNum, "n", params.getN()); value(sheet, rowNum, "Rs (Ω)", params.getRs()); value(sheet, rowNum, "Rsh (Ω)", params.getRsh());
        header(sheet, headerStyle, rowNum, "Betriebsbedingungen");
        value(sheet, rowNum, "Einstrahlung (W/m²)", condition.getIrradiance()); value(sheet, rowNum, "Temperatur (°C)", condition.getTemperature());
        header(sheet, headerStyle, rowNum, "Kennwerte");
        value(sheet, rowNum, "Isc' (A)", analysis.getShortCircuitCurrent()); value(sheet, rowNum, "Voc' (V)", analysis.getOpenCircuitVoltage());
        value(sheet, rowNum, "Vmpp (V)", mpp.getVoltage()); value(sheet, rowNum, "Impp (A)", mpp.getCurrent()); value(sheet, rowNum, "Pmpp (W)", mpp.getPower());
        value(sheet, rowNum, "Füllfaktor", analysis.getFillFactor()); value(sheet, rowNum, "Wirkungsgrad", analysis.getEfficiency());
        header(sheet, headerStyle, rowNum, "Diagnose");
        for (Diagnostic d : analysis.getDiagnostics()) {
            Row row = sheet.createRow(rowNum[0]++);
            row.createCell(0).setCellValue(d.getName()); row.createCell(1).setCellValue(d.isPassed() ? "OK" : "Fehler"); row.createCell(2).setCellValue(d.getMessage());
        }
        sheet.setColumnWidth(0, 2 * COLUMN_WIDTH); sheet.setColumnWidth(1, COLUMN_WIDTH); sheet.setColumnWidth(2, 4 * COLUMN_WIDTH);
    }

    private void header(Sheet sheet, CellStyle style, int[] rowNum, String title) { Cell cell = sheet.createRow(rowNum[0]++).createCell(0); cell.setCellValue(title); cell.setCellStyle(style); }
    private void value(Sheet sheet, int[] rowNum, String label, double value) { Row row = sheet.createRow(rowNum[0]++); row.createCell(0).setCellValue(label); createNumericCell(row, 1, value); }
    private void createNumericCell(Row row, int colIndex, double value) { if (!Double.isNaN(value) && !Double.isInfinite(value)) { row.createCell(colIndex).setCellValue(value); } else { row.createCell(colIndex, CellType.BLANK); } }
}
