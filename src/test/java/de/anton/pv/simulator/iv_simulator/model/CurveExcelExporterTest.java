package de.anton.pv.simulator.iv_simulator.model;

import de.anton.pv.simulator.iv_simulator.service.SimulationConfiguration;
import de.anton.pv.simulator.iv_simulator.service.SimulationService;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class CurveExcelExporterTest {

    private static SimulationService.SimulationResult result;

    private final CurveExcelExporter exporter = new CurveExcelExporter();

    @TempDir
    Path tempDir;

    @BeforeAll
    static void simulate() {
        SimulationConfiguration config = new SimulationConfiguration(SimulationModel.DEFAULT_MODULE,
                SimulationModel.DEFAULT_PARAMS, OperatingCondition.STC, 50, false);
        result = new SimulationService().runSimulation(config);
    }

    @Test
    void writesCurveAndSummarySheets() throws IOException {
        Path file = tempDir.resolve("kennlinie.xlsx");

        exporter.exportResult(result, file.toString());

        assertTrue(Files.size(file) > 0);
        try (InputStream in = Files.newInputStream(file); Workbook workbook = new XSSFWorkbook(in)) {
            Sheet curve = workbook.getSheet(CurveExcelExporter.SHEET_CURVE);
            assertNotNull(curve);
            Row header = curve.getRow(0);
            assertEquals("Spannung (V)", header.getCell(0).getStringCellValue());
            assertEquals("Strom (A)", header.getCell(1).getStringCellValue());
            assertEquals("Leistung (W)", header.getCell(2).getStringCellValue());
            assertEquals(51, curve.getLastRowNum());

            CurvePoint first = result.curve.getFirstPoint();
            assertEquals(first.getVoltage(), curve.getRow(1).getCell(0).getNumericCellValue(), 1e-12);
            assertEquals(first.getCurrent(), curve.getRow(1).getCell(1).getNumericCellValue(), 1e-12);

            Sheet summary = workbook.getSheet(CurveExcelExporter.SHEET_SUMMARY);
            assertNotNull(summary);
            assertEquals("Modul", summary.getRow(0).getCell(0).getStringCellValue());
            assertEquals("Voc (V)", summary.getRow(1).getCell(0).getStringCellValue());
            assertEquals(52.0, summary.getRow(1).getCell(1).getNumericCellValue(), 1e-12);

            Row pmpp = findRow(summary, "Pmpp (W)");
            assertNotNull(pmpp);
            assertEquals(result.analysis.getMaximumPowerPoint().getPower(), pmpp.getCell(1).getNumericCellValue(), 1e-9);

            Row convergence = findRow(summary, "Newton-Konvergenz");
            assertNotNull(convergence);
            assertEquals("OK", convergence.getCell(1).getStringCellValue());
        }
    }

    @Test
    void emptyResultWritesNothing() throws IOException {
        Path file = tempDir.resolve("leer.xlsx");

        exporter.exportResult(null, file.toString());

        assertFalse(Files.exists(file));
    }

    @Test
    void rejectsBlankPath() {
        assertThrows(IllegalArgumentException.class, () -> exporter.exportResult(result, " "));
    }

    private static Row findRow(Sheet sheet, String label) {
        for (Row row : sheet) {
            if (row.getCell(0) != null && label.equals(row.getCell(0).getStringCellValue())) return row;
        }
        return null;
    }
}
