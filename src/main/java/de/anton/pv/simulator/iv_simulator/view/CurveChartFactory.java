package de.anton.pv.simulator.iv_simulator.view;

import de.anton.pv.simulator.iv_simulator.model.Curve;
import de.anton.pv.simulator.iv_simulator.model.CurveFamily;
import de.anton.pv.simulator.iv_simulator.model.CurvePoint;

import org.jfree.chart.ChartFactory;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.plot.PlotOrientation;
import org.jfree.chart.plot.XYPlot;
import org.jfree.chart.renderer.xy.XYLineAndShapeRenderer;
import org.jfree.chart.util.ShapeUtils;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;

import java.awt.*;
import java.util.function.ToDoubleFunction;

/**
 * Builds the JFreeChart charts for single curves and curve families.
 * Dataset creation is kept separate from chart styling so it can be used headless.
 */
public final class CurveChartFactory {

    public static final String SERIES_MPP = "MPP";
    static final String AXIS_VOLTAGE = "Spannung (V)";
    static final String AXIS_CURRENT = "Strom (A)";
    static final String AXIS_POWER = "Leistung (W)";

    private static final Color IV_COLOR = new Color(5, 150, 105);
    private static final Color PV_COLOR = new Color(14, 165, 233);
    private static final Color MPP_COLOR = new Color(17, 24, 39);
    private static final Shape MPP_SHAPE = ShapeUtils.createDiamond(5.0f);

    private CurveChartFactory() { throw new IllegalStateException("Utility class"); }

    /** I-V dataset: series 0 is the curve, series 1 holds the single MPP point. */
    public static XYSeriesCollection createIvDataset(Curve curve, CurvePoint mpp) {
        return createDataset("I–V", curve, mpp, CurvePoint::getCurrent);
    }

    /** P-V dataset: series 0 is the curve, series 1 holds the single MPP point. */
    public static XYSeriesCollection createPvDataset(Curve curve, CurvePoint mpp) {
        return createDataset("P–V", curve, mpp, CurvePoint::getPower);
    }

    /** One I-V series per family member, in family order. */
    public static XYSeriesCollection createFamilyDataset(CurveFamily family) {
        XYSeriesCollection dataset = new XYSeriesCollection();
        for (Curve curve : family.getCurves()) {
            XYSeries series = new XYSeries(family.labelFor(curve), false, true);
            curve.getPoints().forEach(p -> series.add(p.getVoltage(), p.getCurrent()));
            dataset.addSeries(series);
        }
        return dataset;
    }

    public static JFreeChart createIvChart(Curve curve, CurvePoint mpp) {
        return styleSingleCurveChart(ChartFactory.createXYLineChart("Kennlinie I–V", AXIS_VOLTAGE, AXIS_CURRENT,
                createIvDataset(curve, mpp), PlotOrientation.VERTICAL, true, true, false), IV_COLOR);
    }

    public static JFreeChart createPvChart(Curve curve, CurvePoint mpp) {
        return styleSingleCurveChart(ChartFactory.createXYLineChart("Kennlinie P–V", AXIS_VOLTAGE, AXIS_POWER,
                createPvDataset(curve, mpp), PlotOrientation.VERTICAL, true, true, false), PV_COLOR);
    }

    public static JFreeChart createFamilyChart(CurveFamily family) {
        String title = family.getVariable() == CurveFamily.Variable.IRRADIANCE
                ? String.format("I–V bei verschiedenen Einstrahlungen (%.0f °C)", family.getFixedValue())
                : String.format("I–V bei verschiedenen Temperaturen (%.0f W/m²)", family.getFixedValue());
        XYSeriesCollection dataset = createFamilyDataset(family);
        JFreeChart chart = ChartFactory.createXYLineChart(title, AXIS_VOLTAGE, AXIS_CURRENT, dataset,
                PlotOrientation.VERTICAL, true, true, false);
        XYPlot plot = chart.getXYPlot();
        XYLineAndShapeRenderer renderer = new XYLineAndShapeRenderer(true, false);
        int total = Math.max(dataset.getSeriesCount(), 1);
        for (int i = 0; i < dataset.getSeriesCount(); i++) {
            renderer.setSeriesPaint(i, Color.getHSBColor((float) i / total, 0.7f, 0.75f));
        }
        plot.setRenderer(renderer);
        plot.setBackgroundPaint(Color.WHITE);
        plot.setDomainGridlinePaint(Color.LIGHT_GRAY);
        plot.setRangeGridlinePaint(Color.LIGHT_GRAY);
        return chart;
    }

    private static XYSeriesCollection createDataset(String name, Curve curve, CurvePoint mpp, ToDoubleFunction<CurvePoint> yValue) {
        XYSeries series = new XYSeries(name, false, true);
        curve.getPoints().forEach(p -> series.add(p.getVoltage(), yValue.applyAsDouble(p)));
        XYSeries mppSeries = new XYSeries(SERIES_MPP, false, true);
        if (mpp != null) mppSeries.add(mpp.getVoltage(), yValue.applyAsDouble(mpp));
        XYSeriesCollection dataset = new XYSeriesCollection();
        dataset.addSeries(series);
        dataset.addSeries(mppSeries);
        return dataset;
    }

    private static JFreeChart styleSingleCurveChart(JFreeChart chart, Color curveColor) {
        XYPlot plot = chart.getXYPlot();
        XYLineAndShapeRenderer renderer = new XYLineAndShapeRenderer();
        renderer.setSeriesLinesVisible(0, true); renderer.setSeriesShapesVisible(0, false); renderer.setSeriesPaint(0, curveColor);
        renderer.setSeriesLinesVisible(1, false); renderer.setSeriesShapesVisible(1, true); renderer.setSeriesShape(1, MPP_SHAPE); renderer.setSeriesPaint(1, MPP_COLOR);
        plot.setRenderer(renderer);
        plot.setBackgroundPaint(Color.WHITE);
        plot.setDomainGridlinePaint(Color.LIGHT_GRAY);
        plot.setRangeGridlinePaint(Color.LIGHT_GRAY);
        return chart;
    }
}
