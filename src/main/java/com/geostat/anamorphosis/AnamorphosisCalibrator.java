package com.geostat.anamorphosis;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.OptionalDouble;

import com.geostat.anamorphosis.api.CurveReportSink;
import com.geostat.anamorphosis.api.CurveSeries;
import com.geostat.anamorphosis.api.StatisticsProvider;
import com.geostat.anamorphosis.api.TransformTable;
import com.geostat.anamorphosis.api.TransformTableBuilder;
import com.geostat.anamorphosis.control.ControlPointLocator;
import com.geostat.anamorphosis.control.ControlPoints;
import com.geostat.anamorphosis.effect.EffectCoefficientSolver;
import com.geostat.anamorphosis.gslib.NormalScoreTableBuilder;
import com.geostat.anamorphosis.gslib.WeightedStatistics;
import com.geostat.anamorphosis.hermite.HermiteExpansion;
import com.geostat.anamorphosis.hermite.HermiteMatrix;
import com.geostat.anamorphosis.hermite.HermiteRecurrence;
import com.geostat.anamorphosis.hermite.PciFit;
import com.geostat.anamorphosis.hermite.PciFitter;
import com.geostat.anamorphosis.io.AnamorphosisDefinition;
import com.geostat.anamorphosis.io.DefinitionLoader;
import com.geostat.anamorphosis.io.NoOpCurveReportSink;
import com.geostat.anamorphosis.transform.AnamorphosisTransform;
import com.geostat.anamorphosis.transform.ControlAnchors;

import lombok.extern.log4j.Log4j2;

/**
 * Runs the calibration pipelines.
 * <p>
 * Point support:
 * <ol>
 * <li>transformation table from raw data and declustering weights</li>
 * <li>Hermite matrix on the table's Gaussian scores</li>
 * <li>PCI fit and evaluation of the expansion on the same scores</li>
 * <li>control points, automatic or explicit</li>
 * </ol>
 * Block support derives {@code r} from a target block variance, evaluates the
 * shrunk expansion on a regular Gaussian grid over [-5, 5] and searches its
 * authorized interval against the point model's practical bounds.
 * <p>
 * Every curve computed is handed to the configured {@link CurveReportSink}.
 */
@Log4j2
public final class AnamorphosisCalibrator {
    static final double BLOCK_GRID_MIN = -5.0;
    static final double BLOCK_GRID_MAX = 5.0;

    private final AnamorphosisDefinition.Settings settings;
    private final TransformTableBuilder tableBuilder;
    private final StatisticsProvider statistics;
    private final CurveReportSink reportSink;
    private final EffectCoefficientSolver solver;

    private AnamorphosisCalibrator(Builder b) {
        this.settings = b.settings;
        this.tableBuilder = b.tableBuilder;
        this.statistics = b.statistics;
        this.reportSink = b.reportSink;
        this.solver = b.solver;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Calibrator with the bundled default settings and collaborators. */
    public static AnamorphosisCalibrator withDefaults() {
        return builder().build();
    }

    /** Copy of the settings this calibrator was built with. */
    public AnamorphosisDefinition.Settings settings() {
        return DefinitionLoader.copy(settings);
    }

    /**
     * Point support calibration with automatic control points. Practical
     * bounds come from the settings, or from the data when unset.
     *
     * @param raw     raw values.
     * @param weights declustering weights, one per value.
     * @return the calibrated model.
     */
    public AnamorphosisModel calibrate(double[] raw, double[] weights) {
        Fitted f = fit(raw, weights);
        ControlPoints cp = ControlPointLocator.authorized(f.curve, f.z, f.y,
                settings.getPracticalMin(), settings.getPracticalMax());
        return finish(f, cp);
    }

    /**
     * Point support calibration with explicit control points.
     *
     * @see ControlPointLocator#explicit
     */
    public AnamorphosisModel calibrateExplicit(double[] raw, double[] weights,
            double zpmin, double zpmax, double zamin, double zamax) {
        Fitted f = fit(raw, weights);
        ControlPoints cp = ControlPointLocator.explicit(f.curve, f.z, f.y, zpmin, zpmax, zamin, zamax);
        return finish(f, cp);
    }

    /**
     * Block support model for a target block variance.
     *
     * @param point         calibrated point model.
     * @param blockVariance Var(Zv), at most the point model's PCI variance.
     * @return the block model.
     */
    public BlockAnamorphosisModel calibrateBlock(AnamorphosisModel point, double blockVariance) {
        double[] pci = point.pci();
        double r = solver.solveSupport(blockVariance, pci);
        double[] blockPci = HermiteExpansion.blockCoefficients(pci, r);

        double[] grid = regularGrid(settings.getBlockGridSize());
        HermiteMatrix h = HermiteRecurrence.generate(grid, point.order());
        double[] curve = HermiteExpansion.evaluate(pci, h, r);

        ControlAnchors pointAnchors = point.anchors();
        ControlPoints cp = ControlPointLocator.authorizedBlock(curve, pointAnchors.zpmin(), pointAnchors.zpmax());

        // Only the authorized segment is strictly increasing: it serves as the
        // practical interval and as the inverse table.
        int i = cp.lowerAuthorized();
        int j = cp.upperAuthorized();
        ControlPoints segment = new ControlPoints(i, j, i, j);
        ControlAnchors anchors = ControlAnchors.of(segment, curve, curve, grid);
        double[] zTable = Arrays.copyOfRange(curve, i, j + 1);
        double[] yTable = Arrays.copyOfRange(grid, i, j + 1);
        AnamorphosisTransform transform = new AnamorphosisTransform(pci, r, anchors, zTable, yTable);

        log.info("Block anamorphosis '{}': r={}, target variance {}, block PCI variance {}, {}",
                settings.getName(), r, blockVariance, HermiteExpansion.variance(blockPci), cp);

        List<CurveSeries> series = new ArrayList<>();
        series.add(new CurveSeries("block", curve));
        addControlSeries(series, grid.length, segment, anchors);
        reportSink.publish(settings.getName() + " block anamorphosis", grid, series);
        return new BlockAnamorphosisModel(r, blockPci, grid, curve, cp, transform);
    }

    /**
     * Support and information effect coefficients.
     *
     * @param point            calibrated point model.
     * @param blockVariance    Var(Zv).
     * @param estimateVariance Var(Zv*), variance of the block estimates.
     * @param covariance       Cov(Zv, Zv*).
     * @return r, s and ro.
     */
    public InformationEffect informationEffect(AnamorphosisModel point, double blockVariance,
            double estimateVariance, double covariance) {
        double[] pci = point.pci();
        double r = solver.solveSupport(blockVariance, pci);
        double s = solver.solveSmoothing(estimateVariance, pci);
        double ro = solver.solveConditionalBias(covariance, pci, r, s);
        log.info("Information effect '{}': r={}, s={}, ro={}", settings.getName(), r, s, ro);
        return new InformationEffect(r, s, ro);
    }

    private Fitted fit(double[] raw, double[] weights) {
        TransformTable table = tableBuilder.build(raw, weights);
        double[] z = table.raw();
        double[] y = table.gaussian();

        HermiteMatrix h = HermiteRecurrence.generate(y, settings.getOrder());
        OptionalDouble mean = settings.getMean() != null
                ? OptionalDouble.of(settings.getMean())
                : OptionalDouble.empty();
        PciFit fit = PciFitter.fit(z, y, h, mean);
        double[] curve = HermiteExpansion.evaluate(fit.pci(), h);

        double rawVariance = statistics.describe(raw, weights, true).variance();
        return new Fitted(table, z, y, h, fit, curve, rawVariance);
    }

    private AnamorphosisModel finish(Fitted f, ControlPoints cp) {
        ControlAnchors anchors = ControlAnchors.of(cp, f.curve, f.z, f.y);
        AnamorphosisTransform transform = new AnamorphosisTransform(f.fit.pci(), 1.0, anchors, f.z, f.y);

        double pciVariance = f.fit.variance();
        double relative = relativeGap(pciVariance, f.rawVariance);
        log.info("Anamorphosis '{}': order {}, {} table rows, raw variance {}, PCI variance {}, {}",
                settings.getName(), f.fit.order(), f.z.length, f.rawVariance, pciVariance, cp);
        if (relative > settings.getVarianceTolerance())
            log.warn("Anamorphosis '{}': PCI variance {} is {}% away from raw variance {}",
                    settings.getName(), pciVariance, Math.round(1000 * relative) / 10.0, f.rawVariance);

        List<CurveSeries> series = new ArrayList<>();
        series.add(new CurveSeries("raw", f.z));
        series.add(new CurveSeries("model", f.curve));
        addControlSeries(series, f.y.length, cp, anchors);
        reportSink.publish(settings.getName() + " point anamorphosis", f.y, series);
        return new AnamorphosisModel(f.table, f.h, f.fit, f.curve, cp, transform, f.rawVariance);
    }

    /** {@code |value - reference| / reference}, or {@code |value|} for a zero reference. */
    static double relativeGap(double value, double reference) {
        return reference > 0 ? Math.abs(value - reference) / reference : Math.abs(value);
    }

    // The four anchors at their grid indices, NaN elsewhere.
    private void addControlSeries(List<CurveSeries> series, int n, ControlPoints cp, ControlAnchors a) {
        if (settings.getStyle() == null || !settings.getStyle().isShowControlPoints())
            return;
        double[] values = new double[n];
        Arrays.fill(values, Double.NaN);
        values[cp.lowerPractical()] = a.zpmin();
        values[cp.upperPractical()] = a.zpmax();
        values[cp.lowerAuthorized()] = a.zamin();
        values[cp.upperAuthorized()] = a.zamax();
        series.add(new CurveSeries("control points", values));
    }

    static double[] regularGrid(int n) {
        if (n < 3)
            throw new IllegalArgumentException("Block grid size must be >= 3, got " + n);
        double[] grid = new double[n];
        double step = (BLOCK_GRID_MAX - BLOCK_GRID_MIN) / (n - 1);
        for (int k = 0; k < n; k++) {
            grid[k] = BLOCK_GRID_MIN + k * step;
        }
        return grid;
    }

    private record Fitted(TransformTable table, double[] z, double[] y, HermiteMatrix h, PciFit fit,
            double[] curve, double rawVariance) {
    }

    /**
     * Builder for {@link AnamorphosisCalibrator}. Unset collaborators fall
     * back to the bundled implementations.
     */
    public static final class Builder {
        private AnamorphosisDefinition.Settings settings;
        private TransformTableBuilder tableBuilder = new NormalScoreTableBuilder();
        private StatisticsProvider statistics = new WeightedStatistics();
        private CurveReportSink reportSink = NoOpCurveReportSink.INSTANCE;
        private EffectCoefficientSolver solver = new EffectCoefficientSolver();

        public Builder definition(AnamorphosisDefinition def) {
            return settings(def.getAnamorphosis());
        }

        public Builder settings(AnamorphosisDefinition.Settings settings) {
            this.settings = settings;
            return this;
        }

        public Builder tableBuilder(TransformTableBuilder tableBuilder) {
            this.tableBuilder = tableBuilder;
            return this;
        }

        public Builder statistics(StatisticsProvider statistics) {
            this.statistics = statistics;
            return this;
        }

        public Builder reportSink(CurveReportSink reportSink) {
            this.reportSink = reportSink;
            return this;
        }

        public Builder solver(EffectCoefficientSolver solver) {
            this.solver = solver;
            return this;
        }

        public AnamorphosisCalibrator build() {
            settings = settings == null
                    ? DefinitionLoader.defaults().getAnamorphosis()
                    : DefinitionLoader.copy(settings);
            if (settings.getOrder() < 1)
                throw new IllegalArgumentException("Truncation order must be >= 1, got " + settings.getOrder());
            return new AnamorphosisCalibrator(this);
        }
    }
}
