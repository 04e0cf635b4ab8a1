package com.geostat.anamorphosis.gslib;

import org.apache.commons.math3.distribution.NormalDistribution;

import com.geostat.anamorphosis.api.NormalScoreTransform;
import com.geostat.anamorphosis.api.TailKind;
import com.geostat.anamorphosis.api.TailModel;
import com.geostat.anamorphosis.api.TransformTable;
import com.geostat.anamorphosis.exceptions.UpstreamComputationException;
import com.geostat.anamorphosis.transform.Interpolation;

/**
 * Normal-score transform and GSLIB {@code backtr} back transform.
 * <p>
 * Inside the table both directions interpolate linearly. Beyond the table the
 * back transform works on the cumulative probability scale:
 * <ul>
 * <li>{@code NONE}: table end value.</li>
 * <li>{@code LINEAR}: linear from the table end to zmin/zmax.</li>
 * <li>{@code POWER}: {@code ((p - p0) / (p1 - p0))^(1/par)} between the table
 * end and zmin/zmax.</li>
 * <li>{@code HYPERBOLIC} (upper only): {@code z = (lambda / (1 - p))^(1/par)}
 * with lambda fitted to the table maximum.</li>
 * </ul>
 * Results are clamped to [zmin, zmax].
 */
public final class GslibNormalScoreTransform implements NormalScoreTransform {
    public static final int ERR_BAD_TABLE = 10;
    public static final int ERR_BOUNDS_INSIDE_TABLE = 11;
    public static final int ERR_LOWER_HYPERBOLIC = 12;
    public static final int ERR_BAD_TAIL_PARAMETER = 13;

    private static final double EPSILON = 1.0e-20;

    private final NormalDistribution standard = new NormalDistribution(null, 0.0, 1.0,
            NormalDistribution.DEFAULT_INVERSE_ABSOLUTE_ACCURACY);

    @Override
    public double[] forward(double[] values, TransformTable table) {
        double[] z = table.raw();
        double[] y = table.gaussian();
        checkTable("Normal score transform", z, y);
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = Interpolation.table(values[i], z, y);
        }
        return out;
    }

    @Override
    public double[] backward(double[] values, TransformTable table, TailModel tails) {
        String op = "Back transform";
        double[] z = table.raw();
        double[] y = table.gaussian();
        checkTable(op, z, y);
        int n = z.length;

        if (tails.zmin() > z[0] || tails.zmax() < z[n - 1])
            throw new UpstreamComputationException(op, ERR_BOUNDS_INSIDE_TABLE,
                    "bounds [" + tails.zmin() + ", " + tails.zmax() + "] inside table range ["
                            + z[0] + ", " + z[n - 1] + "]");
        if (tails.lowerKind() == TailKind.HYPERBOLIC)
            throw new UpstreamComputationException(op, ERR_LOWER_HYPERBOLIC, "hyperbolic lower tail");
        if (tails.lowerKind() == TailKind.POWER && !(tails.lowerParameter() > 0))
            throw new UpstreamComputationException(op, ERR_BAD_TAIL_PARAMETER,
                    "lower power parameter " + tails.lowerParameter());
        if ((tails.upperKind() == TailKind.POWER || tails.upperKind() == TailKind.HYPERBOLIC)
                && !(tails.upperParameter() > 0))
            throw new UpstreamComputationException(op, ERR_BAD_TAIL_PARAMETER,
                    "upper tail parameter " + tails.upperParameter());
        if (tails.upperKind() == TailKind.HYPERBOLIC && !(z[n - 1] > 0))
            throw new UpstreamComputationException(op, ERR_BAD_TAIL_PARAMETER,
                    "hyperbolic upper tail needs a positive table maximum, got " + z[n - 1]);

        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            double v = values[i];
            double b;
            if (v <= y[0]) {
                b = lowerTail(v, z[0], y[0], tails);
            } else if (v >= y[n - 1]) {
                b = upperTail(v, z[n - 1], y[n - 1], tails);
            } else {
                b = Interpolation.table(v, y, z);
            }
            out[i] = Math.min(Math.max(b, tails.zmin()), tails.zmax());
        }
        return out;
    }

    private double lowerTail(double v, double zFirst, double yFirst, TailModel tails) {
        double cdfLow = standard.cumulativeProbability(yFirst);
        double cdf = standard.cumulativeProbability(v);
        return switch (tails.lowerKind()) {
            case LINEAR -> powerInterpolate(0.0, cdfLow, tails.zmin(), zFirst, cdf, 1.0);
            case POWER -> powerInterpolate(0.0, cdfLow, tails.zmin(), zFirst, cdf, 1.0 / tails.lowerParameter());
            default -> zFirst;
        };
    }

    private double upperTail(double v, double zLast, double yLast, TailModel tails) {
        double cdfHigh = standard.cumulativeProbability(yLast);
        double cdf = standard.cumulativeProbability(v);
        return switch (tails.upperKind()) {
            case LINEAR -> powerInterpolate(cdfHigh, 1.0, zLast, tails.zmax(), cdf, 1.0);
            case POWER -> powerInterpolate(cdfHigh, 1.0, zLast, tails.zmax(), cdf, 1.0 / tails.upperParameter());
            case HYPERBOLIC -> {
                double w = tails.upperParameter();
                double lambda = Math.pow(zLast, w) * (1.0 - cdfHigh);
                double tail = 1.0 - cdf;
                yield tail > 0 ? Math.pow(lambda / tail, 1.0 / w) : tails.zmax();
            }
            default -> zLast;
        };
    }

    static double powerInterpolate(double xLow, double xHigh, double yLow, double yHigh, double x, double pow) {
        if (xHigh - xLow < EPSILON)
            return 0.5 * (yHigh + yLow);
        return yLow + (yHigh - yLow) * Math.pow((x - xLow) / (xHigh - xLow), pow);
    }

    private static void checkTable(String op, double[] z, double[] y) {
        if (z.length == 0)
            throw new UpstreamComputationException(op, ERR_BAD_TABLE, "empty table");
        for (int k = 1; k < z.length; k++) {
            if (z[k] < z[k - 1] || y[k] < y[k - 1])
                throw new UpstreamComputationException(op, ERR_BAD_TABLE, "table not sorted at index " + k);
        }
    }
}
