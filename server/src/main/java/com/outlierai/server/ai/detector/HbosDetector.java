package com.outlierai.server.ai.detector;

import com.outlierai.server.ai.BaseDetector;
import com.outlierai.server.ai.DegeneracyPolicy;
import com.outlierai.server.ai.DegenerateDistributionException;
import com.outlierai.server.ai.InvalidInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Histogram-based outlier score. Each feature gets a static equal-width histogram of the
 * training values; a row scores the sum over features of -log(binDensity + alpha).
 */
public class HbosDetector extends BaseDetector<HbosDetector.Histograms> {
    private static final Logger logger = LoggerFactory.getLogger(HbosDetector.class);

    public static final int DEFAULT_N_BINS = 10;
    public static final double DEFAULT_ALPHA = 0.1;
    public static final double DEFAULT_TOL = 0.5;
    // half-width of the range given to a constant feature under EPSILON_FLOOR
    public static final double CONSTANT_FEATURE_HALF_WIDTH = 0.5;
    // keeps log() finite for empty bins when alpha is 0
    public static final double DENSITY_FLOOR = 1e-12;

    private final int nBins;
    private final double alpha;
    private final double tol;
    private final DegeneracyPolicy degeneracy;

    /**
     * Per-feature bin edges and densities.
     */
    public static final class Histograms {
        final double[] lower;
        final double[] upper;
        final double[] binWidth;
        final double[][] density;

        Histograms(int nFeatures, int nBins) {
            this.lower = new double[nFeatures];
            this.upper = new double[nFeatures];
            this.binWidth = new double[nFeatures];
            this.density = new double[nFeatures][nBins];
        }

        public double[] densities(int feature) {
            return density[feature].clone();
        }

        public double binWidth(int feature) {
            return binWidth[feature];
        }
    }

    public HbosDetector(String name, int nBins, double alpha, double tol, DegeneracyPolicy degeneracy,
            double contamination) {
        super(name, contamination);
        if (nBins < 2) {
            throw new InvalidInputException("nBins must be at least 2, got " + nBins);
        }
        if (alpha < 0.0 || tol < 0.0) {
            throw new InvalidInputException("alpha and tol must be non-negative");
        }
        this.nBins = nBins;
        this.alpha = alpha;
        this.tol = tol;
        this.degeneracy = degeneracy != null ? degeneracy : DegeneracyPolicy.EPSILON_FLOOR;
    }

    public HbosDetector() {
        this("hbos", DEFAULT_N_BINS, DEFAULT_ALPHA, DEFAULT_TOL, DegeneracyPolicy.EPSILON_FLOOR, 0.1);
    }

    @Override
    protected int minimumRows() {
        return 2;
    }

    @Override
    protected Histograms buildModel(double[][] x) {
        int n = x.length;
        int d = x[0].length;
        Histograms h = new Histograms(d, nBins);

        for (int f = 0; f < d; f++) {
            double lo = Double.POSITIVE_INFINITY;
            double hi = Double.NEGATIVE_INFINITY;
            for (double[] row : x) {
                lo = Math.min(lo, row[f]);
                hi = Math.max(hi, row[f]);
            }
            if (lo == hi) {
                if (degeneracy == DegeneracyPolicy.FAIL) {
                    throw new DegenerateDistributionException(
                            getName() + ": feature " + f + " is constant, cannot build a histogram");
                }
                logger.debug("{}: feature {} is constant, widening range by {}", getName(), f,
                        CONSTANT_FEATURE_HALF_WIDTH);
                lo -= CONSTANT_FEATURE_HALF_WIDTH;
                hi += CONSTANT_FEATURE_HALF_WIDTH;
            }
            double width = (hi - lo) / nBins;
            h.lower[f] = lo;
            h.upper[f] = hi;
            h.binWidth[f] = width;

            long[] counts = new long[nBins];
            for (double[] row : x) {
                counts[binOf(row[f], lo, width)]++;
            }
            for (int b = 0; b < nBins; b++) {
                h.density[f][b] = counts[b] / (n * width);
            }
        }
        return h;
    }

    private int binOf(double v, double lo, double width) {
        int b = (int) Math.floor((v - lo) / width);
        // the upper edge belongs to the last bin
        return Math.max(0, Math.min(nBins - 1, b));
    }

    @Override
    protected double[] scoreTraining(Histograms model, double[][] x) {
        return score(model, x);
    }

    @Override
    protected double[] score(Histograms model, double[][] x) {
        double[] scores = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            double s = 0.0;
            for (int f = 0; f < x[i].length; f++) {
                s -= Math.log(Math.max(densityAt(model, f, x[i][f]) + alpha, DENSITY_FLOOR));
            }
            scores[i] = s;
        }
        return scores;
    }

    private double densityAt(Histograms h, int f, double v) {
        double lo = h.lower[f];
        double hi = h.upper[f];
        double width = h.binWidth[f];
        if (v >= lo && v <= hi) {
            return h.density[f][binOf(v, lo, width)];
        }
        double slack = tol * width;
        if (v < lo && lo - v <= slack) {
            return h.density[f][0];
        }
        if (v > hi && v - hi <= slack) {
            return h.density[f][nBins - 1];
        }
        return 0.0;
    }
}
