package com.outlierai.server.ai;

import com.outlierai.util.MatrixUtil;
import org.apache.commons.math3.ml.distance.CanberraDistance;
import org.apache.commons.math3.ml.distance.ChebyshevDistance;
import org.apache.commons.math3.ml.distance.DistanceMeasure;
import org.apache.commons.math3.ml.distance.EuclideanDistance;
import org.apache.commons.math3.ml.distance.ManhattanDistance;

import java.util.Arrays;
import java.util.Comparator;

/**
 * Exact pairwise distances between a query set and a reference set.
 */
public class DistanceOracle {

    public static final String DEFAULT_METRIC = "euclidean";

    private final String metric;
    private final DistanceMeasure measure;

    public DistanceOracle() {
        this(DEFAULT_METRIC);
    }

    public DistanceOracle(String metric) {
        this.metric = (metric == null || metric.trim().isEmpty()) ? DEFAULT_METRIC : metric.trim().toLowerCase();
        this.measure = resolve(this.metric);
    }

    private static DistanceMeasure resolve(String metric) {
        switch (metric) {
            case "euclidean":
                return new EuclideanDistance();
            case "manhattan":
                return new ManhattanDistance();
            case "chebyshev":
                return new ChebyshevDistance();
            case "canberra":
                return new CanberraDistance();
            default:
                throw new InvalidInputException("Unknown distance metric: " + metric);
        }
    }

    public String getMetric() {
        return metric;
    }

    public double distance(double[] a, double[] b) {
        return measure.compute(a, b);
    }

    /**
     * @return an N_q x N_r matrix, entry (i, j) is the distance from query row i to reference row j
     */
    public double[][] distances(double[][] query, double[][] reference) {
        int qCols = MatrixUtil.requireMatrix(query, "query set");
        int rCols = MatrixUtil.requireMatrix(reference, "reference set");
        if (qCols != rCols) {
            throw new InvalidInputException(
                    "Dimension mismatch: query set has " + qCols + " columns, reference set has " + rCols);
        }
        double[][] d = new double[query.length][reference.length];
        for (int i = 0; i < query.length; i++) {
            for (int j = 0; j < reference.length; j++) {
                d[i][j] = measure.compute(query[i], reference[j]);
            }
        }
        return d;
    }

    public double[][] selfDistances(double[][] x) {
        MatrixUtil.requireMatrix(x, "data set");
        int n = x.length;
        double[][] d = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                double v = measure.compute(x[i], x[j]);
                d[i][j] = v;
                d[j][i] = v;
            }
        }
        return d;
    }

    /**
     * Indices of the k nearest reference rows for one row of a distance matrix, ordered by
     * (distance, reference index).
     *
     * @param skipIndex reference index to leave out (the row itself when scoring the reference set
     *                  against itself), or -1
     */
    public static int[] nearest(double[] distanceRow, int k, int skipIndex) {
        int available = distanceRow.length - (skipIndex >= 0 ? 1 : 0);
        if (k > available) {
            throw new InvalidInputException("Requested " + k + " neighbours but only " + available
                    + " reference rows are available");
        }
        Integer[] order = new Integer[distanceRow.length];
        for (int j = 0; j < order.length; j++) {
            order[j] = j;
        }
        // Arrays.sort on objects is stable, so equal distances keep reference order
        Arrays.sort(order, Comparator.comparingDouble(j -> distanceRow[j]));

        int[] out = new int[k];
        int filled = 0;
        for (int idx = 0; idx < order.length && filled < k; idx++) {
            if (order[idx] == skipIndex) {
                continue;
            }
            out[filled++] = order[idx];
        }
        return out;
    }
}
