package com.outlierai.server.ai.detector;

import com.outlierai.server.ai.BaseDetector;
import com.outlierai.server.ai.DistanceOracle;
import com.outlierai.server.ai.InvalidInputException;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * k-nearest-neighbour distance detector. The score of a row is the distance to its k-th nearest
 * reference row (largest), or the mean or median of its k nearest distances.
 */
public class KnnDetector extends BaseDetector<double[][]> {
    private static final Logger logger = LoggerFactory.getLogger(KnnDetector.class);

    public static final int DEFAULT_N_NEIGHBORS = 5;

    public enum Method {
        LARGEST,
        MEAN,
        MEDIAN;

        public static Method fromName(String name) {
            if (name == null || name.trim().isEmpty()) {
                return LARGEST;
            }
            switch (name.trim().toLowerCase()) {
                case "largest":
                    return LARGEST;
                case "mean":
                    return MEAN;
                case "median":
                    return MEDIAN;
                default:
                    throw new InvalidInputException("Unknown KNN method: " + name);
            }
        }
    }

    private final int nNeighbors;
    private final Method method;
    private final DistanceOracle oracle;

    public KnnDetector(String name, int nNeighbors, Method method, String metric, double contamination) {
        super(name, contamination);
        if (nNeighbors < 1) {
            throw new InvalidInputException("nNeighbors must be positive, got " + nNeighbors);
        }
        this.nNeighbors = nNeighbors;
        this.method = method != null ? method : Method.LARGEST;
        this.oracle = new DistanceOracle(metric);
    }

    public KnnDetector(int nNeighbors, Method method) {
        this("knn_" + (method != null ? method.name().toLowerCase() : "largest"), nNeighbors, method,
                DistanceOracle.DEFAULT_METRIC, 0.1);
    }

    public int getNNeighbors() {
        return nNeighbors;
    }

    public Method getMethod() {
        return method;
    }

    @Override
    protected int minimumRows() {
        // each training row is scored against the other rows
        return nNeighbors + 1;
    }

    @Override
    protected double[][] buildModel(double[][] x) {
        return x;
    }

    @Override
    protected double[] scoreTraining(double[][] reference, double[][] x) {
        double[][] d = oracle.selfDistances(x);
        double[] scores = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            scores[i] = aggregate(d[i], DistanceOracle.nearest(d[i], nNeighbors, i));
        }
        return scores;
    }

    @Override
    protected double[] score(double[][] reference, double[][] x) {
        double[][] d = oracle.distances(x, reference);
        double[] scores = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            scores[i] = aggregate(d[i], DistanceOracle.nearest(d[i], nNeighbors, -1));
        }
        if (logger.isTraceEnabled()) {
            logger.trace("{} scored {} rows against {} reference rows ({})", getName(), x.length,
                    reference.length, oracle.getMetric());
        }
        return scores;
    }

    private double aggregate(double[] distanceRow, int[] neighbours) {
        double[] knn = new double[neighbours.length];
        for (int j = 0; j < neighbours.length; j++) {
            knn[j] = distanceRow[neighbours[j]];
        }
        switch (method) {
            case MEAN:
                return StatUtils.mean(knn);
            case MEDIAN:
                return new Median().evaluate(knn);
            case LARGEST:
            default:
                // neighbours are sorted ascending
                return knn[knn.length - 1];
        }
    }
}
