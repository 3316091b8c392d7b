package com.outlierai.server.ai.detector;

import com.outlierai.server.ai.BaseDetector;
import com.outlierai.server.ai.InvalidInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import smile.anomaly.IsolationForest;
import smile.math.MathEx;

/**
 * Isolation forest backed by Smile. Anomalies are isolated by fewer random splits, so they get
 * shorter average path lengths and a higher Smile anomaly score.
 */
public class IsolationForestDetector extends BaseDetector<IsolationForest> {
    private static final Logger logger = LoggerFactory.getLogger(IsolationForestDetector.class);

    public static final int DEFAULT_N_ESTIMATORS = 100;
    public static final double DEFAULT_SUBSAMPLE = 0.7;

    private final int nEstimators;
    private final double subsample;
    private final Integer maxDepth;
    private final long randomState;

    public IsolationForestDetector(String name, int nEstimators, double subsample, Integer maxDepth,
            long randomState, double contamination) {
        super(name, contamination);
        if (nEstimators < 1) {
            throw new InvalidInputException("nEstimators must be positive, got " + nEstimators);
        }
        if (!(subsample > 0.0 && subsample <= 1.0)) {
            throw new InvalidInputException("subsample must be in (0, 1], got " + subsample);
        }
        if (maxDepth != null && maxDepth < 1) {
            throw new InvalidInputException("maxDepth must be positive, got " + maxDepth);
        }
        this.nEstimators = nEstimators;
        this.subsample = subsample;
        this.maxDepth = maxDepth;
        this.randomState = randomState;
    }

    public IsolationForestDetector(long randomState) {
        this("iforest", DEFAULT_N_ESTIMATORS, DEFAULT_SUBSAMPLE, null, randomState, 0.1);
    }

    @Override
    protected int minimumRows() {
        return 2;
    }

    @Override
    protected IsolationForest buildModel(double[][] x) {
        int sampleSize = Math.max(2, (int) Math.round(subsample * x.length));
        int depth = maxDepth != null ? maxDepth : (int) Math.ceil(Math.log(sampleSize) / Math.log(2));
        // Smile draws its subsamples from the calling thread's generator
        MathEx.setSeed(randomState);
        IsolationForest forest = IsolationForest.fit(x, nEstimators, Math.max(1, depth), subsample, 0);
        logger.debug("{} grew {} trees, maxDepth={}", getName(), nEstimators, depth);
        return forest;
    }

    @Override
    protected double[] scoreTraining(IsolationForest model, double[][] x) {
        return score(model, x);
    }

    @Override
    protected double[] score(IsolationForest model, double[][] x) {
        return model.score(x);
    }
}
