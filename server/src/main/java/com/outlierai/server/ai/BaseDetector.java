package com.outlierai.server.ai;

import com.outlierai.util.MatrixUtil;
import org.apache.commons.math3.special.Erf;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared fit/threshold/predict plumbing. Subclasses only build their reference structure and
 * score rows against it; everything derived from training scores lives here so every algorithm
 * thresholds, scales and ranks the same way.
 *
 * @param <M> the algorithm-specific reference structure kept in {@link FittedDetectorState}
 */
public abstract class BaseDetector<M> implements OutlierDetector {
    private static final Logger logger = LoggerFactory.getLogger(BaseDetector.class);

    private final String name;
    private final double contamination;

    // Swapped in one write at the end of fit, readers see the old or the new state
    private volatile FittedDetectorState<M> state;

    protected BaseDetector(String name, double contamination) {
        Labeler.requireContamination(contamination);
        this.name = name;
        this.contamination = contamination;
    }

    /**
     * Smallest training set the algorithm can work with.
     */
    protected abstract int minimumRows();

    /**
     * Builds the reference structure from a validated copy of the training set.
     */
    protected abstract M buildModel(double[][] x);

    /**
     * Scores the training set itself. Neighbour-based algorithms leave each row out of its own
     * neighbourhood here.
     */
    protected abstract double[] scoreTraining(M model, double[][] x);

    /**
     * Scores arbitrary rows against the reference structure. Must not modify the model.
     */
    protected abstract double[] score(M model, double[][] x);

    @Override
    public int getMinimumRows() {
        return minimumRows();
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public double getContamination() {
        return contamination;
    }

    @Override
    public void fit(double[][] x) {
        MatrixUtil.requireMatrix(x, "training set");
        if (x.length < minimumRows()) {
            throw new InvalidInputException(name + " needs at least " + minimumRows()
                    + " training rows, got " + x.length);
        }
        long startTime = System.currentTimeMillis();
        double[][] train = MatrixUtil.copy(x);

        M model = buildModel(train);
        double[] trainingScores = scoreTraining(model, train);
        FittedDetectorState<M> fitted = FittedDetectorState.of(model, train[0].length, contamination,
                trainingScores);
        this.state = fitted;

        long duration = System.currentTimeMillis() - startTime;
        logger.debug("{} fitted on {} rows in {} ms, threshold={}", name, train.length, duration,
                String.format("%.4f", fitted.getThreshold()));
    }

    @Override
    public double[] decisionFunction(double[][] x) {
        FittedDetectorState<M> fitted = requireFitted();
        int cols = MatrixUtil.requireMatrix(x, "query set");
        if (cols != fitted.getNFeatures()) {
            throw new InvalidInputException(name + " was fitted on " + fitted.getNFeatures()
                    + " features, query set has " + cols);
        }
        return score(fitted.getModel(), x);
    }

    @Override
    public int[] predict(double[][] x) {
        FittedDetectorState<M> fitted = requireFitted();
        return Labeler.label(decisionFunction(x), fitted.getThreshold());
    }

    @Override
    public double[] predictProba(double[][] x) {
        return predictProba(x, ProbabilityMethod.LINEAR);
    }

    @Override
    public double[] predictProba(double[][] x, ProbabilityMethod method) {
        FittedDetectorState<M> fitted = requireFitted();
        double[] scores = decisionFunction(x);
        double[] proba = new double[scores.length];

        if (method == ProbabilityMethod.UNIFY) {
            double mean = fitted.getMeanScore();
            double std = fitted.getStdScore();
            for (int i = 0; i < scores.length; i++) {
                if (std == 0.0) {
                    proba[i] = scores[i] > mean ? 1.0 : 0.0;
                } else {
                    double z = (scores[i] - mean) / (std * Math.sqrt(2.0));
                    proba[i] = Math.max(0.0, Erf.erf(z));
                }
            }
            return proba;
        }

        double min = fitted.getMinScore();
        double range = fitted.getMaxScore() - min;
        for (int i = 0; i < scores.length; i++) {
            if (range == 0.0) {
                proba[i] = scores[i] > min ? 1.0 : 0.0;
            } else {
                proba[i] = Math.min(1.0, Math.max(0.0, (scores[i] - min) / range));
            }
        }
        return proba;
    }

    /**
     * Position of each score within the training distribution, in (0, 1]. A query score is
     * ordered after training scores equal to it.
     */
    @Override
    public double[] predictRank(double[][] x) {
        FittedDetectorState<M> fitted = requireFitted();
        double[] scores = decisionFunction(x);
        double n = fitted.getNSamples() + 1.0;
        double[] ranks = new double[scores.length];
        for (int i = 0; i < scores.length; i++) {
            ranks[i] = (fitted.countAtOrBelow(scores[i]) + 1) / n;
        }
        return ranks;
    }

    @Override
    public int[] fitPredict(double[][] x) {
        fit(x);
        return getLabels();
    }

    @Override
    public EvaluationResult fitPredictEvaluate(double[][] x, int[] y) {
        if (y == null || y.length != x.length) {
            throw new InvalidInputException("Ground truth must have one label per training row");
        }
        fit(x);
        double[] scores = getDecisionScores();
        double roc = Evaluator.rocAuc(y, scores);
        double precision = Evaluator.precisionAtN(y, scores);
        logger.info("{} roc:{}, precision @ rank n:{}", name, String.format("%.4f", roc),
                String.format("%.4f", precision));
        return new EvaluationResult(getLabels(), roc, precision);
    }

    @Override
    public boolean isFitted() {
        return state != null;
    }

    public FittedDetectorState<M> getState() {
        return requireFitted();
    }

    @Override
    public double[] getDecisionScores() {
        return requireFitted().getDecisionScores();
    }

    @Override
    public int[] getLabels() {
        return requireFitted().getLabels();
    }

    @Override
    public double getThreshold() {
        return requireFitted().getThreshold();
    }

    private FittedDetectorState<M> requireFitted() {
        FittedDetectorState<M> fitted = state;
        if (fitted == null) {
            throw new NotFittedException(name);
        }
        return fitted;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{name='" + name + "', contamination=" + contamination
                + ", fitted=" + isFitted() + '}';
    }
}
