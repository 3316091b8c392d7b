package com.outlierai.server.ai.ensemble;

import com.outlierai.server.ai.DegeneracyPolicy;
import com.outlierai.server.ai.InvalidInputException;
import com.outlierai.server.ai.Labeler;
import com.outlierai.server.ai.NotFittedException;
import com.outlierai.server.ai.OutlierDetector;
import com.outlierai.server.ai.combination.ColumnGrouping;
import com.outlierai.server.ai.combination.ScoreCombiner;
import com.outlierai.server.ai.combination.StandardizedScores;
import com.outlierai.server.ai.combination.Standardizer;
import com.outlierai.util.MatrixUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Fits a fixed list of detectors on the same training set and merges their scores:
 * raw scores, then z-scores with training statistics, then one combination policy, then a
 * contamination threshold calibrated on the combined training scores.
 */
public class OutlierEnsemble {
    private static final Logger logger = LoggerFactory.getLogger(OutlierEnsemble.class);

    public static final long DEFAULT_SEED = 42L;

    private final List<OutlierDetector> detectors;
    private final EnsembleBuilder.CombinationConfig combination;
    private final double contamination;
    private final boolean standardize;
    private final boolean parallel;
    private final Standardizer standardizer;
    private final String method;

    private volatile FittedEnsemble fitted;

    private static final class FittedEnsemble {
        final StandardizedScores trainStats;
        final ColumnGrouping grouping;
        final EnsembleResult training;

        FittedEnsemble(StandardizedScores trainStats, ColumnGrouping grouping, EnsembleResult training) {
            this.trainStats = trainStats;
            this.grouping = grouping;
            this.training = training;
        }
    }

    public OutlierEnsemble(List<OutlierDetector> detectors, EnsembleBuilder.CombinationConfig combination,
            double contamination, boolean standardize, boolean parallel, DegeneracyPolicy standardizerPolicy) {
        if (detectors == null || detectors.isEmpty()) {
            throw new InvalidInputException("An ensemble needs at least one detector");
        }
        Labeler.requireContamination(contamination);
        this.detectors = Collections.unmodifiableList(new ArrayList<>(detectors));
        this.combination = combination != null ? combination : new EnsembleBuilder.CombinationConfig();
        this.contamination = contamination;
        this.standardize = standardize;
        this.parallel = parallel;
        this.standardizer = new Standardizer(standardizerPolicy);
        this.method = ScoreCombiner.requireMethod(this.combination.method);
    }

    public List<OutlierDetector> getDetectors() {
        return detectors;
    }

    public List<String> getDetectorNames() {
        List<String> names = new ArrayList<>();
        for (OutlierDetector d : detectors) {
            names.add(d.getName());
        }
        return names;
    }

    public String getCombinationMethod() {
        return method;
    }

    public boolean isFitted() {
        return fitted != null;
    }

    /**
     * Fits every detector on {@code train} and calibrates the combined threshold.
     * <p>
     * Shape, row count, grouping and weights are checked before any detector is touched; such a
     * failure keeps the previous fit usable. Detectors are refit in place, so a failure after that
     * point discards the previous fit and the ensemble reports itself unfitted.
     */
    public EnsembleResult fit(double[][] train) {
        MatrixUtil.requireMatrix(train, "training set");
        for (OutlierDetector d : detectors) {
            if (train.length < d.getMinimumRows()) {
                throw new InvalidInputException(d.getName() + " needs at least " + d.getMinimumRows()
                        + " training rows, got " + train.length);
            }
        }
        ColumnGrouping grouping = ScoreCombiner.usesGrouping(method) ? ColumnGrouping.partition(detectors.size(),
                bucketCount(), seed(), Boolean.TRUE.equals(combination.remainderToLast)) : null;
        double[] w = weightsOrNull();
        long startTime = System.currentTimeMillis();

        EnsembleResult training;
        StandardizedScores stats;
        try {
            // each detector owns its state, so fitting them side by side is safe
            IntStream indices = IntStream.range(0, detectors.size());
            if (parallel) {
                indices = indices.parallel();
            }
            indices.forEach(j -> detectors.get(j).fit(train));

            double[][] columns = new double[detectors.size()][];
            for (int j = 0; j < detectors.size(); j++) {
                columns[j] = detectors.get(j).getDecisionScores();
            }
            double[][] raw = MatrixUtil.columnStack(columns);

            stats = standardize ? standardizer.fitTransform(raw) : null;
            double[][] normalized = stats != null ? stats.getNormalized() : raw;
            double[] combined = ScoreCombiner.combine(method, normalized, grouping, w, thresholdSumLevel());
            double threshold = Labeler.threshold(combined, contamination);
            training = new EnsembleResult(getDetectorNames(), raw, normalized, combined,
                    Labeler.label(combined, threshold), threshold);
        } catch (RuntimeException e) {
            this.fitted = null;
            logger.warn("Ensemble fit failed, previous fit discarded: {}", e.getMessage());
            throw e;
        }
        this.fitted = new FittedEnsemble(stats, grouping, training);

        long duration = System.currentTimeMillis() - startTime;
        logger.info("Ensemble of {} detectors fitted on {} rows in {} ms ({}), threshold={}", detectors.size(),
                train.length, duration, method, String.format("%.4f", training.getThreshold()));
        if (grouping != null) {
            logger.debug("Column grouping: {}", grouping);
        }
        return training;
    }

    public EnsembleResult getTrainingResult() {
        return requireFitted().training;
    }

    public EnsembleResult score(double[][] test) {
        FittedEnsemble state = requireFitted();
        MatrixUtil.requireMatrix(test, "query set");

        double[][] columns = new double[detectors.size()][];
        for (int j = 0; j < detectors.size(); j++) {
            columns[j] = detectors.get(j).decisionFunction(test);
        }
        double[][] raw = MatrixUtil.columnStack(columns);
        double[][] normalized = state.trainStats != null
                ? standardizer.transform(raw, state.trainStats.getMean(), state.trainStats.getStd())
                : raw;
        double[] combined = ScoreCombiner.combine(method, normalized, state.grouping, weightsOrNull(),
                thresholdSumLevel());
        double threshold = state.training.getThreshold();

        logger.debug("Ensemble scored {} rows", test.length);
        return new EnsembleResult(getDetectorNames(), raw, normalized, combined,
                Labeler.label(combined, threshold), threshold);
    }

    private double thresholdSumLevel() {
        return combination.threshold != null ? combination.threshold : 0.0;
    }

    private int bucketCount() {
        return combination.nBuckets != null ? combination.nBuckets : 1;
    }

    private long seed() {
        return combination.seed != null ? combination.seed : DEFAULT_SEED;
    }

    private double[] weightsOrNull() {
        if (combination.weights == null && !ScoreCombiner.WEIGHTED_AVERAGE.equals(method)) {
            return null;
        }
        if (combination.weights == null || combination.weights.size() != detectors.size()) {
            throw new InvalidInputException("weighted combination needs one weight per detector ("
                    + detectors.size() + ")");
        }
        double[] w = new double[combination.weights.size()];
        for (int j = 0; j < w.length; j++) {
            w[j] = combination.weights.get(j);
        }
        return w;
    }

    private FittedEnsemble requireFitted() {
        FittedEnsemble state = fitted;
        if (state == null) {
            throw new NotFittedException("ensemble");
        }
        return state;
    }
}
