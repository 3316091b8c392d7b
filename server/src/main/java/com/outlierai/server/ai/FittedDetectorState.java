package com.outlierai.server.ai;

import org.apache.commons.math3.stat.StatUtils;

import java.util.Arrays;

/**
 * Everything a detector learns in one fit: the algorithm's reference structure plus the training
 * scores, their labels and the calibrated threshold. Never modified after construction; a refit
 * builds a new instance.
 *
 * @param <M> the algorithm-specific reference structure
 */
public final class FittedDetectorState<M> {

    private final M model;
    private final int nFeatures;
    private final double contamination;
    private final double[] decisionScores;
    private final double[] sortedScores;
    private final int[] labels;
    private final double threshold;
    private final double minScore;
    private final double maxScore;
    private final double meanScore;
    private final double stdScore;

    private FittedDetectorState(M model, int nFeatures, double contamination, double[] decisionScores) {
        this.model = model;
        this.nFeatures = nFeatures;
        this.contamination = contamination;
        this.decisionScores = decisionScores;
        this.sortedScores = decisionScores.clone();
        Arrays.sort(this.sortedScores);
        this.threshold = Labeler.threshold(decisionScores, contamination);
        this.labels = Labeler.label(decisionScores, threshold);
        this.minScore = sortedScores[0];
        this.maxScore = sortedScores[sortedScores.length - 1];
        this.meanScore = StatUtils.mean(decisionScores);
        this.stdScore = Math.sqrt(StatUtils.populationVariance(decisionScores));
    }

    public static <M> FittedDetectorState<M> of(M model, int nFeatures, double contamination,
            double[] trainingScores) {
        for (int i = 0; i < trainingScores.length; i++) {
            if (Double.isNaN(trainingScores[i])) {
                throw new DegenerateDistributionException("Training score " + i + " is NaN");
            }
        }
        return new FittedDetectorState<>(model, nFeatures, contamination, trainingScores.clone());
    }

    public M getModel() {
        return model;
    }

    public int getNFeatures() {
        return nFeatures;
    }

    public double getContamination() {
        return contamination;
    }

    public double[] getDecisionScores() {
        return decisionScores.clone();
    }

    public int[] getLabels() {
        return labels.clone();
    }

    public double getThreshold() {
        return threshold;
    }

    public double getMinScore() {
        return minScore;
    }

    public double getMaxScore() {
        return maxScore;
    }

    public double getMeanScore() {
        return meanScore;
    }

    public double getStdScore() {
        return stdScore;
    }

    public int getNSamples() {
        return decisionScores.length;
    }

    /**
     * Number of training scores less than or equal to the given score.
     */
    int countAtOrBelow(double score) {
        int lo = 0;
        int hi = sortedScores.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (sortedScores[mid] <= score) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }
}
