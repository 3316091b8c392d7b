package com.outlierai.server.ai.ensemble;

import java.util.List;

public class EnsembleResult {
    private final List<String> detectorNames;
    private final double[][] rawScores;
    private final double[][] normalizedScores;
    private final double[] combinedScores;
    private final int[] labels;
    private final double threshold;

    public EnsembleResult(List<String> detectorNames, double[][] rawScores, double[][] normalizedScores,
            double[] combinedScores, int[] labels, double threshold) {
        this.detectorNames = detectorNames;
        this.rawScores = rawScores;
        this.normalizedScores = normalizedScores;
        this.combinedScores = combinedScores;
        this.labels = labels;
        this.threshold = threshold;
    }

    public List<String> getDetectorNames() {
        return detectorNames;
    }

    // columns follow getDetectorNames()
    public double[][] getRawScores() {
        return rawScores;
    }

    public double[][] getNormalizedScores() {
        return normalizedScores;
    }

    public double[] getCombinedScores() {
        return combinedScores;
    }

    public int[] getLabels() {
        return labels;
    }

    public double getThreshold() {
        return threshold;
    }
}
