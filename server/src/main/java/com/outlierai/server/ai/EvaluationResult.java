package com.outlierai.server.ai;

public class EvaluationResult {
    private final int[] labels;
    private final double rocAuc;
    private final double precisionAtN;

    public EvaluationResult(int[] labels, double rocAuc, double precisionAtN) {
        this.labels = labels;
        this.rocAuc = rocAuc;
        this.precisionAtN = precisionAtN;
    }

    public int[] getLabels() {
        return labels;
    }

    public double getRocAuc() {
        return rocAuc;
    }

    public double getPrecisionAtN() {
        return precisionAtN;
    }

    @Override
    public String toString() {
        return "EvaluationResult{" +
                "roc=" + String.format("%.4f", rocAuc) +
                ", precisionAtN=" + String.format("%.4f", precisionAtN) +
                ", outliers=" + Labeler.countOutliers(labels) +
                '}';
    }
}
