package com.outlierai.server.ai.combination;

public class StandardizedScores {
    private final double[][] normalized;
    private final double[] mean;
    private final double[] std;

    public StandardizedScores(double[][] normalized, double[] mean, double[] std) {
        this.normalized = normalized;
        this.mean = mean;
        this.std = std;
    }

    public double[][] getNormalized() {
        return normalized;
    }

    public double[] getMean() {
        return mean;
    }

    public double[] getStd() {
        return std;
    }
}
