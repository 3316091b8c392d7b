package com.outlierai.server.ai;

/**
 * Capability set shared by every detector. Callers (ensembles, the service layer) depend on this
 * interface only, never on a concrete algorithm.
 *
 * Scores follow one convention: higher means more outlying.
 */
public interface OutlierDetector {

    // Name used in logs, config ids and score-matrix column headers.
    String getName();

    /**
     * Fits the detector on the reference set, replacing any previous fit. Also computes the
     * training scores, the threshold at the configured contamination and the training labels.
     */
    void fit(double[][] x);

    // Smallest training set fit(x) accepts.
    int getMinimumRows();

    double[] decisionFunction(double[][] x);

    int[] predict(double[][] x);

    double[] predictProba(double[][] x);

    double[] predictProba(double[][] x, ProbabilityMethod method);

    double[] predictRank(double[][] x);

    int[] fitPredict(double[][] x);

    EvaluationResult fitPredictEvaluate(double[][] x, int[] y);

    boolean isFitted();

    double getContamination();

    double[] getDecisionScores();

    int[] getLabels();

    double getThreshold();
}
