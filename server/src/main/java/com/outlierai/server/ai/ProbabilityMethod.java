package com.outlierai.server.ai;

public enum ProbabilityMethod {
    /** Min-max scaling against the training score range, clipped to [0, 1]. */
    LINEAR,
    /** Gaussian scaling: max(0, erf((s - mean) / (std * sqrt(2)))) with training mean/std. */
    UNIFY
}
