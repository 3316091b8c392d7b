package com.outlierai.server.ai;

/**
 * Raised when a statistic is undefined for the given data (zero-variance column, constant
 * histogram feature, coincident points) and the configured policy is {@link DegeneracyPolicy#FAIL}.
 */
public class DegenerateDistributionException extends ArithmeticException {

    public DegenerateDistributionException(String message) {
        super(message);
    }
}
