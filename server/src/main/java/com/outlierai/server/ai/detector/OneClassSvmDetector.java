package com.outlierai.server.ai.detector;

import com.outlierai.server.ai.BaseDetector;
import com.outlierai.server.ai.InvalidInputException;
import smile.anomaly.SVM;
import smile.base.svm.KernelMachine;
import smile.math.kernel.GaussianKernel;

/**
 * One-class SVM with a Gaussian kernel, backed by Smile. The SVM decision value is positive
 * inside the learned support; it is negated so that higher means more outlying.
 */
public class OneClassSvmDetector extends BaseDetector<KernelMachine<double[]>> {

    public static final double DEFAULT_NU = 0.5;
    public static final double DEFAULT_TOL = 1e-3;

    private final double nu;
    private final Double gamma;
    private final double tol;

    /**
     * @param gamma RBF coefficient in exp(-gamma |x - y|^2); null means 1 / nFeatures
     */
    public OneClassSvmDetector(String name, double nu, Double gamma, double tol, double contamination) {
        super(name, contamination);
        if (!(nu > 0.0 && nu <= 1.0)) {
            throw new InvalidInputException("nu must be in (0, 1], got " + nu);
        }
        if (gamma != null && gamma <= 0.0) {
            throw new InvalidInputException("gamma must be positive, got " + gamma);
        }
        this.nu = nu;
        this.gamma = gamma;
        this.tol = tol;
    }

    public OneClassSvmDetector() {
        this("ocsvm", DEFAULT_NU, null, DEFAULT_TOL, 0.1);
    }

    @Override
    protected int minimumRows() {
        return 2;
    }

    @Override
    protected KernelMachine<double[]> buildModel(double[][] x) {
        double g = gamma != null ? gamma : 1.0 / x[0].length;
        // Smile's Gaussian kernel is exp(-|x - y|^2 / (2 sigma^2))
        double sigma = Math.sqrt(1.0 / (2.0 * g));
        return SVM.fit(x, new GaussianKernel(sigma), nu, tol);
    }

    @Override
    protected double[] scoreTraining(KernelMachine<double[]> model, double[][] x) {
        return score(model, x);
    }

    @Override
    protected double[] score(KernelMachine<double[]> model, double[][] x) {
        double[] scores = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            scores[i] = -model.score(x[i]);
        }
        return scores;
    }
}
