package com.outlierai.server.ai.detector;

import com.outlierai.server.ai.DegeneracyPolicy;
import com.outlierai.server.ai.DistanceOracle;
import com.outlierai.server.ai.InvalidInputException;
import com.outlierai.server.ai.OutlierDetector;
import com.outlierai.server.ai.ensemble.EnsembleBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class DetectorFactory {

    private static final Logger logger = LoggerFactory.getLogger(DetectorFactory.class);

    public static final long DEFAULT_RANDOM_STATE = 42L;

    public static OutlierDetector create(EnsembleBuilder.DetectorConfig config, double defaultContamination) {
        if (config == null || config.type == null || config.type.trim().isEmpty()) {
            throw new InvalidInputException("Detector config needs a type");
        }
        String type = config.type.trim().toLowerCase();
        String id = (config.id != null && !config.id.isEmpty()) ? config.id : type;
        double contamination = config.contamination != null ? config.contamination : defaultContamination;
        DegeneracyPolicy degeneracy = DegeneracyPolicy.fromName(config.degeneracy, DegeneracyPolicy.EPSILON_FLOOR);

        switch (type) {
            case "knn":
                return new KnnDetector(id,
                        config.nNeighbors != null ? config.nNeighbors : KnnDetector.DEFAULT_N_NEIGHBORS,
                        KnnDetector.Method.fromName(config.method),
                        config.metric != null ? config.metric : DistanceOracle.DEFAULT_METRIC,
                        contamination);
            case "hbos":
                return new HbosDetector(id,
                        config.nBins != null ? config.nBins : HbosDetector.DEFAULT_N_BINS,
                        config.alpha != null ? config.alpha : HbosDetector.DEFAULT_ALPHA,
                        config.tol != null ? config.tol : HbosDetector.DEFAULT_TOL,
                        degeneracy, contamination);
            case "abod":
            case "fast_abod":
                boolean fast = "fast_abod".equals(type) || Boolean.TRUE.equals(config.fast);
                return new AbodDetector(id, fast,
                        config.nNeighbors != null ? config.nNeighbors : AbodDetector.DEFAULT_N_NEIGHBORS,
                        degeneracy, contamination);
            case "iforest":
                return new IsolationForestDetector(id,
                        config.nEstimators != null ? config.nEstimators : IsolationForestDetector.DEFAULT_N_ESTIMATORS,
                        config.subsample != null ? config.subsample : IsolationForestDetector.DEFAULT_SUBSAMPLE,
                        config.maxDepth,
                        config.randomState != null ? config.randomState : DEFAULT_RANDOM_STATE,
                        contamination);
            case "ocsvm":
                return new OneClassSvmDetector(id,
                        config.nu != null ? config.nu : OneClassSvmDetector.DEFAULT_NU,
                        config.gamma,
                        config.tol != null ? config.tol : OneClassSvmDetector.DEFAULT_TOL,
                        contamination);
            default:
                logger.warn("Unknown detector type: {}", config.type);
                throw new InvalidInputException("Unknown detector type: " + config.type);
        }
    }
}
