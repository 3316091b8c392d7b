package com.outlierai.server.service;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.outlierai.server.ai.InvalidInputException;
import com.outlierai.server.ai.Labeler;
import com.outlierai.server.ai.combination.ColumnGrouping;
import com.outlierai.server.ai.combination.ScoreCombiner;
import com.outlierai.server.ai.combination.Standardizer;
import com.outlierai.server.ai.ensemble.EnsembleBuilder;
import com.outlierai.server.ai.ensemble.EnsembleResult;
import com.outlierai.server.ai.ensemble.OutlierEnsemble;
import com.outlierai.server.util.ConfigPathResolver;
import com.outlierai.util.MatrixUtil;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.InputStream;
import java.util.List;

@Service
public class OutlierScoringService {

    private static final Logger logger = LoggerFactory.getLogger(OutlierScoringService.class);

    private final EnsembleBuilder builder = new EnsembleBuilder();
    private volatile EnsembleBuilder.ConfigRoot config;

    public static class DetectionReport {
        private final EnsembleResult training;
        private final EnsembleResult test;

        public DetectionReport(EnsembleResult training, EnsembleResult test) {
            this.training = training;
            this.test = test;
        }

        public EnsembleResult getTraining() {
            return training;
        }

        // null when no query set was supplied
        public EnsembleResult getTest() {
            return test;
        }
    }

    @PostConstruct
    public void init() {
        EnsembleBuilder.ConfigRoot loaded = loadConfig();
        // fail at startup rather than on the first request
        builder.build(loaded);
        this.config = loaded;
        logger.info("Ensemble config loaded from {} with {} detectors", ConfigPathResolver.resolveConfigPath(),
                loaded.detectors.size());
    }

    public boolean isReady() {
        return config != null;
    }

    EnsembleBuilder.ConfigRoot loadConfig() {
        try (InputStream is = ConfigPathResolver.openConfig()) {
            ObjectMapper mapper = new ObjectMapper()
                    .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            return mapper.readValue(is, EnsembleBuilder.ConfigRoot.class);
        } catch (Exception e) {
            throw new RuntimeException("Failed to load ensemble config", e);
        }
    }

    /**
     * Builds a fresh ensemble from the loaded config. Every call gets its own detectors, so
     * concurrent requests never share fitted state.
     */
    public OutlierEnsemble newEnsemble() {
        EnsembleBuilder.ConfigRoot cfg = config;
        if (cfg == null) {
            cfg = loadConfig();
            this.config = cfg;
        }
        return builder.build(cfg);
    }

    public DetectionReport detect(double[][] train, double[][] test) {
        OutlierEnsemble ensemble = newEnsemble();
        EnsembleResult training = ensemble.fit(train);
        EnsembleResult scored = test != null ? ensemble.score(test) : null;
        logger.info("Detection run: {} training rows, {} query rows, {} training outliers", train.length,
                test != null ? test.length : 0, Labeler.countOutliers(training.getLabels()));
        return new DetectionReport(training, scored);
    }

    /**
     * Combines an already computed score matrix, optionally z-scoring its columns first.
     */
    public double[] combine(double[][] scores, String method, Integer nBuckets, Long seed,
            List<Double> weights, Double threshold, boolean standardize) {
        MatrixUtil.requireMatrix(scores, "score matrix");
        double[][] matrix = standardize ? new Standardizer().fitTransform(scores).getNormalized() : scores;
        String m = ScoreCombiner.requireMethod(method != null ? method : ScoreCombiner.AVERAGE);
        ColumnGrouping grouping = ScoreCombiner.usesGrouping(m)
                ? ColumnGrouping.partition(matrix[0].length, nBuckets != null ? nBuckets : 1,
                        seed != null ? seed : OutlierEnsemble.DEFAULT_SEED, false)
                : null;
        double[] w = (weights != null || ScoreCombiner.WEIGHTED_AVERAGE.equals(m)) ? toArray(weights) : null;
        return ScoreCombiner.combine(m, matrix, grouping, w, threshold != null ? threshold : 0.0);
    }

    private static double[] toArray(List<Double> values) {
        if (values == null) {
            throw new InvalidInputException("weights are required for this combination method");
        }
        double[] out = new double[values.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = values.get(i);
        }
        return out;
    }
}
