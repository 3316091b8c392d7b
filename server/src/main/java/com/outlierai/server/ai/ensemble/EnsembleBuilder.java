package com.outlierai.server.ai.ensemble;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.outlierai.server.ai.DegeneracyPolicy;
import com.outlierai.server.ai.Labeler;
import com.outlierai.server.ai.OutlierDetector;
import com.outlierai.server.ai.detector.DetectorFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class EnsembleBuilder {

    private static final Logger logger = LoggerFactory.getLogger(EnsembleBuilder.class);

    public static class DetectorConfig {
        public String id;
        public String type;
        // per-detector override of the ensemble contamination
        public Double contamination;

        // knn / fast abod
        public Integer nNeighbors;
        public String method;
        public String metric;

        // hbos
        public Integer nBins;
        public Double alpha;
        public Double tol;

        // abod
        public Boolean fast;

        // iforest
        public Integer nEstimators;
        public Double subsample;
        public Integer maxDepth;
        public Long randomState;

        // ocsvm
        public Double nu;
        public Double gamma;

        // hbos / abod
        public String degeneracy;
    }

    public static class CombinationConfig {
        public String method = "average";
        public Integer nBuckets;
        public Long seed;
        public Boolean remainderToLast;
        public List<Double> weights;
        public Double threshold;
    }

    public static class ConfigRoot {
        public Double contamination;
        public Boolean standardize;
        public Boolean parallel;
        public String standardizerDegeneracy;
        public CombinationConfig combination;
        public List<DetectorConfig> detectors;
    }

    public OutlierEnsemble build(InputStream jsonStream) {
        try {
            ObjectMapper mapper = new ObjectMapper()
                    .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            ConfigRoot config = mapper.readValue(jsonStream, ConfigRoot.class);
            return build(config);
        } catch (Exception e) {
            throw new RuntimeException("Failed to build outlier ensemble from JSON", e);
        }
    }

    public OutlierEnsemble build(ConfigRoot config) {
        if (config.detectors == null || config.detectors.isEmpty()) {
            throw new IllegalArgumentException("Ensemble config must list at least one detector");
        }
        double contamination = config.contamination != null ? config.contamination
                : Labeler.DEFAULT_CONTAMINATION;

        List<OutlierDetector> detectors = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        for (DetectorConfig dc : config.detectors) {
            OutlierDetector detector = DetectorFactory.create(dc, contamination);
            if (!ids.add(detector.getName())) {
                throw new IllegalArgumentException("Duplicate detector id: " + detector.getName());
            }
            detectors.add(detector);
        }

        CombinationConfig combination = config.combination != null ? config.combination : new CombinationConfig();
        boolean standardize = config.standardize == null || config.standardize;
        boolean parallel = Boolean.TRUE.equals(config.parallel);
        DegeneracyPolicy policy = DegeneracyPolicy.fromName(config.standardizerDegeneracy, DegeneracyPolicy.FAIL);

        logger.info("Outlier ensemble built with {} detectors, combination={}, standardize={}",
                detectors.size(), combination.method, standardize);
        return new OutlierEnsemble(detectors, combination, contamination, standardize, parallel, policy);
    }
}
