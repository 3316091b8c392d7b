package com.outlierai.server.controller;

import com.outlierai.server.ai.DegenerateDistributionException;
import com.outlierai.server.ai.combination.ScoreCombiner;
import com.outlierai.server.service.OutlierScoringService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
public class DetectionController {

    private static final Logger logger = LoggerFactory.getLogger(DetectionController.class);
    private final OutlierScoringService scoringService;

    public DetectionController(OutlierScoringService scoringService) {
        this.scoringService = scoringService;
    }

    public static class DetectionRequest {
        public double[][] train;
        // optional, scored against the ensemble fitted on train
        public double[][] test;
    }

    public static class CombinationRequest {
        public double[][] scores;
        public String method;
        public Integer nBuckets;
        public Long seed;
        public List<Double> weights;
        public Double threshold;
        public Boolean standardize;
    }

    public static class CombinationResponse {
        public String method;
        public double[] scores;

        public CombinationResponse(String method, double[] scores) {
            this.method = method;
            this.scores = scores;
        }
    }

    @PostMapping("/detect-outliers")
    public ResponseEntity<?> detect(@RequestBody DetectionRequest request) {
        if (!scoringService.isReady()) {
            return ResponseEntity.status(503).body("Ensemble config is not loaded yet.");
        }
        if (request.train == null || request.train.length == 0) {
            return ResponseEntity.badRequest().body("Missing training data.");
        }

        logger.info("Received detection request: {} training rows.", request.train.length);
        try {
            return ResponseEntity.ok(scoringService.detect(request.train, request.test));
        } catch (IllegalArgumentException | DegenerateDistributionException e) {
            logger.warn("Rejected detection request: {}", e.getMessage());
            return ResponseEntity.badRequest().body(e.getMessage());
        }
    }

    @PostMapping("/combine-scores")
    public ResponseEntity<?> combine(@RequestBody CombinationRequest request) {
        if (request.scores == null || request.scores.length == 0) {
            return ResponseEntity.badRequest().body("Missing score matrix.");
        }
        try {
            double[] combined = scoringService.combine(request.scores, request.method, request.nBuckets,
                    request.seed, request.weights, request.threshold, Boolean.TRUE.equals(request.standardize));
            String method = ScoreCombiner.requireMethod(request.method != null ? request.method : ScoreCombiner.AVERAGE);
            return ResponseEntity.ok(new CombinationResponse(method, combined));
        } catch (IllegalArgumentException | DegenerateDistributionException e) {
            logger.warn("Rejected combination request: {}", e.getMessage());
            return ResponseEntity.badRequest().body(e.getMessage());
        }
    }
}
