package com.outlierai.server.ai.detector;

import com.outlierai.server.ai.InvalidInputException;
import com.outlierai.server.ai.OutlierDetector;
import com.outlierai.server.ai.ensemble.EnsembleBuilder;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class DetectorFactoryTest {

    private static EnsembleBuilder.DetectorConfig config(String type) {
        EnsembleBuilder.DetectorConfig cfg = new EnsembleBuilder.DetectorConfig();
        cfg.type = type;
        return cfg;
    }

    @Test
    public void testFactoryCreation() {
        assertTrue(DetectorFactory.create(config("knn"), 0.1) instanceof KnnDetector);
        assertTrue(DetectorFactory.create(config("HBOS"), 0.1) instanceof HbosDetector);
        assertTrue(DetectorFactory.create(config("iforest"), 0.1) instanceof IsolationForestDetector);
        assertTrue(DetectorFactory.create(config("ocsvm"), 0.1) instanceof OneClassSvmDetector);

        OutlierDetector abod = DetectorFactory.create(config("abod"), 0.1);
        assertFalse(((AbodDetector) abod).isFast());
        OutlierDetector fast = DetectorFactory.create(config("fast_abod"), 0.1);
        assertTrue(((AbodDetector) fast).isFast());
    }

    @Test
    public void testIdsAndOverrides() {
        EnsembleBuilder.DetectorConfig cfg = config("knn");
        cfg.id = "knn_median_7";
        cfg.nNeighbors = 7;
        cfg.method = "median";
        cfg.contamination = 0.05;

        KnnDetector knn = (KnnDetector) DetectorFactory.create(cfg, 0.1);
        assertEquals("knn_median_7", knn.getName());
        assertEquals(7, knn.getNNeighbors());
        assertEquals(KnnDetector.Method.MEDIAN, knn.getMethod());
        assertEquals(0.05, knn.getContamination(), 0.0);

        // id falls back to the type
        assertEquals("hbos", DetectorFactory.create(config("hbos"), 0.1).getName());
    }

    @Test
    public void testUnknownTypeIsRejected() {
        assertThrows(InvalidInputException.class, () -> DetectorFactory.create(config("lof"), 0.1));
        assertThrows(InvalidInputException.class, () -> DetectorFactory.create(config(null), 0.1));
        EnsembleBuilder.DetectorConfig badMethod = config("knn");
        badMethod.method = "sum";
        assertThrows(InvalidInputException.class, () -> DetectorFactory.create(badMethod, 0.1));
    }
}
