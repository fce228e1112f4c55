package com.anomaly.detection.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "detector")
public class DetectorProperties {

    private Sensitivity sensitivity = new Sensitivity();

    private IsolationForest isolationForest = new IsolationForest();

    private Dbscan dbscan = new Dbscan();

    private Lof lof = new Lof();

    // Periodic persistence of every registered detector
    private Snapshot snapshot = new Snapshot();

    @Data
    public static class Sensitivity {
        private double sigmaMultiplier = 3.0;
        private double minStdDev = 0.001;
    }

    @Data
    public static class IsolationForest {
        private int numTrees = 100;
        private int subSampleSize = 256;
        private int maxDepth = 10;
        // Buffer size at which each further point retrains the forest
        private int autoTrainThreshold = 256;
        private double threshold = 0.5;
        // Unset means a fresh random source per training run
        private Long seed;
    }

    @Data
    public static class Dbscan {
        private double epsilon = 0.5;
        private int minPoints = 5;
        // 0 = fixed by the first point
        private int dimensions = 0;
        private int maxHistorySize = 1000;
        private boolean autoRecluster = true;
        private int reclusterThreshold = 50;
    }

    @Data
    public static class Lof {
        private int kNeighbors = 20;
        private int dimensions = 0;
        private double threshold = 1.5;
    }

    @Data
    public static class Snapshot {
        private boolean enabled = true;
        private int intervalSeconds = 300;
    }
}
