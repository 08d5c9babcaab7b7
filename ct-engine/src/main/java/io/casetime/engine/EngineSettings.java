package io.casetime.engine;

import java.time.Duration;
import java.util.Objects;

/**
 * Tunables of the engine.
 *
 * @param inferenceConfidence confidence stamped on inferred relations, below 1.0
 * @param gapThreshold        default gap that starts a new segment in {@code by_gap}
 * @param batchSize           segment size of the {@code auto} strategy
 */
public record EngineSettings(double inferenceConfidence, Duration gapThreshold, int batchSize) {
    public static final double DEFAULT_CONFIDENCE = 0.8;
    public static final Duration DEFAULT_GAP = Duration.ofSeconds(3600);
    public static final int DEFAULT_BATCH = 5;

    public EngineSettings {
        Objects.requireNonNull(gapThreshold);
        if (inferenceConfidence < 0.0 || inferenceConfidence >= 1.0) {
            throw new IllegalArgumentException("inference confidence must be within [0,1): " + inferenceConfidence);
        }
        if (gapThreshold.isNegative()) throw new IllegalArgumentException("gap threshold must not be negative");
        if (batchSize < 1) throw new IllegalArgumentException("batch size must be positive");
    }

    public static EngineSettings defaults() {
        return new EngineSettings(DEFAULT_CONFIDENCE, DEFAULT_GAP, DEFAULT_BATCH);
    }
}
