package io.casetime.api;

import io.casetime.engine.EngineSettings;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/** Engine tunables under {@code casetime.*}. */
@ConfigurationProperties(prefix = "casetime")
@Validated
public class TimelineProperties {

    @Valid
    private final Inference inference = new Inference();

    @Valid
    private final Segment segment = new Segment();

    public Inference getInference() { return inference; }

    public Segment getSegment() { return segment; }

    public EngineSettings toSettings() {
        return new EngineSettings(
                inference.getConfidence(),
                Duration.ofSeconds(segment.getGapThresholdSeconds()),
                segment.getBatchSize());
    }

    public static class Inference {
        /** Confidence stamped on inferred relations; asserted relations carry 1.0. */
        @DecimalMin("0.0")
        @DecimalMax(value = "1.0", inclusive = false)
        private double confidence = EngineSettings.DEFAULT_CONFIDENCE;

        public double getConfidence() { return confidence; }
        public void setConfidence(double confidence) { this.confidence = confidence; }
    }

    public static class Segment {
        /** Gap between consecutive starts that opens a new by_gap segment. */
        @Min(0)
        private long gapThresholdSeconds = EngineSettings.DEFAULT_GAP.toSeconds();

        /** Facts per batch of the auto strategy. */
        @Min(1)
        private int batchSize = EngineSettings.DEFAULT_BATCH;

        public long getGapThresholdSeconds() { return gapThresholdSeconds; }
        public void setGapThresholdSeconds(long gapThresholdSeconds) { this.gapThresholdSeconds = gapThresholdSeconds; }

        public int getBatchSize() { return batchSize; }
        public void setBatchSize(int batchSize) { this.batchSize = batchSize; }
    }
}
