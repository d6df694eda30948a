package com.parsely.backend.services.extraction;

import java.time.Duration;

/**
 * Per-parse options. Validated on construction; an out-of-range value fails before any document
 * is processed.
 *
 * @param confidenceThreshold results below it are flagged for review
 * @param mlEnabled           whether the learned fallback runs at all
 * @param mlMinConfidence     learned values are only used at or above this confidence
 * @param preferRegex         when false, a more confident learned result may replace resolved rule-based values
 * @param layoutModelRef      trained layout model location, or empty for rule-based classification
 * @param parallelStrategies  evaluate strategies concurrently
 * @param mlTimeout           upper bound on waiting for the learned fallback
 */
public record ExtractionSettings(
        double confidenceThreshold,
        boolean mlEnabled,
        double mlMinConfidence,
        boolean preferRegex,
        String layoutModelRef,
        boolean parallelStrategies,
        Duration mlTimeout
) {

    public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.9;
    public static final double DEFAULT_ML_MIN_CONFIDENCE = 0.5;
    public static final Duration DEFAULT_ML_TIMEOUT = Duration.ofMillis(500);

    public ExtractionSettings {
        requireUnitInterval("confidence-threshold", confidenceThreshold);
        requireUnitInterval("ml-min-confidence", mlMinConfidence);
        if (mlTimeout == null) {
            mlTimeout = DEFAULT_ML_TIMEOUT;
        }
        if (mlTimeout.isNegative() || mlTimeout.isZero()) {
            throw new InvalidExtractionConfigException("ml-timeout must be positive (got " + mlTimeout + ")");
        }
        layoutModelRef = layoutModelRef == null ? "" : layoutModelRef.trim();
    }

    public static ExtractionSettings defaults() {
        return new ExtractionSettings(
                DEFAULT_CONFIDENCE_THRESHOLD, false, DEFAULT_ML_MIN_CONFIDENCE, true, "", false, DEFAULT_ML_TIMEOUT);
    }

    public ExtractionSettings withMlEnabled(boolean enabled) {
        return new ExtractionSettings(confidenceThreshold, enabled, mlMinConfidence, preferRegex,
                layoutModelRef, parallelStrategies, mlTimeout);
    }

    public ExtractionSettings withPreferRegex(boolean prefer) {
        return new ExtractionSettings(confidenceThreshold, mlEnabled, mlMinConfidence, prefer,
                layoutModelRef, parallelStrategies, mlTimeout);
    }

    public ExtractionSettings withParallelStrategies(boolean parallel) {
        return new ExtractionSettings(confidenceThreshold, mlEnabled, mlMinConfidence, preferRegex,
                layoutModelRef, parallel, mlTimeout);
    }

    public ExtractionSettings withMlTimeout(Duration timeout) {
        return new ExtractionSettings(confidenceThreshold, mlEnabled, mlMinConfidence, preferRegex,
                layoutModelRef, parallelStrategies, timeout);
    }

    public boolean hasLayoutModel() {
        return !layoutModelRef.isEmpty();
    }

    private static void requireUnitInterval(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new InvalidExtractionConfigException(name + " must be within [0, 1] (got " + value + ")");
        }
    }
}
