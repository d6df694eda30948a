package com.parsely.backend.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.parsely.backend.services.extraction.ExtractionSettings;
import com.parsely.backend.services.extraction.quality.ConfidenceWeights;

import lombok.Data;

/**
 * Extraction engine settings, loaded from application.properties with prefix "parsely.extraction".
 *
 * Example:
 * parsely.extraction.confidence-threshold=0.9
 * parsely.extraction.ml-enabled=false
 * parsely.extraction.ml-min-confidence=0.5
 * parsely.extraction.prefer-regex=true
 * parsely.extraction.layout-model-ref=classpath:models/layout-model.json
 * parsely.extraction.weights.sender=0.20
 */
@Data
@ConfigurationProperties(prefix = "parsely.extraction")
public class ExtractionProperties {

    /**
     * Results below this confidence are flagged for manual review.
     */
    private double confidenceThreshold = ExtractionSettings.DEFAULT_CONFIDENCE_THRESHOLD;

    private boolean mlEnabled = false;

    /**
     * Learned values below this confidence are ignored.
     */
    private double mlMinConfidence = ExtractionSettings.DEFAULT_ML_MIN_CONFIDENCE;

    /**
     * Keep resolved rule-based values even when the learned result is more confident.
     */
    private boolean preferRegex = true;

    /**
     * Trained layout model (classpath:, file: or plain path). Empty means rule-based classification.
     */
    private String layoutModelRef = "";

    private boolean parallelStrategies = false;

    private Duration mlTimeout = ExtractionSettings.DEFAULT_ML_TIMEOUT;

    private Weights weights = new Weights();

    @Data
    public static class Weights {
        private double sender = 0.20;
        private double recipient = 0.20;
        private double amount = 0.10;
        private double iban = 0.15;
        private double bic = 0.15;
        private double currency = 0.05;
        private double senderEmail = 0.05;
        private double recipientEmail = 0.05;
        private double address = 0.05;
        private double ibanPatternOnly = 0.05;
        private double bicShapeOnly = 0.05;
        private double partyWithoutQuality = 0.05;
    }

    public ExtractionSettings toSettings() {
        return new ExtractionSettings(
                confidenceThreshold,
                mlEnabled,
                mlMinConfidence,
                preferRegex,
                layoutModelRef,
                parallelStrategies,
                mlTimeout);
    }

    public ConfidenceWeights toWeights() {
        Weights w = weights == null ? new Weights() : weights;
        return new ConfidenceWeights(
                w.getSender(),
                w.getRecipient(),
                w.getAmount(),
                w.getIban(),
                w.getBic(),
                w.getCurrency(),
                w.getSenderEmail(),
                w.getRecipientEmail(),
                w.getAddress(),
                w.getIbanPatternOnly(),
                w.getBicShapeOnly(),
                w.getPartyWithoutQuality());
    }

    public String getDescription() {
        return String.format(
                "ExtractionProperties{threshold=%.2f, ml=%s, mlMin=%.2f, preferRegex=%s, parallel=%s, layoutModel='%s'}",
                confidenceThreshold,
                mlEnabled,
                mlMinConfidence,
                preferRegex,
                parallelStrategies,
                layoutModelRef == null ? "" : layoutModelRef);
    }
}
