package com.parsely.backend.services.extraction.layout;

import com.parsely.backend.enums.LayoutCategory;

/**
 * Predicted layout with a confidence in [0, 1] and the classifier that produced it.
 */
public record LayoutPrediction(LayoutCategory category, double confidence, String classifier) {

    public static final String RULE_BASED = "rule-based";
    public static final String TRAINED = "trained";

    public LayoutPrediction {
        if (category == null) category = LayoutCategory.UNSTRUCTURED;
        confidence = Math.max(0.0, Math.min(1.0, confidence));
    }
}
