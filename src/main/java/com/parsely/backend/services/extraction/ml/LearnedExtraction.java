package com.parsely.backend.services.extraction.ml;

import com.parsely.backend.services.extraction.FieldMap;

/**
 * Field map produced by the learned fallback, scored with the same weighting as rule-based results.
 */
public record LearnedExtraction(FieldMap fields, double confidence) {

    private static final LearnedExtraction EMPTY = new LearnedExtraction(FieldMap.unresolved(), 0.0);

    public LearnedExtraction {
        if (fields == null) fields = FieldMap.unresolved();
        if (Double.isNaN(confidence)) confidence = 0.0;
        confidence = Math.max(0.0, Math.min(1.0, confidence));
    }

    public static LearnedExtraction empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }
}
