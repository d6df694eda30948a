package com.parsely.backend.services.extraction;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import com.parsely.backend.enums.FieldName;
import com.parsely.backend.enums.StrategyId;

/**
 * Final record of one parse call.
 *
 * @param learnedFields fields whose value came from the learned fallback
 */
public record ExtractionResult(
        FieldMap fieldMap,
        double confidence,
        StrategyId source,
        Set<FieldName> learnedFields,
        double confidenceThreshold
) {
    public ExtractionResult {
        fieldMap = fieldMap == null ? FieldMap.unresolved() : fieldMap;
        source = source == null ? StrategyId.NONE : source;
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        EnumSet<FieldName> copy = EnumSet.noneOf(FieldName.class);
        if (learnedFields != null) copy.addAll(learnedFields);
        learnedFields = Collections.unmodifiableSet(copy);
    }

    public static ExtractionResult unresolved(double confidenceThreshold) {
        return new ExtractionResult(FieldMap.unresolved(), 0.0, StrategyId.NONE, Set.of(), confidenceThreshold);
    }

    /**
     * Confidence below the configured threshold; the caller decides what review means.
     */
    public boolean requiresReview() {
        return confidence < confidenceThreshold;
    }

    public FieldValue get(FieldName field) {
        return fieldMap.get(field);
    }
}
