package com.parsely.backend.enums;

import java.util.List;

/**
 * Advisory layout hint. Only used to reorder strategy evaluation.
 */
public enum LayoutCategory {
    TWO_COLUMN("two_column", List.of(
            StrategyId.TWO_COLUMN, StrategyId.SINGLE_COLUMN_LABEL,
            StrategyId.COMPANY_SPECIFIC, StrategyId.PATTERN_FALLBACK)),
    SINGLE_COLUMN("single_column", List.of(
            StrategyId.SINGLE_COLUMN_LABEL, StrategyId.TWO_COLUMN,
            StrategyId.COMPANY_SPECIFIC, StrategyId.PATTERN_FALLBACK)),
    COMPANY_SPECIFIC("company_specific", List.of(
            StrategyId.COMPANY_SPECIFIC, StrategyId.SINGLE_COLUMN_LABEL,
            StrategyId.TWO_COLUMN, StrategyId.PATTERN_FALLBACK)),
    UNSTRUCTURED("unstructured", List.of(
            StrategyId.PATTERN_FALLBACK, StrategyId.SINGLE_COLUMN_LABEL,
            StrategyId.TWO_COLUMN, StrategyId.COMPANY_SPECIFIC));

    private final String label;
    private final List<StrategyId> evaluationOrder;

    LayoutCategory(String label, List<StrategyId> evaluationOrder) {
        this.label = label;
        this.evaluationOrder = evaluationOrder;
    }

    public String getLabel() {
        return label;
    }

    public List<StrategyId> getEvaluationOrder() {
        return evaluationOrder;
    }

    /**
     * Resolves a model class label. Unknown labels fall back to UNSTRUCTURED.
     */
    public static LayoutCategory fromLabel(String label) {
        if (label == null) {
            return UNSTRUCTURED;
        }
        for (LayoutCategory category : values()) {
            if (category.label.equalsIgnoreCase(label.trim()) || category.name().equalsIgnoreCase(label.trim())) {
                return category;
            }
        }
        return UNSTRUCTURED;
    }
}
