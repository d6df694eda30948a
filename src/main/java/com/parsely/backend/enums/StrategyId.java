package com.parsely.backend.enums;

/**
 * Identifies where an extraction result came from.
 * The four rule-based strategies are declared in canonical priority order.
 */
public enum StrategyId {
    TWO_COLUMN(0),
    SINGLE_COLUMN_LABEL(1),
    COMPANY_SPECIFIC(2),
    PATTERN_FALLBACK(3),
    LEARNED_FALLBACK(Integer.MAX_VALUE - 1),
    NONE(Integer.MAX_VALUE);

    private final int priority;

    StrategyId(int priority) {
        this.priority = priority;
    }

    /**
     * Lower value wins ties between candidates of equal confidence.
     */
    public int getPriority() {
        return priority;
    }
}
