package com.parsely.backend.services.extraction.strategies;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.parsely.backend.enums.LayoutCategory;
import com.parsely.backend.enums.StrategyId;

class ExtractionStrategyFactoryTest {

    private static List<StrategyId> ids(List<ExtractionStrategy> strategies) {
        return strategies.stream().map(ExtractionStrategy::id).toList();
    }

    @Test
    void defaultFactory_holdsFourStrategiesInCanonicalOrder() {
        ExtractionStrategyFactory factory = new ExtractionStrategyFactory();

        assertEquals(List.of(StrategyId.TWO_COLUMN, StrategyId.SINGLE_COLUMN_LABEL,
                StrategyId.COMPANY_SPECIFIC, StrategyId.PATTERN_FALLBACK), ids(factory.getStrategies()));
        assertTrue(factory.getStrategy(StrategyId.COMPANY_SPECIFIC).isPresent());
        assertTrue(factory.getStrategy(StrategyId.LEARNED_FALLBACK).isEmpty());
    }

    @Test
    void registrationOrder_isIrrelevant() {
        ExtractionStrategyFactory factory = new ExtractionStrategyFactory(List.of(
                new PatternFallbackStrategy(), new TwoColumnStrategy()));

        assertEquals(List.of(StrategyId.TWO_COLUMN, StrategyId.PATTERN_FALLBACK), ids(factory.getStrategies()));
    }

    @Test
    void duplicateOrEmptyRegistration_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ExtractionStrategyFactory(List.of()));
        assertThrows(IllegalArgumentException.class, () -> new ExtractionStrategyFactory(List.of(
                new TwoColumnStrategy(), new TwoColumnStrategy())));
    }

    @Test
    void layoutHint_onlyPermutesTheStrategies() {
        ExtractionStrategyFactory factory = new ExtractionStrategyFactory();

        assertEquals(List.of(StrategyId.PATTERN_FALLBACK, StrategyId.SINGLE_COLUMN_LABEL,
                StrategyId.TWO_COLUMN, StrategyId.COMPANY_SPECIFIC), ids(factory.orderFor(LayoutCategory.UNSTRUCTURED)));
        assertEquals(List.of(StrategyId.COMPANY_SPECIFIC, StrategyId.SINGLE_COLUMN_LABEL,
                StrategyId.TWO_COLUMN, StrategyId.PATTERN_FALLBACK), ids(factory.orderFor(LayoutCategory.COMPANY_SPECIFIC)));
        assertEquals(factory.getStrategies(), factory.orderFor(null));
    }

    @Test
    void partialFactory_stillCoversEveryRegisteredStrategy() {
        ExtractionStrategyFactory factory = new ExtractionStrategyFactory(List.of(new TwoColumnStrategy()));
        assertEquals(List.of(StrategyId.TWO_COLUMN), ids(factory.orderFor(LayoutCategory.UNSTRUCTURED)));
    }
}
