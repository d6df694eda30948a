package com.parsely.backend.services.extraction.strategies;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.parsely.backend.enums.LayoutCategory;
import com.parsely.backend.enums.StrategyId;

/**
 * Holds the rule-based strategies in canonical priority order
 * (TwoColumn, SingleColumnLabel, CompanySpecific, PatternFallback).
 */
public class ExtractionStrategyFactory {

    private final List<ExtractionStrategy> strategies;
    private final Map<StrategyId, ExtractionStrategy> byId = new EnumMap<>(StrategyId.class);

    public ExtractionStrategyFactory() {
        this(defaultStrategies());
    }

    private static List<ExtractionStrategy> defaultStrategies() {
        List<ExtractionStrategy> structured = List.of(
                new TwoColumnStrategy(),
                new SingleColumnLabelStrategy(),
                new CompanySpecificStrategy());
        List<ExtractionStrategy> all = new ArrayList<>(structured);
        all.add(new PatternFallbackStrategy(structured));
        return all;
    }

    /**
     * Strategies are re-sorted by {@link StrategyId#getPriority()}; registration order is irrelevant.
     */
    public ExtractionStrategyFactory(List<ExtractionStrategy> strategies) {
        if (strategies == null || strategies.isEmpty()) {
            throw new IllegalArgumentException("At least one extraction strategy is required");
        }
        List<ExtractionStrategy> sorted = new ArrayList<>(strategies);
        sorted.sort((a, b) -> Integer.compare(a.id().getPriority(), b.id().getPriority()));
        for (ExtractionStrategy strategy : sorted) {
            if (byId.putIfAbsent(strategy.id(), strategy) != null) {
                throw new IllegalArgumentException("Duplicate strategy id: " + strategy.id());
            }
        }
        this.strategies = List.copyOf(sorted);
    }

    public List<ExtractionStrategy> getStrategies() {
        return strategies;
    }

    public Optional<ExtractionStrategy> getStrategy(StrategyId id) {
        return Optional.ofNullable(byId.get(id));
    }

    /**
     * The canonical strategies permuted into the layout's evaluation order. Strategies the layout
     * does not mention keep their canonical relative order at the end.
     */
    public List<ExtractionStrategy> orderFor(LayoutCategory category) {
        if (category == null) return strategies;
        List<ExtractionStrategy> ordered = new ArrayList<>(strategies.size());
        for (StrategyId id : category.getEvaluationOrder()) {
            getStrategy(id).ifPresent(ordered::add);
        }
        for (ExtractionStrategy strategy : strategies) {
            if (!ordered.contains(strategy)) ordered.add(strategy);
        }
        return List.copyOf(ordered);
    }
}
