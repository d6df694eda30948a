package com.parsely.backend.services.extraction.strategies;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

import com.parsely.backend.enums.StrategyId;
import com.parsely.backend.services.extraction.DocumentText;
import com.parsely.backend.services.extraction.FieldMap;
import com.parsely.backend.services.extraction.quality.ConfidenceScorer;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs the applicable strategies and picks the field map with the strictly highest confidence.
 * Equal confidences go to the strategy with the lower canonical priority, so neither the evaluation
 * order nor the completion order of parallel runs can change the winner. When every applicable map
 * scores 0, the highest-priority map that still resolves a field (payment method, routing or account
 * number carry no weight) is chosen.
 */
@Slf4j
public class StrategySelector {

    private static final double TIE_EPSILON = 1e-9;

    private final ConfidenceScorer scorer;
    private final Executor executor;

    public StrategySelector(ConfidenceScorer scorer) {
        this(scorer, null);
    }

    /**
     * @param executor used for parallel evaluation; {@code null} restricts the selector to sequential runs
     */
    public StrategySelector(ConfidenceScorer scorer, Executor executor) {
        if (scorer == null) {
            throw new IllegalArgumentException("ConfidenceScorer is required");
        }
        this.scorer = scorer;
        this.executor = executor;
    }

    public record Candidate(
            ExtractionStrategy strategy,
            boolean applicable,
            FieldMap fields,
            double confidence
    ) {
        static Candidate notApplicable(ExtractionStrategy strategy) {
            return new Candidate(strategy, false, FieldMap.unresolved(), 0.0);
        }

        public StrategyId id() {
            return strategy.id();
        }
    }

    /**
     * {@code chosen} is {@code null} when nothing applied or no applicable strategy resolved a field.
     */
    public record Selection(
            Candidate chosen,
            List<Candidate> evaluated
    ) {
        public FieldMap fields() {
            return chosen == null ? FieldMap.unresolved() : chosen.fields();
        }

        public double confidence() {
            return chosen == null ? 0.0 : chosen.confidence();
        }

        public StrategyId source() {
            return chosen == null ? StrategyId.NONE : chosen.id();
        }
    }

    public Selection select(List<ExtractionStrategy> evaluationOrder, DocumentText document) {
        return select(evaluationOrder, document, false);
    }

    public Selection select(List<ExtractionStrategy> evaluationOrder, DocumentText document, boolean parallel) {
        if (evaluationOrder == null || evaluationOrder.isEmpty()) {
            throw new IllegalArgumentException("No extraction strategy is configured");
        }
        DocumentText doc = document == null ? DocumentText.of(List.of()) : document;

        List<Candidate> evaluated = parallel && executor != null
                ? evaluateInParallel(evaluationOrder, doc)
                : evaluateSequentially(evaluationOrder, doc);

        Candidate best = null;
        for (Candidate candidate : evaluated) {
            if (candidate.applicable() && isBetter(candidate, best)) {
                best = candidate;
            }
        }

        if (best != null && best.confidence() <= 0.0) {
            best = firstNonEmpty(evaluated);
        }
        if (best == null) {
            log.info("[StrategySelector] No strategy produced a usable result ({} evaluated)", evaluated.size());
            return new Selection(null, Collections.unmodifiableList(evaluated));
        }

        log.info("[StrategySelector] Selected {} with confidence {}", best.id(), String.format("%.3f", best.confidence()));
        return new Selection(best, Collections.unmodifiableList(evaluated));
    }

    private List<Candidate> evaluateSequentially(List<ExtractionStrategy> order, DocumentText document) {
        List<Candidate> evaluated = new ArrayList<>();
        Candidate best = null;
        double ceiling = scorer.maxAttainable();

        for (int i = 0; i < order.size(); i++) {
            ExtractionStrategy strategy = order.get(i);
            if (strategy == null) continue;

            Candidate candidate = evaluate(strategy, document);
            evaluated.add(candidate);
            if (candidate.applicable() && isBetter(candidate, best)) {
                best = candidate;
            }

            if (best != null && best.confidence() >= ceiling - TIE_EPSILON
                    && !anyOutranks(order.subList(i + 1, order.size()), best.id())) {
                log.debug("[StrategySelector] Early exit after {}: maximum confidence reached", strategy.id());
                break;
            }
        }
        return evaluated;
    }

    private List<Candidate> evaluateInParallel(List<ExtractionStrategy> order, DocumentText document) {
        List<CompletableFuture<Candidate>> futures = new ArrayList<>();
        for (ExtractionStrategy strategy : order) {
            if (strategy == null) continue;
            futures.add(CompletableFuture
                    .supplyAsync(() -> evaluate(strategy, document), executor)
                    .exceptionally(ex -> {
                        log.warn("[StrategySelector] {} failed in parallel run: {}", strategy.id(), rootMessage(ex));
                        return Candidate.notApplicable(strategy);
                    }));
        }
        List<Candidate> evaluated = new ArrayList<>(futures.size());
        for (CompletableFuture<Candidate> future : futures) {
            evaluated.add(future.join());
        }
        return evaluated;
    }

    private Candidate evaluate(ExtractionStrategy strategy, DocumentText document) {
        boolean applicable;
        try {
            applicable = strategy.canHandle(document);
        } catch (RuntimeException e) {
            log.warn("[StrategySelector] {}.canHandle failed: {}", strategy.id(), e.getMessage());
            return Candidate.notApplicable(strategy);
        }
        if (!applicable) {
            log.debug("[StrategySelector] {} not applicable", strategy.id());
            return Candidate.notApplicable(strategy);
        }

        FieldMap fields;
        try {
            fields = strategy.parse(document);
            if (fields == null) fields = FieldMap.unresolved();
        } catch (RuntimeException e) {
            log.warn("[StrategySelector] {}.parse failed: {}", strategy.id(), e.getMessage());
            return Candidate.notApplicable(strategy);
        }
        double confidence = scorer.score(fields);
        log.debug("[StrategySelector] {} -> confidence={} resolved={}",
                strategy.id(), String.format("%.3f", confidence), fields.resolvedCount());
        return new Candidate(strategy, true, fields, confidence);
    }

    /**
     * Strictly higher confidence wins; on a tie the lower canonical priority wins.
     */
    static boolean isBetter(Candidate candidate, Candidate best) {
        if (best == null) return true;
        double diff = candidate.confidence() - best.confidence();
        if (diff > TIE_EPSILON) return true;
        if (diff < -TIE_EPSILON) return false;
        return candidate.id().getPriority() < best.id().getPriority();
    }

    private static Candidate firstNonEmpty(List<Candidate> evaluated) {
        Candidate chosen = null;
        for (Candidate candidate : evaluated) {
            if (!candidate.applicable() || candidate.fields().isEmpty()) continue;
            if (chosen == null || candidate.id().getPriority() < chosen.id().getPriority()) {
                chosen = candidate;
            }
        }
        return chosen;
    }

    private static boolean anyOutranks(List<ExtractionStrategy> remaining, StrategyId bestId) {
        for (ExtractionStrategy strategy : remaining) {
            if (strategy != null && strategy.id().getPriority() < bestId.getPriority()) return true;
        }
        return false;
    }

    private static String rootMessage(Throwable ex) {
        Throwable t = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        return t.getMessage();
    }
}
