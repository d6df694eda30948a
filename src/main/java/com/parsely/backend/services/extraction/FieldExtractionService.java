package com.parsely.backend.services.extraction;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.parsely.backend.enums.FieldName;
import com.parsely.backend.enums.LayoutCategory;
import com.parsely.backend.enums.StrategyId;
import com.parsely.backend.services.extraction.layout.LayoutClassifier;
import com.parsely.backend.services.extraction.layout.LayoutPrediction;
import com.parsely.backend.services.extraction.ml.LearnedExtraction;
import com.parsely.backend.services.extraction.ml.LearnedFieldExtractor;
import com.parsely.backend.services.extraction.strategies.ExtractionStrategy;
import com.parsely.backend.services.extraction.strategies.ExtractionStrategyFactory;
import com.parsely.backend.services.extraction.strategies.StrategySelector;

import lombok.extern.slf4j.Slf4j;

/**
 * Parses one document: layout hint, rule-based strategy selection, optional learned fallback
 * running concurrently, then the ensemble merge. Never throws for document content.
 */
@Slf4j
public class FieldExtractionService {

    private final ExtractionStrategyFactory strategyFactory;
    private final StrategySelector strategySelector;
    private final LayoutClassifier layoutClassifier;
    private final LearnedFieldExtractor learnedFieldExtractor;
    private final EnsembleMerger ensembleMerger;
    private final ExtractionSettings defaultSettings;
    private final Executor learnedExtractionExecutor;

    public FieldExtractionService(
            ExtractionStrategyFactory strategyFactory,
            StrategySelector strategySelector,
            LayoutClassifier layoutClassifier,
            LearnedFieldExtractor learnedFieldExtractor,
            EnsembleMerger ensembleMerger,
            ExtractionSettings defaultSettings,
            Executor learnedExtractionExecutor) {
        if (strategyFactory == null || strategySelector == null || ensembleMerger == null) {
            throw new IllegalArgumentException("Strategy factory, selector and merger are required");
        }
        this.strategyFactory = strategyFactory;
        this.strategySelector = strategySelector;
        this.layoutClassifier = layoutClassifier;
        this.learnedFieldExtractor = learnedFieldExtractor;
        this.ensembleMerger = ensembleMerger;
        this.defaultSettings = defaultSettings == null ? ExtractionSettings.defaults() : defaultSettings;
        this.learnedExtractionExecutor = learnedExtractionExecutor;
    }

    public ExtractionSettings getDefaultSettings() {
        return defaultSettings;
    }

    public ExtractionResult parse(List<String> lines) {
        return parse(lines, defaultSettings);
    }

    public ExtractionResult parse(List<String> lines, ExtractionSettings settings) {
        ExtractionSettings s = settings == null ? defaultSettings : settings;
        DocumentText document = DocumentText.of(lines);

        if (document.isBlank()) {
            log.info("[FieldExtraction] Empty document; returning unresolved result");
            return ExtractionResult.unresolved(s.confidenceThreshold());
        }

        CompletableFuture<LearnedExtraction> learnedFuture = startLearnedExtraction(document, s);

        List<ExtractionStrategy> order = evaluationOrder(document);
        StrategySelector.Selection selection = strategySelector.select(order, document, s.parallelStrategies());

        LearnedExtraction learned = awaitLearnedExtraction(learnedFuture, s);
        if (learned.isEmpty()) {
            ExtractionResult result = new ExtractionResult(
                    selection.fields(), selection.confidence(), selection.source(), Set.of(), s.confidenceThreshold());
            logResult(result);
            return result;
        }

        EnsembleMerger.MergeOutcome merged = ensembleMerger.merge(
                selection.fields(), selection.confidence(), learned, s.preferRegex(), s.mlMinConfidence());

        StrategyId source = selection.source();
        if (source == StrategyId.NONE && !merged.learnedFields().isEmpty()) {
            source = StrategyId.LEARNED_FALLBACK;
        }

        ExtractionResult result = new ExtractionResult(
                merged.fields(), merged.confidence(), source, merged.learnedFields(), s.confidenceThreshold());
        logResult(result);
        return result;
    }

    private List<ExtractionStrategy> evaluationOrder(DocumentText document) {
        if (layoutClassifier == null) {
            return strategyFactory.getStrategies();
        }
        try {
            LayoutPrediction prediction = layoutClassifier.classify(document);
            LayoutCategory category = prediction == null ? null : prediction.category();
            log.debug("[FieldExtraction] Layout hint: {} ({})",
                    category == null ? "none" : category.getLabel(),
                    prediction == null ? "-" : prediction.classifier());
            return strategyFactory.orderFor(category);
        } catch (RuntimeException e) {
            log.warn("[FieldExtraction] Layout classification failed ({}); using canonical order", e.getMessage());
            return strategyFactory.getStrategies();
        }
    }

    private CompletableFuture<LearnedExtraction> startLearnedExtraction(DocumentText document, ExtractionSettings s) {
        if (!s.mlEnabled() || learnedFieldExtractor == null || !learnedFieldExtractor.isAvailable()) {
            return null;
        }
        try {
            return learnedExtractionExecutor == null
                    ? CompletableFuture.supplyAsync(() -> learnedFieldExtractor.extract(document))
                    : CompletableFuture.supplyAsync(() -> learnedFieldExtractor.extract(document), learnedExtractionExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("[FieldExtraction] Learned fallback not scheduled ({}); continuing rule-only", e.getMessage());
            return null;
        }
    }

    private LearnedExtraction awaitLearnedExtraction(CompletableFuture<LearnedExtraction> future, ExtractionSettings s) {
        if (future == null) {
            return LearnedExtraction.empty();
        }
        try {
            LearnedExtraction learned = future.get(s.mlTimeout().toMillis(), TimeUnit.MILLISECONDS);
            return learned == null ? LearnedExtraction.empty() : learned;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[FieldExtraction] Learned fallback timed out after {} ms; continuing rule-only", s.mlTimeout().toMillis());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[FieldExtraction] Learned fallback failed ({}); continuing rule-only", cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[FieldExtraction] Interrupted while waiting for learned fallback; continuing rule-only");
        }
        return LearnedExtraction.empty();
    }

    private static void logResult(ExtractionResult result) {
        log.info("[FieldExtraction] source={} confidence={} resolved={}/{} review={}",
                result.source(),
                String.format("%.3f", result.confidence()),
                result.fieldMap().resolvedCount(),
                FieldName.values().length,
                result.requiresReview());
    }
}
