package com.parsely.backend.config;

import java.util.concurrent.Executor;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.parsely.backend.services.extraction.EnsembleMerger;
import com.parsely.backend.services.extraction.ExtractionSettings;
import com.parsely.backend.services.extraction.FieldExtractionService;
import com.parsely.backend.services.extraction.layout.LayoutClassifier;
import com.parsely.backend.services.extraction.layout.LayoutModelLoader;
import com.parsely.backend.services.extraction.layout.RuleBasedLayoutClassifier;
import com.parsely.backend.services.extraction.layout.TrainedLayoutClassifier;
import com.parsely.backend.services.extraction.ml.DisabledLearnedFieldExtractor;
import com.parsely.backend.services.extraction.ml.EntityRecognitionFieldExtractor;
import com.parsely.backend.services.extraction.ml.EntityRecognitionModel;
import com.parsely.backend.services.extraction.ml.LearnedFieldExtractor;
import com.parsely.backend.services.extraction.quality.ConfidenceScorer;
import com.parsely.backend.services.extraction.quality.ConfidenceWeights;
import com.parsely.backend.services.extraction.strategies.ExtractionStrategyFactory;
import com.parsely.backend.services.extraction.strategies.StrategySelector;

import lombok.extern.slf4j.Slf4j;

@Configuration
@EnableConfigurationProperties(ExtractionProperties.class)
@Slf4j
public class ExtractionConfiguration {

    @Bean
    public ExtractionSettings extractionSettings(ExtractionProperties properties) {
        ExtractionSettings settings = properties.toSettings();
        log.info("[Extraction] {}", properties.getDescription());
        return settings;
    }

    @Bean
    public ConfidenceScorer confidenceScorer(ExtractionProperties properties) {
        ConfidenceWeights weights = properties.toWeights();
        log.info("[Extraction] Confidence weights loaded (max attainable {})",
                String.format("%.2f", weights.maxAttainable()));
        return new ConfidenceScorer(weights);
    }

    @Bean
    public ExtractionStrategyFactory extractionStrategyFactory() {
        return new ExtractionStrategyFactory();
    }

    @Bean
    public StrategySelector strategySelector(
            ConfidenceScorer confidenceScorer,
            @Qualifier("strategyEvaluationExecutor") Executor strategyEvaluationExecutor) {
        return new StrategySelector(confidenceScorer, strategyEvaluationExecutor);
    }

    @Bean
    public EnsembleMerger ensembleMerger(ConfidenceScorer confidenceScorer) {
        return new EnsembleMerger(confidenceScorer);
    }

    @Bean
    public LayoutClassifier layoutClassifier(
            ExtractionSettings settings,
            ObjectMapper objectMapper,
            ResourceLoader resourceLoader) {
        RuleBasedLayoutClassifier ruleBased = new RuleBasedLayoutClassifier();
        if (!settings.hasLayoutModel()) {
            log.info("[Extraction] Layout classifier: rule-based");
            return ruleBased;
        }
        return new LayoutModelLoader(objectMapper, resourceLoader)
                .load(settings.layoutModelRef())
                .<LayoutClassifier>map(model -> {
                    log.info("[Extraction] Layout classifier: trained model '{}'", settings.layoutModelRef());
                    return new TrainedLayoutClassifier(model, ruleBased);
                })
                .orElseGet(() -> {
                    log.info("[Extraction] Layout classifier: rule-based (model '{}' unavailable)",
                            settings.layoutModelRef());
                    return ruleBased;
                });
    }

    // The model is supplied by the host application; without one the fallback stays disabled.
    @Bean
    @ConditionalOnProperty(prefix = "parsely.extraction", name = "ml-enabled", havingValue = "true")
    public LearnedFieldExtractor entityRecognitionFieldExtractor(
            ObjectProvider<EntityRecognitionModel> entityRecognitionModel,
            ConfidenceScorer confidenceScorer) {
        EntityRecognitionModel model = entityRecognitionModel.getIfAvailable();
        if (model == null) {
            log.warn("[Extraction] parsely.extraction.ml-enabled=true but no EntityRecognitionModel bean; learned fallback disabled");
            return new DisabledLearnedFieldExtractor();
        }
        log.info("[Extraction] Learned fallback enabled ({})", model.getClass().getSimpleName());
        return new EntityRecognitionFieldExtractor(model, confidenceScorer);
    }

    @Bean
    @ConditionalOnMissingBean(LearnedFieldExtractor.class)
    public LearnedFieldExtractor disabledLearnedFieldExtractor() {
        log.info("[Extraction] Learned fallback disabled (parsely.extraction.ml-enabled=false)");
        return new DisabledLearnedFieldExtractor();
    }

    @Bean
    public FieldExtractionService fieldExtractionService(
            ExtractionStrategyFactory extractionStrategyFactory,
            StrategySelector strategySelector,
            LayoutClassifier layoutClassifier,
            LearnedFieldExtractor learnedFieldExtractor,
            EnsembleMerger ensembleMerger,
            ExtractionSettings extractionSettings,
            @Qualifier("learnedExtractionExecutor") Executor learnedExtractionExecutor) {
        return new FieldExtractionService(
                extractionStrategyFactory,
                strategySelector,
                layoutClassifier,
                learnedFieldExtractor,
                ensembleMerger,
                extractionSettings,
                learnedExtractionExecutor);
    }
}
