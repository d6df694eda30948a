package com.parsely.backend.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertFalse;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.test.context.TestPropertySource;

import com.parsely.backend.enums.FieldName;
import com.parsely.backend.enums.LayoutCategory;
import com.parsely.backend.enums.StrategyId;
import com.parsely.backend.services.extraction.DocumentText;
import com.parsely.backend.services.extraction.ExtractionResult;
import com.parsely.backend.services.extraction.FieldExtractionService;
import com.parsely.backend.services.extraction.layout.LayoutClassifier;
import com.parsely.backend.services.extraction.layout.TrainedLayoutClassifier;
import com.parsely.backend.services.extraction.ml.EntityRecognitionFieldExtractor;
import com.parsely.backend.services.extraction.ml.EntityRecognitionModel;
import com.parsely.backend.services.extraction.ml.LearnedFieldExtractor;
import com.parsely.backend.services.extraction.ml.RecognizedEntity;

@SpringBootTest
@TestPropertySource(properties = {
        "parsely.extraction.ml-enabled=true",
        "parsely.extraction.layout-model-ref=classpath:models/layout-model.json",
        "parsely.extraction.ml-min-confidence=0.3",
        "parsely.extraction.confidence-threshold=0.3"
})
class ExtractionConfigurationTest {

    @TestConfiguration
    static class ModelConfig {
        @Bean
        EntityRecognitionModel entityRecognitionModel() {
            return text -> List.of(
                    RecognizedEntity.of("Acme Corporation", "ORG"),
                    RecognizedEntity.of("Globex Industries", "ORG"));
        }
    }

    @Autowired
    private LayoutClassifier layoutClassifier;

    @Autowired
    private LearnedFieldExtractor learnedFieldExtractor;

    @Autowired
    private FieldExtractionService fieldExtractionService;

    @Test
    void trainedLayoutModel_isWiredFromProperties() {
        assertInstanceOf(TrainedLayoutClassifier.class, layoutClassifier);
        assertEquals(LayoutCategory.TWO_COLUMN,
                layoutClassifier.classify(DocumentText.of(List.of("From: A", "To: B"))).category());
    }

    @Test
    void learnedFallback_isWiredWhenEnabledAndModelPresent() {
        assertInstanceOf(EntityRecognitionFieldExtractor.class, learnedFieldExtractor);

        ExtractionResult result = fieldExtractionService.parse(List.of("thank you for your business"));

        assertEquals(StrategyId.LEARNED_FALLBACK, result.source());
        assertEquals("Globex Industries", result.get(FieldName.RECIPIENT).get());
        assertFalse(result.requiresReview());
    }
}
