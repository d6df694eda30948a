package com.parsely.backend.services.extraction.layout;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.parsely.backend.enums.LayoutCategory;
import com.parsely.backend.services.extraction.DocumentText;

class TrainedLayoutClassifierTest {

    private static LayoutModel testModel() {
        return new LayoutModelLoader(new ObjectMapper()).load("classpath:models/layout-model.json").orElseThrow();
    }

    @Test
    void confidentPrediction_isUsed() {
        LayoutClassifier fallback = mock(LayoutClassifier.class);
        TrainedLayoutClassifier classifier = new TrainedLayoutClassifier(testModel(), fallback);

        LayoutPrediction prediction = classifier.classify(DocumentText.of(List.of("From: Acme", "To: Globex")));

        assertEquals(LayoutCategory.TWO_COLUMN, prediction.category());
        assertEquals(LayoutPrediction.TRAINED, prediction.classifier());
        verify(fallback, never()).classify(any());
    }

    @Test
    void probabilities_sumToOne() {
        TrainedLayoutClassifier classifier = new TrainedLayoutClassifier(testModel(), null);

        double[] p = classifier.predictProbabilities(DocumentText.of(List.of("Sender: Acme")));

        double sum = 0.0;
        for (double v : p) sum += v;
        assertEquals(1.0, sum, 1e-9);
        assertEquals(4, p.length);
    }

    @Test
    void lowConfidence_defersToFallback() {
        LayoutClassifier fallback = mock(LayoutClassifier.class);
        LayoutPrediction ruleBased = new LayoutPrediction(LayoutCategory.SINGLE_COLUMN, 1.0, LayoutPrediction.RULE_BASED);
        when(fallback.classify(any())).thenReturn(ruleBased);
        TrainedLayoutClassifier classifier = new TrainedLayoutClassifier(testModel(), fallback);

        // No feature fires: unstructured leads with about 0.48, under the 0.5 minimum.
        LayoutPrediction prediction = classifier.classify(DocumentText.of(List.of("plain words only")));

        assertEquals(ruleBased, prediction);
    }

    @Test
    void scoringFailure_defersToFallback() {
        LayoutModel broken = testModel();
        broken.setBias(new double[] {0.0});
        TrainedLayoutClassifier classifier = new TrainedLayoutClassifier(broken, new RuleBasedLayoutClassifier());

        LayoutPrediction prediction = classifier.classify(DocumentText.of(List.of("From: Acme", "To: Globex")));

        assertEquals(LayoutPrediction.RULE_BASED, prediction.classifier());
        assertEquals(LayoutCategory.TWO_COLUMN, prediction.category());
    }

    @Test
    void modelIsRequired() {
        assertThrows(IllegalArgumentException.class, () -> new TrainedLayoutClassifier(null, null));
    }
}
