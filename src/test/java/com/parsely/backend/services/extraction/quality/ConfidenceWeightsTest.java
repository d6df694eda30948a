package com.parsely.backend.services.extraction.quality;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.parsely.backend.services.extraction.InvalidExtractionConfigException;

class ConfidenceWeightsTest {

    @Test
    void defaults_sumToOne() {
        assertEquals(1.0, ConfidenceWeights.defaults().maxAttainable(), 1e-9);
    }

    @Test
    void weightsAboveOne_areRejected() {
        assertThrows(InvalidExtractionConfigException.class, () -> new ConfidenceWeights(
                0.5, 0.5, 0.1, 0.15, 0.15, 0.05, 0.05, 0.05, 0.05, 0.05, 0.05, 0.05));
    }

    @Test
    void negativeWeight_isRejected() {
        assertThrows(InvalidExtractionConfigException.class, () -> new ConfidenceWeights(
                -0.1, 0.2, 0.1, 0.15, 0.15, 0.05, 0.05, 0.05, 0.05, 0.05, 0.05, 0.05));
    }

    @Test
    void partialCreditAboveFullWeight_isRejected() {
        assertThrows(InvalidExtractionConfigException.class, () -> new ConfidenceWeights(
                0.2, 0.2, 0.1, 0.15, 0.15, 0.05, 0.05, 0.05, 0.05, 0.2, 0.05, 0.05));
        assertThrows(InvalidExtractionConfigException.class, () -> new ConfidenceWeights(
                0.2, 0.2, 0.1, 0.15, 0.15, 0.05, 0.05, 0.05, 0.05, 0.05, 0.05, 0.3));
    }

    @Test
    void lowerTotal_lowersTheCeiling() {
        ConfidenceWeights weights = new ConfidenceWeights(
                0.2, 0.2, 0.1, 0.0, 0.0, 0.05, 0.05, 0.05, 0.05, 0.0, 0.0, 0.05);
        assertEquals(0.7, weights.maxAttainable(), 1e-9);
    }
}
