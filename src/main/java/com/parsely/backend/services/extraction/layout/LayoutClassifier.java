package com.parsely.backend.services.extraction.layout;

import com.parsely.backend.services.extraction.DocumentText;

/**
 * Predicts a layout category so the strategy selector can try the most likely strategy first.
 * The prediction only reorders evaluation; it never changes the selected result.
 */
public interface LayoutClassifier {

    /**
     * Must not throw; implementations fall back to a rule-based guess.
     */
    LayoutPrediction classify(DocumentText document);
}
