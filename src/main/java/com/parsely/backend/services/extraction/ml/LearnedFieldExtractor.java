package com.parsely.backend.services.extraction.ml;

import com.parsely.backend.services.extraction.DocumentText;

public interface LearnedFieldExtractor {

    /**
     * Runs a learned extraction over the document text.
     * Implementations return {@link LearnedExtraction#empty()} instead of throwing.
     */
    LearnedExtraction extract(DocumentText document);

    /**
     * False when no model is configured; callers skip the learned path entirely.
     */
    default boolean isAvailable() {
        return true;
    }
}
