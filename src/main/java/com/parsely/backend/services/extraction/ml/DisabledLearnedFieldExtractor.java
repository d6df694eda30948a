package com.parsely.backend.services.extraction.ml;

import com.parsely.backend.services.extraction.DocumentText;

public class DisabledLearnedFieldExtractor implements LearnedFieldExtractor {

    @Override
    public LearnedExtraction extract(DocumentText document) {
        return LearnedExtraction.empty();
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
