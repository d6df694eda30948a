package com.parsely.backend.services.extraction.strategies;

import com.parsely.backend.enums.StrategyId;
import com.parsely.backend.services.extraction.DocumentText;
import com.parsely.backend.services.extraction.FieldMap;

/**
 * One rule-based way of reading invoice fields. Implementations are stateless and thread-safe.
 */
public interface ExtractionStrategy {

    StrategyId id();

    /**
     * Fast structural pre-check. A {@code true} answer does not promise that any field resolves.
     */
    boolean canHandle(DocumentText document);

    /**
     * Never throws for document content; fields that cannot be read stay unresolved.
     */
    FieldMap parse(DocumentText document);
}
