package com.parsely.backend.services.extraction.ml;

import java.util.List;

/**
 * A loaded named-entity model supplied by the hosting application. Register one as a Spring bean
 * and set {@code parsely.extraction.ml-enabled=true} to enable the learned fallback.
 */
@FunctionalInterface
public interface EntityRecognitionModel {

    /**
     * Entities in document order.
     */
    List<RecognizedEntity> recognize(String text);
}
