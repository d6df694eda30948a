package com.parsely.backend.dto;

import java.util.List;
import java.util.Map;

import com.parsely.backend.enums.FieldName;
import com.parsely.backend.services.extraction.ExtractionResult;

import lombok.Builder;
import lombok.Data;

/**
 * Every field key is always present; unresolved fields are serialized as {@code null}.
 */
@Data
@Builder
public class ExtractionResponseDTO {
    private Map<String, String> fields;
    private List<String> unresolvedFields;
    private double confidence;
    private String strategy;
    private boolean requiresReview;
    private List<String> learnedFields;

    public static ExtractionResponseDTO from(ExtractionResult result) {
        return ExtractionResponseDTO.builder()
                .fields(result.fieldMap().toKeyedMap())
                .unresolvedFields(result.fieldMap().unresolvedFields().stream().map(FieldName::getKey).toList())
                .confidence(result.confidence())
                .strategy(result.source().name())
                .requiresReview(result.requiresReview())
                .learnedFields(result.learnedFields().stream().sorted().map(FieldName::getKey).toList())
                .build();
    }
}
