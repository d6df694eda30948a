package com.parsely.backend.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;

import jakarta.validation.constraints.AssertTrue;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One document, either as pre-split lines or as raw text. Lines win when both are sent.
 * The optional flags override the configured defaults for this request only.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionRequestDTO {

    private List<String> lines;
    private String text;

    private Boolean mlEnabled;
    private Boolean preferRegex;

    @JsonIgnore
    @AssertTrue(message = "lines or text is required")
    public boolean isContentPresent() {
        return (lines != null && !lines.isEmpty()) || (text != null && !text.isBlank());
    }

    public static ExtractionRequestDTO ofLines(List<String> lines) {
        return new ExtractionRequestDTO(lines, null, null, null);
    }
}
