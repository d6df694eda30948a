package com.parsely.backend.dto;

import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BatchExtractionRequestDTO {

    @NotEmpty(message = "documents is required")
    @Size(max = 100, message = "at most 100 documents per batch")
    private List<@Valid ExtractionRequestDTO> documents;
}
