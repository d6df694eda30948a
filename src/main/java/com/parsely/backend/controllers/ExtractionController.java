package com.parsely.backend.controllers;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.parsely.backend.dto.ApiResponse;
import com.parsely.backend.dto.BatchExtractionRequestDTO;
import com.parsely.backend.dto.ExtractionRequestDTO;
import com.parsely.backend.dto.ExtractionResponseDTO;
import com.parsely.backend.services.ExtractionService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/extractions")
@RequiredArgsConstructor
public class ExtractionController {

    private final ExtractionService extractionService;

    @PostMapping
    public ResponseEntity<ApiResponse<ExtractionResponseDTO>> extract(
            @Valid @RequestBody ExtractionRequestDTO request
    ) {
        ExtractionResponseDTO result = extractionService.extract(request);
        return ResponseEntity.ok(ApiResponse.success(result, "Fields extracted"));
    }

    @PostMapping("/batch")
    public ResponseEntity<ApiResponse<List<ExtractionResponseDTO>>> extractBatch(
            @Valid @RequestBody BatchExtractionRequestDTO request
    ) {
        List<ExtractionResponseDTO> results = extractionService.extractAll(request.getDocuments());
        return ResponseEntity.ok(ApiResponse.success(results, results.size() + " documents processed"));
    }
}
