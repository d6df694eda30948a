package com.parsely.backend.services;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import com.parsely.backend.dto.ExtractionRequestDTO;
import com.parsely.backend.dto.ExtractionResponseDTO;
import com.parsely.backend.services.extraction.DocumentText;
import com.parsely.backend.services.extraction.ExtractionResult;
import com.parsely.backend.services.extraction.ExtractionSettings;
import com.parsely.backend.services.extraction.FieldExtractionService;

import lombok.extern.slf4j.Slf4j;

/**
 * Request-level entry point: applies per-request overrides and fans batches out over a worker pool.
 * Batch results keep the order of the submitted documents.
 */
@Service
@Slf4j
public class ExtractionService {

    private final FieldExtractionService fieldExtractionService;
    private final Executor batchExecutor;

    public ExtractionService(
            FieldExtractionService fieldExtractionService,
            @Qualifier("extractionBatchExecutor") Executor batchExecutor) {
        this.fieldExtractionService = fieldExtractionService;
        this.batchExecutor = batchExecutor;
    }

    public ExtractionResponseDTO extract(ExtractionRequestDTO request) {
        if (request == null) {
            throw new IllegalArgumentException("Request body is required");
        }
        ExtractionResult result = fieldExtractionService.parse(linesOf(request), settingsFor(request));
        return ExtractionResponseDTO.from(result);
    }

    public List<ExtractionResponseDTO> extractAll(List<ExtractionRequestDTO> requests) {
        if (requests == null || requests.isEmpty()) {
            throw new IllegalArgumentException("At least one document is required");
        }
        log.info("[Extraction] Batch of {} documents", requests.size());

        List<CompletableFuture<ExtractionResponseDTO>> futures = new ArrayList<>(requests.size());
        for (ExtractionRequestDTO request : requests) {
            futures.add(CompletableFuture.supplyAsync(() -> extract(request), batchExecutor));
        }

        List<ExtractionResponseDTO> responses = new ArrayList<>(futures.size());
        for (CompletableFuture<ExtractionResponseDTO> future : futures) {
            try {
                responses.add(future.join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof RuntimeException runtime) {
                    throw runtime;
                }
                throw new IllegalStateException("Batch extraction failed", cause);
            }
        }
        return responses;
    }

    private ExtractionSettings settingsFor(ExtractionRequestDTO request) {
        ExtractionSettings settings = fieldExtractionService.getDefaultSettings();
        if (request.getMlEnabled() != null) {
            settings = settings.withMlEnabled(request.getMlEnabled());
        }
        if (request.getPreferRegex() != null) {
            settings = settings.withPreferRegex(request.getPreferRegex());
        }
        return settings;
    }

    private static List<String> linesOf(ExtractionRequestDTO request) {
        if (request.getLines() != null && !request.getLines().isEmpty()) {
            return request.getLines();
        }
        return DocumentText.ofText(request.getText()).lines();
    }
}
