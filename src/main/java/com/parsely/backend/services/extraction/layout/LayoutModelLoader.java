package com.parsely.backend.services.extraction.layout;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Optional;

import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.parsely.backend.enums.LayoutCategory;

import lombok.extern.slf4j.Slf4j;

/**
 * Reads a {@link LayoutModel} from a file path, a {@code file:} URL or a {@code classpath:} resource.
 * Missing, unreadable or inconsistent models yield an empty result; nothing is thrown.
 */
@Slf4j
public class LayoutModelLoader {

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;

    public LayoutModelLoader(ObjectMapper objectMapper) {
        this(objectMapper, new DefaultResourceLoader());
    }

    public LayoutModelLoader(ObjectMapper objectMapper, ResourceLoader resourceLoader) {
        this.objectMapper = objectMapper;
        this.resourceLoader = resourceLoader;
    }

    public Optional<LayoutModel> load(String modelRef) {
        if (modelRef == null || modelRef.isBlank()) {
            return Optional.empty();
        }

        Resource resource = resolve(modelRef.trim());
        if (!resource.exists()) {
            log.warn("[LayoutModelLoader] Model '{}' not found; using rule-based layout classification", modelRef);
            return Optional.empty();
        }

        LayoutModel model;
        try (InputStream in = resource.getInputStream()) {
            model = objectMapper.readValue(in, LayoutModel.class);
        } catch (IOException e) {
            log.warn("[LayoutModelLoader] Could not read model '{}': {}", modelRef, e.getMessage());
            return Optional.empty();
        }

        Optional<String> problem = validate(model);
        if (problem.isPresent()) {
            log.warn("[LayoutModelLoader] Rejected model '{}': {}", modelRef, problem.get());
            return Optional.empty();
        }

        log.info("[LayoutModelLoader] Loaded layout model '{}' (version={}, features={}, classes={})",
                modelRef, model.getVersion(), model.getFeatureNames().size(), model.getClasses());
        return Optional.of(model);
    }

    private Resource resolve(String modelRef) {
        if (modelRef.startsWith("classpath:") || modelRef.startsWith("file:")) {
            return resourceLoader.getResource(modelRef);
        }
        return new FileSystemResource(modelRef);
    }

    /**
     * Shape and value checks; returns the first problem found.
     */
    static Optional<String> validate(LayoutModel model) {
        if (model == null) return Optional.of("empty document");

        if (model.getFeatureNames() == null || model.getFeatureNames().isEmpty()) {
            return Optional.of("featureNames is empty");
        }
        for (String name : model.getFeatureNames()) {
            if (!LayoutFeatureExtractor.FEATURE_NAMES.contains(name)) {
                return Optional.of("unknown feature '" + name + "'");
            }
        }
        int featureCount = model.getFeatureNames().size();

        if (model.getClasses() == null || model.getClasses().isEmpty()) {
            return Optional.of("classes is empty");
        }
        for (String label : model.getClasses()) {
            boolean known = Arrays.stream(LayoutCategory.values()).anyMatch(c -> c.getLabel().equals(label));
            if (!known) return Optional.of("unknown class '" + label + "'");
        }
        int classCount = model.getClasses().size();

        double[][] weights = model.getWeights();
        if (weights == null || weights.length != classCount) {
            return Optional.of("weights must have one row per class");
        }
        for (double[] row : weights) {
            if (row == null || row.length != featureCount) {
                return Optional.of("each weight row must have one value per feature");
            }
            if (!allFinite(row)) return Optional.of("weights contain non-finite values");
        }

        if (model.getBias() == null || model.getBias().length != classCount || !allFinite(model.getBias())) {
            return Optional.of("bias must have one finite value per class");
        }

        if (model.getFeatureMeans() != null
                && (model.getFeatureMeans().length != featureCount || !allFinite(model.getFeatureMeans()))) {
            return Optional.of("featureMeans must have one finite value per feature");
        }
        if (model.getFeatureScales() != null) {
            if (model.getFeatureScales().length != featureCount || !allFinite(model.getFeatureScales())) {
                return Optional.of("featureScales must have one finite value per feature");
            }
            for (double scale : model.getFeatureScales()) {
                if (scale == 0.0) return Optional.of("featureScales must not contain zero");
            }
        }

        if (model.getMinConfidence() < 0.0 || model.getMinConfidence() > 1.0) {
            return Optional.of("minConfidence must be within [0, 1]");
        }
        return Optional.empty();
    }

    private static boolean allFinite(double[] values) {
        for (double v : values) {
            if (!Double.isFinite(v)) return false;
        }
        return true;
    }
}
