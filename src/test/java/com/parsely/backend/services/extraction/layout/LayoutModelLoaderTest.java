package com.parsely.backend.services.extraction.layout;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.ObjectMapper;

class LayoutModelLoaderTest {

    private final LayoutModelLoader loader = new LayoutModelLoader(new ObjectMapper());

    @Test
    void classpathModel_isLoaded() {
        Optional<LayoutModel> model = loader.load("classpath:models/layout-model.json");

        assertTrue(model.isPresent());
        assertEquals("test-1", model.get().getVersion());
        assertEquals(List.of("two_column", "single_column", "company_specific", "unstructured"), model.get().getClasses());
        assertEquals(0.5, model.get().getMinConfidence());
    }

    @Test
    void plainFilePath_isLoaded(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("model.json");
        Files.writeString(file, """
                {"featureNames": ["has_from_to"], "classes": ["two_column", "unstructured"],
                 "weights": [[2.0], [0.0]], "bias": [0.0, 0.5], "extraField": true}
                """);

        assertTrue(loader.load(file.toString()).isPresent());
    }

    @Test
    void missingOrBlankReference_yieldsEmpty() {
        assertTrue(loader.load("").isEmpty());
        assertTrue(loader.load(null).isEmpty());
        assertTrue(loader.load("classpath:models/does-not-exist.json").isEmpty());
        assertTrue(loader.load("/definitely/not/here.json").isEmpty());
    }

    @Test
    void inconsistentModels_areRejected() {
        assertTrue(loader.load("classpath:models/layout-model-mismatched.json").isEmpty());
        assertTrue(loader.load("classpath:models/layout-model-unknown-feature.json").isEmpty());
    }

    @Test
    void malformedJson_yieldsEmpty(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("broken.json");
        Files.writeString(file, "{ not json");

        assertTrue(loader.load(file.toString()).isEmpty());
    }

    @Test
    void validate_reportsZeroScale() {
        LayoutModel model = new LayoutModel();
        model.setFeatureNames(List.of("has_from_to"));
        model.setClasses(List.of("two_column"));
        model.setWeights(new double[][] {{1.0}});
        model.setBias(new double[] {0.0});
        model.setFeatureScales(new double[] {0.0});

        assertEquals(Optional.of("featureScales must not contain zero"), LayoutModelLoader.validate(model));
    }
}
