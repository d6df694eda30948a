package com.parsely.backend.services.extraction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.Test;

class ExtractionSettingsTest {

    @Test
    void defaults_matchDocumentedValues() {
        ExtractionSettings settings = ExtractionSettings.defaults();

        assertEquals(0.9, settings.confidenceThreshold());
        assertFalse(settings.mlEnabled());
        assertEquals(0.5, settings.mlMinConfidence());
        assertTrue(settings.preferRegex());
        assertFalse(settings.hasLayoutModel());
        assertFalse(settings.parallelStrategies());
        assertEquals(Duration.ofMillis(500), settings.mlTimeout());
    }

    @Test
    void outOfRangeThresholds_areRejected() {
        assertThrows(InvalidExtractionConfigException.class,
                () -> new ExtractionSettings(1.5, false, 0.5, true, "", false, null));
        assertThrows(InvalidExtractionConfigException.class,
                () -> new ExtractionSettings(0.9, false, -0.1, true, "", false, null));
        assertThrows(InvalidExtractionConfigException.class,
                () -> new ExtractionSettings(Double.NaN, false, 0.5, true, "", false, null));
    }

    @Test
    void nonPositiveTimeout_isRejected() {
        assertThrows(InvalidExtractionConfigException.class,
                () -> ExtractionSettings.defaults().withMlTimeout(Duration.ZERO));
    }

    @Test
    void copies_changeOnlyTheNamedOption() {
        ExtractionSettings base = ExtractionSettings.defaults();
        ExtractionSettings changed = base.withMlEnabled(true).withPreferRegex(false);

        assertTrue(changed.mlEnabled());
        assertFalse(changed.preferRegex());
        assertEquals(base.confidenceThreshold(), changed.confidenceThreshold());
        assertEquals(base.mlTimeout(), changed.mlTimeout());
    }

    @Test
    void layoutModelRef_isTrimmed() {
        ExtractionSettings settings = new ExtractionSettings(0.9, false, 0.5, true, "  classpath:m.json ", false, null);
        assertEquals("classpath:m.json", settings.layoutModelRef());
        assertTrue(settings.hasLayoutModel());
    }
}
