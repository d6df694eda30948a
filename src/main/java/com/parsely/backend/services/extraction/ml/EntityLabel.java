package com.parsely.backend.services.extraction.ml;

import java.util.Locale;

/**
 * Entity types the learned fallback understands. Anything else maps to {@link #OTHER}.
 */
public enum EntityLabel {
    ORG,
    PERSON,
    MONEY,
    GPE,
    EMAIL,
    OTHER;

    public static EntityLabel fromTag(String tag) {
        if (tag == null || tag.isBlank()) return OTHER;
        try {
            return valueOf(tag.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return OTHER;
        }
    }
}
