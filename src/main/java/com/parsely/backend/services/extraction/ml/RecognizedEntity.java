package com.parsely.backend.services.extraction.ml;

/**
 * One labelled span returned by an entity-recognition model.
 */
public record RecognizedEntity(String text, EntityLabel label) {

    public RecognizedEntity {
        text = text == null ? "" : text.trim();
        label = label == null ? EntityLabel.OTHER : label;
    }

    public static RecognizedEntity of(String text, String tag) {
        return new RecognizedEntity(text, EntityLabel.fromTag(tag));
    }
}
