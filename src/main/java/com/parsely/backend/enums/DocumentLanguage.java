package com.parsely.backend.enums;

import java.util.Locale;

public enum DocumentLanguage {
    EN,
    DE;

    /**
     * ISO 639-1 code, as passed to amount normalization.
     */
    public String getCode() {
        return name().toLowerCase(Locale.ROOT);
    }
}
