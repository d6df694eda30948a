package com.parsely.backend.services.extraction;

import java.util.Objects;
import java.util.Optional;

/**
 * A single extracted value: either a non-blank resolved string or {@link #UNRESOLVED}.
 */
public final class FieldValue {

    public static final FieldValue UNRESOLVED = new FieldValue(null);

    private final String value;

    private FieldValue(String value) {
        this.value = value;
    }

    /**
     * Trims the input; null or blank input yields {@link #UNRESOLVED}.
     */
    public static FieldValue of(String raw) {
        if (raw == null) return UNRESOLVED;
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) return UNRESOLVED;
        return new FieldValue(trimmed);
    }

    public boolean isResolved() {
        return value != null;
    }

    public String get() {
        if (value == null) {
            throw new IllegalStateException("Field is unresolved");
        }
        return value;
    }

    public Optional<String> asOptional() {
        return Optional.ofNullable(value);
    }

    public String orElse(String fallback) {
        return value != null ? value : fallback;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldValue other)) return false;
        return Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return value != null ? value : "UNRESOLVED";
    }
}
