package com.parsely.backend.services.extraction.validation;

/**
 * Outcome of validating one raw token. {@code normalized} is {@code null} when the token is invalid.
 */
public record ValidatedToken<T>(String raw, T normalized, boolean valid) {

    public static <T> ValidatedToken<T> valid(String raw, T normalized) {
        return new ValidatedToken<>(raw, normalized, true);
    }

    public static <T> ValidatedToken<T> invalid(String raw) {
        return new ValidatedToken<>(raw, null, false);
    }
}
