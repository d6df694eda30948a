package com.parsely.backend.services.extraction.validation;

public final class EmailValidator {

    private EmailValidator() {
    }

    /**
     * One {@code @}, a non-empty local part, and a dotted domain without empty segments.
     */
    public static boolean isValidEmail(String token) {
        if (token == null) return false;
        String email = token.trim();
        if (email.isEmpty() || email.chars().anyMatch(Character::isWhitespace)) return false;

        int at = email.indexOf('@');
        if (at <= 0 || at != email.lastIndexOf('@')) return false;

        String domain = email.substring(at + 1);
        if (!domain.contains(".")) return false;

        for (String segment : domain.split("\\.", -1)) {
            if (segment.isEmpty()) return false;
        }
        return true;
    }
}
