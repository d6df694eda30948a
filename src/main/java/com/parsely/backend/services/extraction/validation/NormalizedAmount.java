package com.parsely.backend.services.extraction.validation;

import java.math.BigDecimal;
import java.math.RoundingMode;

import com.parsely.backend.enums.AmountLocale;

/**
 * Result of reading a monetary token. {@code amount} is {@code null} when {@code valid} is false.
 */
public record NormalizedAmount(String raw, BigDecimal amount, AmountLocale locale, boolean valid) {

    static NormalizedAmount invalid(String raw, AmountLocale locale) {
        return new NormalizedAmount(raw, null, locale, false);
    }

    /**
     * Plain decimal string with two fraction digits, e.g. {@code 1234.56}.
     */
    public String toPlainString() {
        if (!valid) {
            throw new IllegalStateException("Amount '" + raw + "' is not valid");
        }
        return amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}
