package com.parsely.backend.services.extraction.validation;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

import com.parsely.backend.enums.AmountLocale;

import lombok.extern.slf4j.Slf4j;

/**
 * Reads amount tokens written with either US ("1,234.56") or EU ("1.234,56") separators.
 *
 * <ul>
 * <li>Both separators present: the one appearing last is the decimal separator.</li>
 * <li>One separator type repeated: it groups thousands.</li>
 * <li>One separator occurring once, not followed by exactly three digits: it is the decimal separator.</li>
 * <li>One separator occurring once and followed by exactly three digits: the language hint decides,
 * then the currency hint, then US style.</li>
 * </ul>
 * Unparsable and non-positive tokens yield {@code valid=false}; nothing is thrown.
 */
@Slf4j
public final class AmountNormalizer {

    private static final Pattern CURRENCY_NOISE = Pattern.compile("(?i)(EUR|USD|GBP|CHF|€|\\$|£|\\s|')");
    private static final Pattern AMOUNT_CHARS = Pattern.compile("^[0-9.,]+$");

    private static final Set<String> EU_LANGUAGES = Set.of("de", "fr", "es", "it", "nl", "pt");
    private static final Set<String> EU_CURRENCIES = Set.of("EUR", "€", "CHF");
    private static final Set<String> US_CURRENCIES = Set.of("USD", "$", "GBP", "£");

    private AmountNormalizer() {
    }

    public static NormalizedAmount normalize(String token) {
        return normalize(token, null, null);
    }

    public static NormalizedAmount normalize(String token, String currencyHint, String languageHint) {
        AmountLocale hinted = localeFromHints(currencyHint, languageHint);
        if (token == null || token.isBlank()) {
            return NormalizedAmount.invalid(token, hinted);
        }

        String cleaned = CURRENCY_NOISE.matcher(token).replaceAll("");
        if (cleaned.isEmpty() || !AMOUNT_CHARS.matcher(cleaned).matches()) {
            log.debug("[AmountNormalizer] Rejected token '{}'", token);
            return NormalizedAmount.invalid(token, hinted);
        }

        int lastDot = cleaned.lastIndexOf('.');
        int lastComma = cleaned.lastIndexOf(',');

        AmountLocale locale;
        if (lastDot >= 0 && lastComma >= 0) {
            locale = lastDot > lastComma ? AmountLocale.US : AmountLocale.EU;
        } else if (lastDot < 0 && lastComma < 0) {
            locale = hinted;
        } else {
            char separator = lastDot >= 0 ? '.' : ',';
            int occurrences = count(cleaned, separator);
            int digitsAfter = cleaned.length() - cleaned.lastIndexOf(separator) - 1;

            if (occurrences > 1) {
                locale = separator == ',' ? AmountLocale.US : AmountLocale.EU;
            } else if (digitsAfter != 3) {
                locale = separator == '.' ? AmountLocale.US : AmountLocale.EU;
            } else {
                locale = hinted;
            }
        }

        return parse(token, cleaned, locale);
    }

    private static NormalizedAmount parse(String raw, String cleaned, AmountLocale locale) {
        if (!hasValidGrouping(cleaned, locale)) {
            log.debug("[AmountNormalizer] Malformed digit grouping in '{}'", raw);
            return NormalizedAmount.invalid(raw, locale);
        }

        String grouping = String.valueOf(locale.getGroupingSeparator());
        String plain = cleaned.replace(grouping, "");

        if (count(plain, locale.getDecimalSeparator()) > 1) {
            return NormalizedAmount.invalid(raw, locale);
        }
        plain = plain.replace(locale.getDecimalSeparator(), '.');
        if (plain.startsWith(".") || plain.endsWith(".")) {
            return NormalizedAmount.invalid(raw, locale);
        }

        try {
            BigDecimal amount = new BigDecimal(plain);
            if (amount.signum() <= 0) {
                return NormalizedAmount.invalid(raw, locale);
            }
            return new NormalizedAmount(raw, amount, locale, true);
        } catch (NumberFormatException e) {
            log.debug("[AmountNormalizer] Unparsable amount '{}': {}", raw, e.getMessage());
            return NormalizedAmount.invalid(raw, locale);
        }
    }

    /**
     * Grouped integer parts need a leading group of one to three digits followed by groups of exactly
     * three. A grouped amount carries at most two fraction digits.
     */
    static boolean hasValidGrouping(String cleaned, AmountLocale locale) {
        char grouping = locale.getGroupingSeparator();
        if (cleaned.indexOf(grouping) < 0) return true;

        int decimalAt = cleaned.indexOf(locale.getDecimalSeparator());
        String integerPart = decimalAt < 0 ? cleaned : cleaned.substring(0, decimalAt);
        if (decimalAt >= 0 && cleaned.length() - decimalAt - 1 > 2) return false;

        String[] groups = integerPart.split(Pattern.quote(String.valueOf(grouping)), -1);
        if (groups[0].isEmpty() || groups[0].length() > 3) return false;
        for (int i = 1; i < groups.length; i++) {
            if (groups[i].length() != 3) return false;
        }
        return true;
    }

    static AmountLocale localeFromHints(String currencyHint, String languageHint) {
        if (languageHint != null && !languageHint.isBlank()) {
            String language = languageHint.trim().toLowerCase(Locale.ROOT);
            if (EU_LANGUAGES.contains(language)) return AmountLocale.EU;
            if ("en".equals(language)) return AmountLocale.US;
        }
        if (currencyHint != null && !currencyHint.isBlank()) {
            String currency = currencyHint.trim().toUpperCase(Locale.ROOT);
            if (EU_CURRENCIES.contains(currency)) return AmountLocale.EU;
            if (US_CURRENCIES.contains(currency)) return AmountLocale.US;
        }
        return AmountLocale.US;
    }

    private static int count(String s, char c) {
        int n = 0;
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) == c) n++;
        }
        return n;
    }
}
