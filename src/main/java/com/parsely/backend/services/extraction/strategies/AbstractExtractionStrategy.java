package com.parsely.backend.services.extraction.strategies;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.parsely.backend.enums.FieldName;
import com.parsely.backend.services.extraction.DocumentText;
import com.parsely.backend.services.extraction.FieldMap;
import com.parsely.backend.services.extraction.patterns.PatternCatalog;
import com.parsely.backend.services.extraction.validation.AmountNormalizer;
import com.parsely.backend.services.extraction.validation.NormalizedAmount;

/**
 * Parties are strategy specific; amount, currency, e-mail fallback and banking fields are shared.
 */
public abstract class AbstractExtractionStrategy implements ExtractionStrategy {

    @Override
    public final FieldMap parse(DocumentText document) {
        FieldMap.Builder builder = FieldMap.builder();
        if (document == null || document.isBlank()) {
            return builder.build();
        }
        extractParties(document, builder);
        extractCurrency(document.text()).ifPresent(v -> builder.setIfUnresolved(FieldName.CURRENCY, v));
        String currencyHint = builder.get(FieldName.CURRENCY).orElse(null);
        extractAmount(document.text(), currencyHint).ifPresent(v -> builder.setIfUnresolved(FieldName.AMOUNT, v));
        fillEmails(document.text(), builder);
        BankingDetailsExtractor.apply(document, builder);
        return builder.build();
    }

    protected abstract void extractParties(DocumentText document, FieldMap.Builder builder);

    /**
     * First label-anchored amount, read with the detected currency and language as hints.
     * Returned as a plain two-decimal string.
     */
    protected Optional<String> extractAmount(String text, String currencyHint) {
        String language = PatternCatalog.detectLanguage(text).getCode();
        for (Pattern pattern : PatternCatalog.AMOUNT_PATTERNS) {
            Matcher m = pattern.matcher(text);
            while (m.find()) {
                NormalizedAmount amount = AmountNormalizer.normalize(m.group(1), currencyHint, language);
                if (amount.valid()) {
                    return Optional.of(amount.toPlainString());
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Explicit {@code Currency:} label first, then symbols or ISO codes: EUR, USD, GBP, CHF.
     */
    protected Optional<String> extractCurrency(String text) {
        Matcher label = PatternCatalog.CURRENCY_LABEL.matcher(text);
        if (label.find()) {
            Optional<String> code = currencyCode(label.group(1));
            if (code.isPresent()) return code;
        }
        if (text.contains("€") || PatternCatalog.EUR_CODE.matcher(text).find()) return Optional.of("EUR");
        if (text.contains("$") || PatternCatalog.USD_CODE.matcher(text).find()) return Optional.of("USD");
        if (text.contains("£") || PatternCatalog.GBP_CODE.matcher(text).find()) return Optional.of("GBP");
        if (PatternCatalog.CHF_CODE.matcher(text).find()) return Optional.of("CHF");
        return Optional.empty();
    }

    protected static Optional<String> currencyCode(String token) {
        if (token == null || token.isBlank()) return Optional.empty();
        String t = token.trim();
        return switch (t) {
            case "€" -> Optional.of("EUR");
            case "$" -> Optional.of("USD");
            case "£" -> Optional.of("GBP");
            default -> t.length() == 3 && t.chars().allMatch(Character::isLetter)
                    ? Optional.of(t.toUpperCase(Locale.ROOT))
                    : Optional.empty();
        };
    }

    /**
     * Sender e-mails are recognized by role prefixes (billing@, support@, ...); the first other
     * address is the recipient's.
     */
    protected static void fillEmails(String text, FieldMap.Builder builder) {
        String sender = null;
        String recipient = null;
        for (String email : PatternCatalog.findEmails(text)) {
            if (PatternCatalog.isSenderEmail(email)) {
                if (sender == null) sender = email;
            } else if (recipient == null) {
                recipient = email;
            }
        }
        builder.setIfUnresolved(FieldName.SENDER_EMAIL, sender);
        builder.setIfUnresolved(FieldName.RECIPIENT_EMAIL, recipient);
    }

    protected static void applyParty(PartyBlockParser.PartyBlock block, FieldName name, FieldName address,
            FieldName email, FieldMap.Builder builder) {
        if (block == null) return;
        builder.setIfUnresolved(name, block.name());
        builder.setIfUnresolved(address, block.address());
        builder.setIfUnresolved(email, block.email());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName();
    }
}
