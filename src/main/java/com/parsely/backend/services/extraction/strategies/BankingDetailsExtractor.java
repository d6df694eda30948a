package com.parsely.backend.services.extraction.strategies;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;

import com.parsely.backend.enums.FieldName;
import com.parsely.backend.enums.PaymentMethod;
import com.parsely.backend.services.extraction.DocumentText;
import com.parsely.backend.services.extraction.FieldMap;
import com.parsely.backend.services.extraction.patterns.PatternCatalog;
import com.parsely.backend.services.extraction.validation.BankingIdentifierValidator;
import com.parsely.backend.services.extraction.validation.ValidatedToken;

import lombok.extern.slf4j.Slf4j;

/**
 * Banking fields shared by every strategy, so checksum and format rules are applied the same way
 * whichever strategy located the banking text. Values failing validation stay unresolved.
 */
@Slf4j
public final class BankingDetailsExtractor {

    private static final int ACCOUNT_MIN_DIGITS = 4;
    private static final int ACCOUNT_MAX_DIGITS = 17;

    private BankingDetailsExtractor() {
    }

    public static FieldMap extract(DocumentText document) {
        FieldMap.Builder builder = FieldMap.builder();
        apply(document, builder);
        return builder.build();
    }

    /**
     * Writes iban, bic, routing_number, account_number, sort_code, bank_name, payment_address and
     * payment_method into the builder.
     */
    public static void apply(DocumentText document, FieldMap.Builder builder) {
        if (document == null || document.isBlank()) return;
        String text = document.text();

        Optional<String> iban = findIban(text);
        iban.ifPresent(v -> builder.set(FieldName.IBAN, v));

        findBic(text).ifPresent(v -> builder.set(FieldName.BIC, v));

        Optional<String> routing = findRoutingNumber(text);
        routing.ifPresent(v -> builder.set(FieldName.ROUTING_NUMBER, v));

        findAccountNumber(text).ifPresent(v -> builder.set(FieldName.ACCOUNT_NUMBER, v));

        Optional<String> sortCode = findSortCode(text);
        sortCode.ifPresent(v -> builder.set(FieldName.SORT_CODE, v));

        findBankName(text).ifPresent(v -> builder.set(FieldName.BANK_NAME, v));
        findPaymentAddress(document.lines()).ifPresent(v -> builder.set(FieldName.PAYMENT_ADDRESS, v));

        classifyPaymentMethod(iban.orElse(null), routing.orElse(null), sortCode.orElse(null))
                .ifPresent(method -> builder.set(FieldName.PAYMENT_METHOD, method.name()));
    }

    /**
     * A labelled IBAN first; otherwise any IBAN-shaped token in the text. Only a checksum-valid
     * candidate is returned, in compact upper-case form.
     */
    static Optional<String> findIban(String text) {
        Matcher labeled = PatternCatalog.IBAN_LABELED.matcher(text);
        while (labeled.find()) {
            Optional<String> valid = longestValidIbanPrefix(labeled.group(1));
            if (valid.isPresent()) return valid;
        }

        Matcher unlabeled = PatternCatalog.IBAN_UNLABELED.matcher(text);
        while (unlabeled.find()) {
            Optional<String> valid = longestValidIbanPrefix(unlabeled.group(1));
            if (valid.isPresent()) {
                log.debug("[BankingDetailsExtractor] Accepted unlabelled IBAN candidate");
                return valid;
            }
        }
        return Optional.empty();
    }

    // The capture can run into the next word on the same line ("... 3000 BIC"),
    // so shorter prefixes of space-separated groups are tried as well.
    private static Optional<String> longestValidIbanPrefix(String candidate) {
        String[] groups = candidate.trim().split("\\s+");
        for (int end = groups.length; end >= 1; end--) {
            String joined = String.join("", Arrays.copyOfRange(groups, 0, end));
            ValidatedToken<String> iban = BankingIdentifierValidator.checkIban(joined);
            if (iban.valid()) {
                return Optional.of(iban.normalized());
            }
        }
        log.debug("[BankingDetailsExtractor] Rejected IBAN candidate (checksum/format)");
        return Optional.empty();
    }

    static Optional<String> findBic(String text) {
        Matcher m = PatternCatalog.BIC_LABELED.matcher(text);
        while (m.find()) {
            String candidate = BankingIdentifierValidator.compact(m.group(1));
            if (BankingIdentifierValidator.validateBic(candidate)) {
                return Optional.of(candidate);
            }
            log.debug("[BankingDetailsExtractor] Rejected BIC candidate '{}'", candidate);
        }
        return Optional.empty();
    }

    static Optional<String> findRoutingNumber(String text) {
        Matcher m = PatternCatalog.ROUTING_NUMBER.matcher(text);
        while (m.find()) {
            String candidate = m.group(1);
            if (BankingIdentifierValidator.validateAbaRouting(candidate)) {
                return Optional.of(candidate);
            }
            log.debug("[BankingDetailsExtractor] Rejected routing number candidate (checksum/prefix)");
        }
        return Optional.empty();
    }

    static Optional<String> findAccountNumber(String text) {
        Matcher m = PatternCatalog.ACCOUNT_NUMBER.matcher(text);
        while (m.find()) {
            String digits = m.group(1).replaceAll("\\D", "");
            if (digits.length() >= ACCOUNT_MIN_DIGITS && digits.length() <= ACCOUNT_MAX_DIGITS) {
                return Optional.of(digits);
            }
        }
        return Optional.empty();
    }

    static Optional<String> findSortCode(String text) {
        Matcher m = PatternCatalog.SORT_CODE.matcher(text);
        while (m.find()) {
            ValidatedToken<String> sortCode = BankingIdentifierValidator.checkSortCode(m.group(1));
            if (sortCode.valid()) return Optional.of(sortCode.normalized());
        }
        return Optional.empty();
    }

    static Optional<String> findBankName(String text) {
        Matcher labeled = PatternCatalog.BANK_NAME_LABELED.matcher(text);
        if (labeled.find()) {
            String name = labeled.group(1).trim();
            if (!name.isEmpty()) return Optional.of(name);
        }
        Matcher line = PatternCatalog.BANK_NAME_LINE.matcher(text);
        if (line.find()) {
            return Optional.of(line.group(1).trim());
        }
        return Optional.empty();
    }

    static Optional<String> findPaymentAddress(List<String> lines) {
        for (int i = 0; i < lines.size(); i++) {
            if (!PatternCatalog.PAYMENT_ADDRESS_HEADER.matcher(lines.get(i)).find()) continue;

            List<String> parts = new ArrayList<>();
            for (int j = i + 1; j < lines.size() && parts.size() < PatternCatalog.PAYMENT_ADDRESS_MAX_LINES; j++) {
                String line = lines.get(j).trim();
                if (line.isEmpty() || PatternCatalog.isHorizontalRule(line) || line.contains("Description")) break;
                parts.add(line);
            }
            return parts.isEmpty() ? Optional.empty() : Optional.of(String.join(", ", parts));
        }
        return Optional.empty();
    }

    /**
     * IBAN takes priority over ABA routing, which takes priority over sort code.
     * Arguments are already-validated values or {@code null}.
     */
    static Optional<PaymentMethod> classifyPaymentMethod(String validIban, String validRouting, String validSortCode) {
        if (validIban != null) {
            boolean sepa = BankingIdentifierValidator.ibanCountry(validIban)
                    .map(PatternCatalog.SEPA_COUNTRIES::contains)
                    .orElse(false);
            return Optional.of(sepa ? PaymentMethod.SEPA : PaymentMethod.SEPA_INTERNATIONAL);
        }
        if (validRouting != null) return Optional.of(PaymentMethod.ACH);
        if (validSortCode != null) return Optional.of(PaymentMethod.BACS);
        return Optional.empty();
    }
}
