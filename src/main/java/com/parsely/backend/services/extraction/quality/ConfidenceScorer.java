package com.parsely.backend.services.extraction.quality;

import java.util.regex.Pattern;

import com.parsely.backend.enums.FieldName;
import com.parsely.backend.services.extraction.FieldMap;
import com.parsely.backend.services.extraction.FieldValue;
import com.parsely.backend.services.extraction.validation.AmountNormalizer;
import com.parsely.backend.services.extraction.validation.BankingIdentifierValidator;
import com.parsely.backend.services.extraction.validation.EmailValidator;

import lombok.extern.slf4j.Slf4j;

/**
 * Weighted quality score of a field map in [0, 1]. Validity counts, not just presence:
 * a checksum-failing IBAN earns less than a valid one.
 */
@Slf4j
public class ConfidenceScorer {

    private static final Pattern CURRENCY_CODE = Pattern.compile("^[A-Z]{3}$");
    private static final int MIN_PARTY_LENGTH = 3;

    private final ConfidenceWeights weights;

    public ConfidenceScorer(ConfidenceWeights weights) {
        if (weights == null) {
            throw new IllegalArgumentException("ConfidenceWeights is required");
        }
        this.weights = weights;
    }

    public double maxAttainable() {
        return weights.maxAttainable();
    }

    /**
     * An all-unresolved map scores 0; the result never exceeds {@link #maxAttainable()}.
     */
    public double score(FieldMap fields) {
        if (fields == null) {
            log.warn("[ConfidenceScorer] FieldMap is null");
            return 0.0;
        }

        double score = 0.0;

        // Critical fields
        score += party(fields.get(FieldName.SENDER), weights.sender());
        score += party(fields.get(FieldName.RECIPIENT), weights.recipient());
        if (isPositiveAmount(fields.get(FieldName.AMOUNT))) {
            score += weights.amount();
        }

        // Banking fields
        FieldValue iban = fields.get(FieldName.IBAN);
        if (iban.isResolved()) {
            if (BankingIdentifierValidator.validateIban(iban.get())) {
                score += weights.iban();
            } else if (BankingIdentifierValidator.hasIbanShape(iban.get())) {
                score += weights.ibanPatternOnly();
            }
        }
        FieldValue bic = fields.get(FieldName.BIC);
        if (bic.isResolved()) {
            if (BankingIdentifierValidator.validateBic(bic.get())) {
                score += weights.bic();
            } else if (BankingIdentifierValidator.hasBicLikeShape(bic.get())) {
                score += weights.bicShapeOnly();
            }
        }

        // Supporting fields
        FieldValue currency = fields.get(FieldName.CURRENCY);
        if (currency.isResolved() && CURRENCY_CODE.matcher(currency.get()).matches()) {
            score += weights.currency();
        }
        if (isValidEmail(fields.get(FieldName.SENDER_EMAIL))) {
            score += weights.senderEmail();
        }
        if (isValidEmail(fields.get(FieldName.RECIPIENT_EMAIL))) {
            score += weights.recipientEmail();
        }
        if (fields.isResolved(FieldName.SENDER_ADDRESS) || fields.isResolved(FieldName.RECIPIENT_ADDRESS)) {
            score += weights.address();
        }

        double bounded = Math.max(0.0, Math.min(1.0, score));
        log.debug("[ConfidenceScorer] resolved={} score={}", fields.resolvedCount(), String.format("%.4f", bounded));
        return bounded;
    }

    /**
     * Full weight for a valid e-mail or a name longer than three characters; partial credit otherwise.
     */
    private double party(FieldValue value, double fullWeight) {
        if (!value.isResolved()) return 0.0;
        String v = value.get();
        if (EmailValidator.isValidEmail(v) || v.length() > MIN_PARTY_LENGTH) {
            return fullWeight;
        }
        return weights.partyWithoutQuality();
    }

    private static boolean isPositiveAmount(FieldValue value) {
        return value.isResolved() && AmountNormalizer.normalize(value.get()).valid();
    }

    private static boolean isValidEmail(FieldValue value) {
        return value.isResolved() && EmailValidator.isValidEmail(value.get());
    }
}
