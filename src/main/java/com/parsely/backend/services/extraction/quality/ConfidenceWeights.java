package com.parsely.backend.services.extraction.quality;

import com.parsely.backend.services.extraction.InvalidExtractionConfigException;

/**
 * Field weights for {@link ConfidenceScorer}. Full weights must be non-negative and sum to at most 1.0;
 * each partial credit must not exceed the full weight it stands in for.
 */
public record ConfidenceWeights(
        double sender,
        double recipient,
        double amount,
        double iban,
        double bic,
        double currency,
        double senderEmail,
        double recipientEmail,
        double address,
        double ibanPatternOnly,
        double bicShapeOnly,
        double partyWithoutQuality
) {

    private static final double EPSILON = 1e-9;

    public ConfidenceWeights {
        requireNonNegative("sender", sender);
        requireNonNegative("recipient", recipient);
        requireNonNegative("amount", amount);
        requireNonNegative("iban", iban);
        requireNonNegative("bic", bic);
        requireNonNegative("currency", currency);
        requireNonNegative("senderEmail", senderEmail);
        requireNonNegative("recipientEmail", recipientEmail);
        requireNonNegative("address", address);
        requireNonNegative("ibanPatternOnly", ibanPatternOnly);
        requireNonNegative("bicShapeOnly", bicShapeOnly);
        requireNonNegative("partyWithoutQuality", partyWithoutQuality);

        double total = sender + recipient + amount + iban + bic + currency + senderEmail + recipientEmail + address;
        if (total > 1.0 + EPSILON) {
            throw new InvalidExtractionConfigException(
                    String.format("Confidence weights must sum to at most 1.0 (got %.4f)", total));
        }
        if (ibanPatternOnly > iban + EPSILON) {
            throw new InvalidExtractionConfigException("ibanPatternOnly must not exceed iban");
        }
        if (bicShapeOnly > bic + EPSILON) {
            throw new InvalidExtractionConfigException("bicShapeOnly must not exceed bic");
        }
        if (partyWithoutQuality > Math.min(sender, recipient) + EPSILON) {
            throw new InvalidExtractionConfigException("partyWithoutQuality must not exceed sender or recipient");
        }
    }

    /**
     * Critical 50% (sender 20, recipient 20, amount 10), banking 30% (IBAN 15, BIC 15),
     * supporting 20% (currency, both e-mails and addresses at 5 each).
     */
    public static ConfidenceWeights defaults() {
        return new ConfidenceWeights(
                0.20, 0.20, 0.10,
                0.15, 0.15,
                0.05, 0.05, 0.05, 0.05,
                0.05, 0.05, 0.05);
    }

    /**
     * Highest score any field map can reach under these weights.
     */
    public double maxAttainable() {
        return Math.min(1.0, sender + recipient + amount + iban + bic + currency + senderEmail + recipientEmail + address);
    }

    private static void requireNonNegative(String name, double value) {
        if (Double.isNaN(value) || value < 0.0) {
            throw new InvalidExtractionConfigException("Confidence weight '" + name + "' must be >= 0 (got " + value + ")");
        }
    }
}
