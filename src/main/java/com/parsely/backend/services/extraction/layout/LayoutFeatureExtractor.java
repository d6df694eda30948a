package com.parsely.backend.services.extraction.layout;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.parsely.backend.services.extraction.DocumentText;
import com.parsely.backend.services.extraction.patterns.PatternCatalog;

/**
 * Structural text features fed to the trained layout model. Names are the keys a model's
 * {@code featureNames} refer to.
 */
public final class LayoutFeatureExtractor {

    public static final List<String> FEATURE_NAMES = List.of(
            "line_count",
            "non_empty_line_count",
            "char_count",
            "word_count",
            "avg_line_length",
            "max_line_length",
            "line_length_variance",
            "has_from_to",
            "has_bill_from_to",
            "has_sender_recipient",
            "has_german_labels",
            "has_vendor_fingerprint",
            "has_invoice_keyword",
            "colon_density",
            "comma_density",
            "wide_gap_ratio");

    private LayoutFeatureExtractor() {
    }

    public static Map<String, Double> extract(DocumentText document) {
        Map<String, Double> f = new LinkedHashMap<>();
        List<String> lines = document.lines();
        String text = document.text();

        List<String> nonEmpty = document.nonBlankLines();
        int chars = text.length();
        int words = text.isBlank() ? 0 : text.trim().split("\\s+").length;

        double avg = nonEmpty.stream().mapToInt(String::length).average().orElse(0.0);
        int max = nonEmpty.stream().mapToInt(String::length).max().orElse(0);
        double variance = nonEmpty.stream().mapToDouble(l -> Math.pow(l.length() - avg, 2)).average().orElse(0.0);

        f.put("line_count", (double) lines.size());
        f.put("non_empty_line_count", (double) nonEmpty.size());
        f.put("char_count", (double) chars);
        f.put("word_count", (double) words);
        f.put("avg_line_length", avg);
        f.put("max_line_length", (double) max);
        f.put("line_length_variance", variance);

        f.put("has_from_to", flag(text.contains("From:") && text.contains("To:")));
        String lower = text.toLowerCase(Locale.ROOT);
        f.put("has_bill_from_to", flag(lower.contains("bill to") || lower.contains("bill from")));
        f.put("has_sender_recipient", flag(text.contains("Sender:") || text.contains("Recipient:")));
        f.put("has_german_labels", flag(text.contains("Absender:") || text.contains("Empfänger:")
                || text.contains("Von:") || text.contains("An:") || text.contains("Rechnungsempfänger:")));
        f.put("has_vendor_fingerprint", flag(PatternCatalog.hasVendorFingerprint(text)));
        f.put("has_invoice_keyword", flag(PatternCatalog.containsInvoiceKeyword(text)));

        long colonLines = nonEmpty.stream().filter(l -> l.contains(":")).count();
        long commaLines = nonEmpty.stream().filter(l -> l.contains(",")).count();
        long gapLines = nonEmpty.stream().filter(l -> PatternCatalog.COLUMN_GAP.matcher(l).find()).count();
        double denominator = Math.max(1, nonEmpty.size());
        f.put("colon_density", colonLines / denominator);
        f.put("comma_density", commaLines / denominator);
        f.put("wide_gap_ratio", gapLines / denominator);

        return Collections.unmodifiableMap(f);
    }

    private static double flag(boolean value) {
        return value ? 1.0 : 0.0;
    }
}
