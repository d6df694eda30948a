package com.parsely.backend.services.extraction.layout;

import java.util.List;

import com.parsely.backend.enums.LayoutCategory;
import com.parsely.backend.services.extraction.DocumentText;
import com.parsely.backend.services.extraction.patterns.PatternCatalog;
import com.parsely.backend.services.extraction.strategies.PartyBlockParser;

import lombok.extern.slf4j.Slf4j;

/**
 * Keyword heuristics needing no training: dual-party labels, then vendor fingerprints,
 * then single-column labels, otherwise unstructured.
 */
@Slf4j
public class RuleBasedLayoutClassifier implements LayoutClassifier {

    @Override
    public LayoutPrediction classify(DocumentText document) {
        if (document == null || document.isBlank()) {
            return new LayoutPrediction(LayoutCategory.UNSTRUCTURED, 1.0, LayoutPrediction.RULE_BASED);
        }
        LayoutCategory category = categorize(document);
        log.debug("[LayoutClassifier] rule-based -> {}", category.getLabel());
        return new LayoutPrediction(category, 1.0, LayoutPrediction.RULE_BASED);
    }

    private static LayoutCategory categorize(DocumentText document) {
        List<String> lines = document.lines();
        boolean twoColumnSender = PartyBlockParser.findLabel(lines, PatternCatalog.TWO_COLUMN_SENDER_LABEL).isPresent();
        boolean twoColumnRecipient = PartyBlockParser.findLabel(lines, PatternCatalog.TWO_COLUMN_RECIPIENT_LABEL).isPresent();
        boolean sideBySide = lines.stream().anyMatch(l -> PatternCatalog.TWO_COLUMN_SIDE_BY_SIDE.matcher(l).matches()
                || (!PatternCatalog.isPartyLabel(l) && PatternCatalog.SENDER_BEFORE_BILL_TO.matcher(l).matches()));

        if ((twoColumnSender && twoColumnRecipient) || sideBySide) {
            return LayoutCategory.TWO_COLUMN;
        }
        if (PatternCatalog.hasVendorFingerprint(document.text())) {
            return LayoutCategory.COMPANY_SPECIFIC;
        }
        if (PartyBlockParser.findLabel(lines, PatternCatalog.SINGLE_COLUMN_SENDER_LABEL).isPresent()
                || PartyBlockParser.findLabel(lines, PatternCatalog.SINGLE_COLUMN_RECIPIENT_LABEL).isPresent()) {
            return LayoutCategory.SINGLE_COLUMN;
        }
        return LayoutCategory.UNSTRUCTURED;
    }
}
