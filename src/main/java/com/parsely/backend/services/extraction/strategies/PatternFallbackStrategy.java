package com.parsely.backend.services.extraction.strategies;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;

import com.parsely.backend.enums.FieldName;
import com.parsely.backend.enums.StrategyId;
import com.parsely.backend.services.extraction.DocumentText;
import com.parsely.backend.services.extraction.FieldMap;
import com.parsely.backend.services.extraction.patterns.PatternCatalog;
import com.parsely.backend.services.extraction.validation.AmountNormalizer;
import com.parsely.backend.services.extraction.validation.NormalizedAmount;

/**
 * Structure-free extraction from e-mail addresses and bare amounts. Applies exactly when none of
 * the structured strategies it was given applies.
 */
public class PatternFallbackStrategy extends AbstractExtractionStrategy {

    private static final int MIN_NAME_LENGTH = 4;

    private final List<ExtractionStrategy> structuredStrategies;

    public PatternFallbackStrategy() {
        this(List.of(new TwoColumnStrategy(), new SingleColumnLabelStrategy(), new CompanySpecificStrategy()));
    }

    public PatternFallbackStrategy(List<ExtractionStrategy> structuredStrategies) {
        if (structuredStrategies == null) {
            throw new IllegalArgumentException("Structured strategies are required");
        }
        for (ExtractionStrategy strategy : structuredStrategies) {
            if (strategy == null || strategy.id() == StrategyId.PATTERN_FALLBACK) {
                throw new IllegalArgumentException("Fallback cannot defer to itself or to a null strategy");
            }
        }
        this.structuredStrategies = List.copyOf(structuredStrategies);
    }

    @Override
    public StrategyId id() {
        return StrategyId.PATTERN_FALLBACK;
    }

    @Override
    public boolean canHandle(DocumentText document) {
        if (document == null || document.isBlank()) return false;
        return structuredStrategies.stream().noneMatch(strategy -> strategy.canHandle(document));
    }

    @Override
    protected void extractParties(DocumentText document, FieldMap.Builder builder) {
        // Text in front of an e-mail on the same line is taken as that party's name.
        for (String line : document.lines()) {
            Optional<String> email = PatternCatalog.firstEmail(line);
            if (email.isEmpty()) continue;

            String before = line.substring(0, line.indexOf(email.get())).trim();
            if (before.contains(":")) continue;
            String name = before.replaceAll("[,;<(\\-]+$", "").trim();
            if (name.length() < MIN_NAME_LENGTH) continue;

            FieldName target = PatternCatalog.isSenderEmail(email.get()) ? FieldName.SENDER : FieldName.RECIPIENT;
            builder.setIfUnresolved(target, name);
        }
    }

    /**
     * Labelled amounts first; otherwise the largest bare amount token in the text.
     */
    @Override
    protected Optional<String> extractAmount(String text, String currencyHint) {
        Optional<String> labelled = super.extractAmount(text, currencyHint);
        if (labelled.isPresent()) return labelled;

        String language = PatternCatalog.detectLanguage(text).getCode();
        NormalizedAmount best = null;
        Matcher m = PatternCatalog.BARE_AMOUNT.matcher(text);
        while (m.find()) {
            NormalizedAmount candidate = AmountNormalizer.normalize(m.group(1), currencyHint, language);
            if (candidate.valid() && (best == null || candidate.amount().compareTo(best.amount()) > 0)) {
                best = candidate;
            }
        }
        return best == null ? Optional.empty() : Optional.of(best.toPlainString());
    }
}
