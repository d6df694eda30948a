package com.parsely.backend.services.extraction.ml;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import com.parsely.backend.enums.FieldName;
import com.parsely.backend.services.extraction.DocumentText;
import com.parsely.backend.services.extraction.FieldMap;
import com.parsely.backend.services.extraction.patterns.PatternCatalog;
import com.parsely.backend.services.extraction.quality.ConfidenceScorer;
import com.parsely.backend.services.extraction.validation.AmountNormalizer;
import com.parsely.backend.services.extraction.validation.EmailValidator;
import com.parsely.backend.services.extraction.validation.NormalizedAmount;

import lombok.extern.slf4j.Slf4j;

/**
 * Maps entity spans onto the field map: organisations and persons to the parties, the first
 * money span to amount and currency, places to addresses and e-mails by role. Banking fields are
 * never produced here.
 */
@Slf4j
public class EntityRecognitionFieldExtractor implements LearnedFieldExtractor {

    private final EntityRecognitionModel model;
    private final ConfidenceScorer scorer;

    public EntityRecognitionFieldExtractor(EntityRecognitionModel model, ConfidenceScorer scorer) {
        if (model == null || scorer == null) {
            throw new IllegalArgumentException("EntityRecognitionModel and ConfidenceScorer are required");
        }
        this.model = model;
        this.scorer = scorer;
    }

    @Override
    public LearnedExtraction extract(DocumentText document) {
        if (document == null || document.isBlank()) {
            return LearnedExtraction.empty();
        }

        List<RecognizedEntity> entities;
        try {
            entities = model.recognize(document.text());
        } catch (RuntimeException e) {
            log.warn("[LearnedFallback] Entity recognition failed: {}", e.getMessage());
            return LearnedExtraction.empty();
        }
        if (entities == null || entities.isEmpty()) {
            return LearnedExtraction.empty();
        }

        FieldMap fields = toFieldMap(entities, document.text());
        double confidence = scorer.score(fields);
        log.debug("[LearnedFallback] {} entities -> {} fields, confidence={}",
                entities.size(), fields.resolvedCount(), String.format("%.3f", confidence));
        return new LearnedExtraction(fields, confidence);
    }

    FieldMap toFieldMap(List<RecognizedEntity> entities, String text) {
        List<String> orgs = new ArrayList<>();
        List<String> persons = new ArrayList<>();
        List<String> places = new ArrayList<>();
        List<String> emails = new ArrayList<>();
        String money = null;

        for (RecognizedEntity entity : entities) {
            if (entity == null || entity.text().isEmpty()) continue;
            switch (entity.label()) {
                case ORG -> orgs.add(entity.text());
                case PERSON -> persons.add(entity.text());
                case GPE -> places.add(entity.text());
                case EMAIL -> emails.add(entity.text());
                case MONEY -> {
                    if (money == null) money = entity.text();
                }
                default -> {
                    // ignored
                }
            }
        }

        FieldMap.Builder builder = FieldMap.builder();
        if (!orgs.isEmpty()) builder.set(FieldName.SENDER, orgs.get(0));
        if (orgs.size() > 1) {
            builder.set(FieldName.RECIPIENT, orgs.get(1));
        } else if (!persons.isEmpty()) {
            builder.set(FieldName.RECIPIENT, persons.get(0));
        }

        if (money != null) {
            Optional<String> currency = currencyOf(money);
            currency.ifPresent(c -> builder.set(FieldName.CURRENCY, c));
            String language = PatternCatalog.detectLanguage(text).getCode();
            NormalizedAmount amount = AmountNormalizer.normalize(money, currency.orElse(null), language);
            if (amount.valid()) {
                builder.set(FieldName.AMOUNT, amount.toPlainString());
            }
        }

        if (!places.isEmpty()) builder.set(FieldName.SENDER_ADDRESS, places.get(0));
        if (places.size() > 1) builder.set(FieldName.RECIPIENT_ADDRESS, places.get(1));

        for (String email : emails) {
            if (!EmailValidator.isValidEmail(email)) continue;
            FieldName target = PatternCatalog.isSenderEmail(email) ? FieldName.SENDER_EMAIL : FieldName.RECIPIENT_EMAIL;
            builder.setIfUnresolved(target, email);
        }
        return builder.build();
    }

    private static Optional<String> currencyOf(String money) {
        String upper = money.toUpperCase(Locale.ROOT);
        if (upper.contains("€") || upper.contains("EUR")) return Optional.of("EUR");
        if (upper.contains("£") || upper.contains("GBP")) return Optional.of("GBP");
        if (upper.contains("$") || upper.contains("USD")) return Optional.of("USD");
        if (upper.contains("CHF")) return Optional.of("CHF");
        return Optional.empty();
    }
}
