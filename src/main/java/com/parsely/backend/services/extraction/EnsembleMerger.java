package com.parsely.backend.services.extraction;

import java.util.EnumSet;
import java.util.Set;

import com.parsely.backend.enums.FieldName;
import com.parsely.backend.services.extraction.ml.LearnedExtraction;
import com.parsely.backend.services.extraction.quality.ConfidenceScorer;

import lombok.extern.slf4j.Slf4j;

/**
 * Field-by-field reconciliation of the winning rule-based map with the learned map.
 *
 * <ol>
 * <li>A resolved rule-based value is kept.</li>
 * <li>Otherwise a resolved learned value is used when the learned confidence reaches {@code mlMinConfidence}.</li>
 * <li>Otherwise the field stays unresolved.</li>
 * </ol>
 * With {@code preferRegex=false}, rule 1 yields to rule 2 whenever the learned confidence is strictly
 * higher than the rule-based one. An unresolved learned value never replaces a resolved one.
 * The merged confidence is rescored, not averaged.
 */
@Slf4j
public class EnsembleMerger {

    private final ConfidenceScorer scorer;

    public EnsembleMerger(ConfidenceScorer scorer) {
        if (scorer == null) {
            throw new IllegalArgumentException("ConfidenceScorer is required");
        }
        this.scorer = scorer;
    }

    public record MergeOutcome(FieldMap fields, double confidence, Set<FieldName> learnedFields) {
    }

    public MergeOutcome merge(FieldMap ruleFields, double ruleConfidence, LearnedExtraction learned,
            boolean preferRegex, double mlMinConfidence) {
        FieldMap rules = ruleFields == null ? FieldMap.unresolved() : ruleFields;
        LearnedExtraction ml = learned == null ? LearnedExtraction.empty() : learned;

        boolean mlTrusted = ml.confidence() >= mlMinConfidence;
        boolean mlOverrides = !preferRegex && ml.confidence() > ruleConfidence;

        FieldMap.Builder merged = rules.toBuilder();
        EnumSet<FieldName> fromMl = EnumSet.noneOf(FieldName.class);

        for (FieldName field : FieldName.values()) {
            FieldValue r = rules.get(field);
            FieldValue m = ml.fields().get(field);

            boolean useMl = m.isResolved() && mlTrusted && (!r.isResolved() || mlOverrides);
            if (useMl) {
                merged.set(field, m);
                if (!m.equals(r)) fromMl.add(field);
            }
        }

        FieldMap result = merged.build();
        double confidence = scorer.score(result);
        if (!fromMl.isEmpty()) {
            log.info("[EnsembleMerger] {} field(s) taken from learned fallback: {} (confidence {} -> {})",
                    fromMl.size(), fromMl, String.format("%.3f", ruleConfidence), String.format("%.3f", confidence));
        }
        return new MergeOutcome(result, confidence, fromMl);
    }
}
