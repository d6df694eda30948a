package com.parsely.backend.services.extraction.strategies;

import java.util.List;
import java.util.Optional;

import com.parsely.backend.enums.FieldName;
import com.parsely.backend.enums.StrategyId;
import com.parsely.backend.services.extraction.DocumentText;
import com.parsely.backend.services.extraction.FieldMap;
import com.parsely.backend.services.extraction.patterns.PatternCatalog;
import com.parsely.backend.services.extraction.strategies.PartyBlockParser.LabelHit;

/**
 * Sequential labelled sections: "Sender:"/"Recipient:" and German equivalents
 * ("Absender:", "Empfänger:", "Von:", "An:").
 */
public class SingleColumnLabelStrategy extends AbstractExtractionStrategy {

    @Override
    public StrategyId id() {
        return StrategyId.SINGLE_COLUMN_LABEL;
    }

    @Override
    public boolean canHandle(DocumentText document) {
        if (document == null || document.isBlank()) return false;
        List<String> lines = document.lines();
        return PartyBlockParser.findLabel(lines, PatternCatalog.SINGLE_COLUMN_SENDER_LABEL).isPresent()
                || PartyBlockParser.findLabel(lines, PatternCatalog.SINGLE_COLUMN_RECIPIENT_LABEL).isPresent();
    }

    @Override
    protected void extractParties(DocumentText document, FieldMap.Builder builder) {
        List<String> lines = document.lines();
        Optional<LabelHit> sender = PartyBlockParser.findLabel(lines, PatternCatalog.SINGLE_COLUMN_SENDER_LABEL);
        Optional<LabelHit> recipient = PartyBlockParser.findLabel(lines, PatternCatalog.SINGLE_COLUMN_RECIPIENT_LABEL);

        sender.ifPresent(hit -> {
            int end = recipient.filter(r -> r.index() > hit.index()).map(LabelHit::index).orElse(lines.size());
            applyParty(PartyBlockParser.parse(lines, hit.index(), hit.inlineValue(), end),
                    FieldName.SENDER, FieldName.SENDER_ADDRESS, FieldName.SENDER_EMAIL, builder);
        });
        recipient.ifPresent(hit -> {
            int end = sender.filter(s -> s.index() > hit.index()).map(LabelHit::index).orElse(lines.size());
            applyParty(PartyBlockParser.parse(lines, hit.index(), hit.inlineValue(), end),
                    FieldName.RECIPIENT, FieldName.RECIPIENT_ADDRESS, FieldName.RECIPIENT_EMAIL, builder);
        });
    }
}
