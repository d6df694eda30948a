package com.parsely.backend.services.extraction.strategies;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;

import com.parsely.backend.enums.FieldName;
import com.parsely.backend.enums.StrategyId;
import com.parsely.backend.services.extraction.DocumentText;
import com.parsely.backend.services.extraction.FieldMap;
import com.parsely.backend.services.extraction.patterns.PatternCatalog;
import com.parsely.backend.services.extraction.strategies.PartyBlockParser.LabelHit;
import com.parsely.backend.services.extraction.strategies.PartyBlockParser.PartyBlock;

/**
 * Dual-party headers ("From:"/"To:", "Bill from:"/"Bill to:"). Handles both stacked blocks and
 * side-by-side columns where both labels share a row.
 */
public class TwoColumnStrategy extends AbstractExtractionStrategy {

    private static final int SIDE_BY_SIDE_ROWS = 6;

    @Override
    public StrategyId id() {
        return StrategyId.TWO_COLUMN;
    }

    @Override
    public boolean canHandle(DocumentText document) {
        if (document == null || document.isBlank()) return false;
        List<String> lines = document.lines();
        if (findSideBySideHeader(lines).isPresent()) return true;
        return PartyBlockParser.findLabel(lines, PatternCatalog.TWO_COLUMN_SENDER_LABEL).isPresent()
                && PartyBlockParser.findLabel(lines, PatternCatalog.TWO_COLUMN_RECIPIENT_LABEL).isPresent();
    }

    @Override
    protected void extractParties(DocumentText document, FieldMap.Builder builder) {
        List<String> lines = document.lines();

        Optional<SideBySideHeader> header = findSideBySideHeader(lines);
        if (header.isPresent()) {
            parseSideBySide(lines, header.get(), builder);
            return;
        }

        Optional<LabelHit> sender = PartyBlockParser.findLabel(lines, PatternCatalog.TWO_COLUMN_SENDER_LABEL);
        Optional<LabelHit> recipient = PartyBlockParser.findLabel(lines, PatternCatalog.TWO_COLUMN_RECIPIENT_LABEL);

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

    private void parseSideBySide(List<String> lines, SideBySideHeader header, FieldMap.Builder builder) {
        List<String> left = new ArrayList<>();
        List<String> right = new ArrayList<>();

        int end = Math.min(lines.size(), header.index() + 1 + SIDE_BY_SIDE_ROWS);
        for (int i = header.index() + 1; i < end; i++) {
            String row = lines.get(i).trim();
            if (row.isEmpty() || PatternCatalog.isSectionBoundary(row) || endsSideBySideBlock(row)) break;

            String[] cells = PartyBlockParser.splitColumns(row);
            if (!cells[1].isEmpty()) {
                left.add(cells[0]);
                right.add(cells[1]);
                continue;
            }
            // A single e-mail goes to the side its role suggests; other unsplit rows belong to the sender.
            Optional<String> email = PatternCatalog.firstEmail(cells[0]);
            if (email.isPresent() && !PatternCatalog.isSenderEmail(email.get())) {
                right.add(cells[0]);
            } else {
                left.add(cells[0]);
            }
        }

        applyParty(PartyBlockParser.fromFragments(header.senderValue(), left),
                FieldName.SENDER, FieldName.SENDER_ADDRESS, FieldName.SENDER_EMAIL, builder);
        applyParty(PartyBlockParser.fromFragments(header.recipientValue(), right),
                FieldName.RECIPIENT, FieldName.RECIPIENT_ADDRESS, FieldName.RECIPIENT_EMAIL, builder);
    }

    private static boolean endsSideBySideBlock(String row) {
        String lower = row.toLowerCase(Locale.ROOT);
        return row.contains("€") || lower.contains(" due") || lower.startsWith("due") || lower.startsWith("pay");
    }

    /**
     * Index and inline values of a row carrying both party labels, or naming the sender before "Bill to".
     */
    static Optional<SideBySideHeader> findSideBySideHeader(List<String> lines) {
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            Matcher both = PatternCatalog.TWO_COLUMN_SIDE_BY_SIDE.matcher(line);
            if (both.matches()) {
                return Optional.of(new SideBySideHeader(i, both.group(1).trim(), both.group(2).trim()));
            }
            if (PatternCatalog.isPartyLabel(line)) continue;
            Matcher named = PatternCatalog.SENDER_BEFORE_BILL_TO.matcher(line);
            if (named.matches()) {
                return Optional.of(new SideBySideHeader(i, named.group(1).trim(), named.group(2).trim()));
            }
        }
        return Optional.empty();
    }

    record SideBySideHeader(int index, String senderValue, String recipientValue) {
    }
}
