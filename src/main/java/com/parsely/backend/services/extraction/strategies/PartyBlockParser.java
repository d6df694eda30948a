package com.parsely.backend.services.extraction.strategies;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.parsely.backend.services.extraction.patterns.PatternCatalog;

/**
 * Reads a labelled party block (name, address, e-mail) out of consecutive lines.
 */
public final class PartyBlockParser {

    /** Lines inspected after a label before the block is cut off. */
    public static final int DEFAULT_WINDOW = 8;

    private PartyBlockParser() {
    }

    /**
     * Name, joined address and first e-mail of one party. Any component may be {@code null}.
     */
    public record PartyBlock(String name, String address, String email) {

        public static final PartyBlock EMPTY = new PartyBlock(null, null, null);

        public boolean isEmpty() {
            return name == null && address == null && email == null;
        }
    }

    /**
     * Parses the block that starts at {@code labelIndex}.
     *
     * @param lines       all document lines
     * @param labelIndex  index of the line carrying the label
     * @param inlineValue text after the label on the same line, possibly empty
     * @param endExclusive hard stop (for example the next party label), or {@code lines.size()}
     */
    public static PartyBlock parse(List<String> lines, int labelIndex, String inlineValue, int endExclusive) {
        if (lines == null || labelIndex < 0 || labelIndex >= lines.size()) return PartyBlock.EMPTY;

        BlockCollector collector = new BlockCollector();
        collector.acceptInline(inlineValue);

        int end = Math.min(Math.min(endExclusive, lines.size()), labelIndex + 1 + DEFAULT_WINDOW);
        for (int i = labelIndex + 1; i < end; i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty()) {
                if (collector.hasContent()) break;
                continue;
            }
            if (PatternCatalog.isSectionBoundary(line)) break;
            collector.accept(line);
        }
        return collector.toBlock();
    }

    /**
     * Builds a block from column fragments already isolated by a two-column split.
     */
    public static PartyBlock fromFragments(String inlineValue, List<String> fragments) {
        BlockCollector collector = new BlockCollector();
        collector.acceptInline(inlineValue);
        if (fragments != null) {
            for (String fragment : fragments) {
                if (fragment != null && !fragment.isBlank()) collector.accept(fragment.trim());
            }
        }
        return collector.toBlock();
    }

    /**
     * Finds the first line matching the label pattern, returning its index and inline value.
     */
    public static Optional<LabelHit> findLabel(List<String> lines, Pattern label) {
        for (int i = 0; i < lines.size(); i++) {
            Matcher m = label.matcher(lines.get(i));
            if (m.matches()) {
                return Optional.of(new LabelHit(i, m.group(1) == null ? "" : m.group(1).trim()));
            }
        }
        return Optional.empty();
    }

    public record LabelHit(int index, String inlineValue) {
    }

    /**
     * Splits a two-column row into left and right cells: at a wide gap, between two e-mails,
     * or before a second postal code. A row that cannot be split is returned as a left cell only.
     */
    public static String[] splitColumns(String row) {
        if (row == null) return new String[] {"", ""};
        String trimmed = row.trim();

        Matcher gap = PatternCatalog.COLUMN_GAP.matcher(trimmed);
        if (gap.find()) {
            return new String[] {trimmed.substring(0, gap.start()).trim(), trimmed.substring(gap.end()).trim()};
        }

        List<String> emails = PatternCatalog.findEmails(trimmed);
        if (emails.size() >= 2) {
            int secondStart = trimmed.indexOf(emails.get(1), trimmed.indexOf(emails.get(0)) + emails.get(0).length());
            return new String[] {trimmed.substring(0, secondStart).trim(), trimmed.substring(secondStart).trim()};
        }

        Matcher postal = PatternCatalog.FIVE_DIGIT_POSTAL.matcher(trimmed);
        List<Integer> starts = new ArrayList<>();
        while (postal.find()) {
            starts.add(postal.start());
        }
        if (starts.size() >= 2) {
            int split = starts.get(1);
            return new String[] {trimmed.substring(0, split).trim(), trimmed.substring(split).trim()};
        }

        return new String[] {trimmed, ""};
    }

    private static final class BlockCollector {
        private String name;
        private String email;
        private final List<String> addressParts = new ArrayList<>();

        void acceptInline(String inlineValue) {
            if (inlineValue == null || inlineValue.isBlank()) return;
            String value = inlineValue.trim();
            Optional<String> inlineEmail = PatternCatalog.firstEmail(value);
            if (inlineEmail.isPresent()) {
                email = inlineEmail.get();
                value = value.replace(inlineEmail.get(), "").trim();
            }
            if (value.length() >= 2) {
                if (PatternCatalog.isAddressLine(value)) {
                    addressParts.add(value);
                } else {
                    name = value;
                }
            }
        }

        void accept(String line) {
            Optional<String> lineEmail = PatternCatalog.firstEmail(line);
            if (lineEmail.isPresent()) {
                if (email == null) email = lineEmail.get();
                return;
            }
            if (PatternCatalog.isContactLine(line)) return;

            if (PatternCatalog.isAddressLine(line)) {
                addressParts.add(line);
                return;
            }
            if (name == null) {
                if (line.length() > 2) name = line;
                return;
            }
            // City or region lines directly continuing an address.
            if (!addressParts.isEmpty() && Character.isUpperCase(line.charAt(0)) && !line.contains(":")) {
                addressParts.add(line);
            }
        }

        boolean hasContent() {
            return name != null || email != null || !addressParts.isEmpty();
        }

        PartyBlock toBlock() {
            String address = addressParts.isEmpty() ? null : String.join(", ", addressParts);
            return new PartyBlock(name, address, email);
        }
    }
}
