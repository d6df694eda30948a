package com.parsely.backend.services.extraction.strategies;

import java.util.List;
import java.util.Optional;

import com.parsely.backend.enums.FieldName;
import com.parsely.backend.enums.StrategyId;
import com.parsely.backend.services.extraction.DocumentText;
import com.parsely.backend.services.extraction.FieldMap;
import com.parsely.backend.services.extraction.patterns.PatternCatalog;
import com.parsely.backend.services.extraction.patterns.PatternCatalog.VendorProfile;

/**
 * Known vendor layouts identified by a header fingerprint. The sender is the fingerprint line,
 * its address the following line, and the recipient the first personal-name line in the
 * vendor's recipient window.
 */
public class CompanySpecificStrategy extends AbstractExtractionStrategy {

    @Override
    public StrategyId id() {
        return StrategyId.COMPANY_SPECIFIC;
    }

    @Override
    public boolean canHandle(DocumentText document) {
        return document != null && PatternCatalog.hasVendorFingerprint(document.text());
    }

    @Override
    protected void extractParties(DocumentText document, FieldMap.Builder builder) {
        Optional<VendorProfile> vendor = PatternCatalog.findVendor(document.text());
        if (vendor.isEmpty()) return;

        VendorProfile profile = vendor.get();
        List<String> lines = document.lines();

        int senderIndex = -1;
        for (int i = 0; i < lines.size(); i++) {
            if (profile.matches(lines.get(i))) {
                senderIndex = i;
                break;
            }
        }
        if (senderIndex >= 0) {
            builder.set(FieldName.SENDER, lines.get(senderIndex));
            if (senderIndex + 1 < lines.size()) {
                String next = lines.get(senderIndex + 1);
                if (next.contains(profile.addressSeparator()) || PatternCatalog.isAddressLine(next)) {
                    builder.set(FieldName.SENDER_ADDRESS, joinAddress(next, profile.addressSeparator()));
                }
            }
        }

        int from = Math.max(profile.recipientSearchFrom(), senderIndex + 1);
        int to = Math.min(profile.recipientSearchTo(), lines.size());
        for (int i = from; i < to; i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty() || profile.recipientSkipWords().stream().anyMatch(line::contains)) continue;
            if (looksLikePersonName(line)) {
                builder.set(FieldName.RECIPIENT, line);
                collectRecipientAddress(lines, i + 1, to, builder);
                break;
            }
        }
    }

    @Override
    protected Optional<String> extractCurrency(String text) {
        Optional<String> found = super.extractCurrency(text);
        if (found.isPresent()) return found;
        return PatternCatalog.findVendor(text).map(VendorProfile::defaultCurrency);
    }

    private static void collectRecipientAddress(List<String> lines, int from, int to, FieldMap.Builder builder) {
        StringBuilder address = new StringBuilder();
        for (int i = from; i < to && i < from + 3; i++) {
            String line = lines.get(i).trim();
            if (!PatternCatalog.isAddressLine(line)) break;
            if (address.length() > 0) address.append(", ");
            address.append(line);
        }
        builder.setIfUnresolved(FieldName.RECIPIENT_ADDRESS, address.toString());
    }

    private static String joinAddress(String line, String separator) {
        return line.replace(" " + separator + " ", ", ").replace(separator, ", ").replaceAll("\\s{2,}", " ").trim();
    }

    // Two or three capitalized words without digits or punctuation typical of headers.
    static boolean looksLikePersonName(String line) {
        if (line.contains(":") || line.contains("@") || line.chars().anyMatch(Character::isDigit)) return false;
        String[] words = line.split("\\s+");
        if (words.length < 2 || words.length > 3) return false;
        for (String word : words) {
            if (word.length() < 2 || !Character.isUpperCase(word.charAt(0))) return false;
        }
        return true;
    }
}
