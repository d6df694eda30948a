package com.parsely.backend.services.extraction.patterns;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.parsely.backend.enums.DocumentLanguage;

/**
 * Regular expressions and keyword lists the extraction strategies use to find candidate values.
 * Everything here is stateless; compiled patterns are thread-safe.
 */
public final class PatternCatalog {

    private PatternCatalog() {}

    /**
     * A known vendor whose documents follow a fixed layout.
     * Fingerprints are plain substrings; the first one present identifies the vendor.
     */
    public record VendorProfile(
            String name,
            List<String> fingerprints,
            String addressSeparator,
            int recipientSearchFrom,
            int recipientSearchTo,
            List<String> recipientSkipWords,
            String defaultCurrency
    ) {
        public VendorProfile {
            if (name == null || name.isBlank()) throw new IllegalArgumentException("name is required");
            if (fingerprints == null || fingerprints.isEmpty()) throw new IllegalArgumentException("fingerprints are required");
            if (recipientSearchFrom < 0 || recipientSearchTo < recipientSearchFrom) {
                throw new IllegalArgumentException("invalid recipient search window");
            }
            fingerprints = List.copyOf(fingerprints);
            recipientSkipWords = recipientSkipWords == null ? List.of() : List.copyOf(recipientSkipWords);
        }

        public boolean matches(String text) {
            return text != null && fingerprints.stream().anyMatch(text::contains);
        }
    }

    // ---------------------------------------------------------------------
    // Party labels
    // ---------------------------------------------------------------------

    /** Dual-party header labels. Group 1 is the value following the label on the same line. */
    public static final Pattern TWO_COLUMN_SENDER_LABEL = Pattern.compile(
            "(?i)^\\s*(?:From|Bill(?:ed)?\\s+from|Billed\\s+by|Invoice\\s+from)\\s*:\\s*(.*)$");
    public static final Pattern TWO_COLUMN_RECIPIENT_LABEL = Pattern.compile(
            "(?i)^\\s*(?:To|Bill(?:ed)?\\s+to|Invoice\\s+to)\\s*:\\s*(.*)$");

    /** Both labels on one row: {@code From: Acme      To: Globex}. */
    public static final Pattern TWO_COLUMN_SIDE_BY_SIDE = Pattern.compile(
            "(?i)^\\s*(?:From|Bill(?:ed)?\\s+from|Billed\\s+by|Invoice\\s+from)\\s*:(.*?)\\s{3,}(?:To|Bill(?:ed)?\\s+to|Invoice\\s+to)\\s*:(.*)$");

    /** Sender name followed by the recipient header on one row: {@code Acme Inc.    Bill to}. */
    public static final Pattern SENDER_BEFORE_BILL_TO = Pattern.compile(
            "(?i)^\\s*(\\S.*?)\\s+Bill\\s+to\\b:?(.*)$");

    public static final Pattern SINGLE_COLUMN_SENDER_LABEL = Pattern.compile(
            "(?i)^\\s*(?:Sender|Absender|Von|Rechnungssteller|Vendor|Supplier|Issued\\s+by|Provider)\\s*:\\s*(.*)$");
    public static final Pattern SINGLE_COLUMN_RECIPIENT_LABEL = Pattern.compile(
            "(?i)^\\s*(?:Recipient|Empfänger|Rechnungsempfänger|An|Customer|Kunde)\\s*:\\s*(.*)$");

    // ---------------------------------------------------------------------
    // Vendor fingerprints
    // ---------------------------------------------------------------------

    public static final List<VendorProfile> VENDOR_PROFILES = List.of(
            new VendorProfile(
                    "Deutsche Bahn",
                    List.of("Deutsche Bahn", "DB Vertrieb", "DB Fernverkehr", "DB Regio"),
                    "·",
                    3, 20,
                    List.of("Invoice", "Rechnung", "GmbH", "AG", "Customer", "Kunde", "Page", "Seite", "Frankfurt", "Mainzer"),
                    "EUR"),
            new VendorProfile(
                    "Telekom",
                    List.of("Telekom Deutschland", "Deutsche Telekom"),
                    "·",
                    2, 18,
                    List.of("Rechnung", "Telekom", "GmbH", "AG", "Kundennummer", "Seite", "Bonn", "Postfach"),
                    "EUR")
    );

    // ---------------------------------------------------------------------
    // Amount and currency
    // ---------------------------------------------------------------------

    private static final String AMOUNT_TOKEN = "(?<![\\d.,])(\\d{1,3}(?:[.,']\\d{3})+(?:[.,]\\d{2})?|\\d+[.,]\\d{2})(?![\\d])";

    /**
     * Label-anchored amount patterns, most specific first. Group 1 is the amount token.
     */
    public static final List<Pattern> AMOUNT_PATTERNS = List.of(
            Pattern.compile("(?i)Total\\s+Amount(?:\\s+Due)?\\s*:?\\s*[€$£]?\\s*" + AMOUNT_TOKEN),
            Pattern.compile("(?i)Amount\\s+(?:Due|Invoice|Total)\\s*:?\\s*[€$£]?\\s*" + AMOUNT_TOKEN),
            Pattern.compile("(?i)(?:Grand\\s+Total|Balance\\s+Due|Invoice\\s+Amount)\\s*:?\\s*[€$£]?\\s*" + AMOUNT_TOKEN),
            Pattern.compile("(?i)(?:Gesamtbetrag|Rechnungsbetrag|Endbetrag|Zu\\s+zahlen)\\s*:?\\s*[€]?\\s*" + AMOUNT_TOKEN),
            Pattern.compile("(?i)\\bAmount\\s*:\\s*[€$£]?\\s*" + AMOUNT_TOKEN),
            Pattern.compile("(?i)\\b(?:Betrag|Summe)\\s*:?\\s*[€]?\\s*" + AMOUNT_TOKEN),
            Pattern.compile("(?i)\\bTotal\\s*:?\\s*[€$£]?\\s*" + AMOUNT_TOKEN),
            Pattern.compile("€\\s*" + AMOUNT_TOKEN),
            Pattern.compile(AMOUNT_TOKEN + "\\s*€"),
            Pattern.compile("\\$\\s*" + AMOUNT_TOKEN),
            Pattern.compile("£\\s*" + AMOUNT_TOKEN)
    );

    /** Bare amount tokens anywhere, used by the fallback strategy when no label matched. */
    public static final Pattern BARE_AMOUNT = Pattern.compile(AMOUNT_TOKEN);

    public static final Pattern CURRENCY_LABEL = Pattern.compile(
            "(?i)\\b(?:Currency|Währung)\\s*:\\s*([A-Za-z]{3}|[€$£])");

    public static final Pattern EUR_CODE = Pattern.compile("\\bEUR\\b");
    public static final Pattern USD_CODE = Pattern.compile("\\bUSD\\b");
    public static final Pattern GBP_CODE = Pattern.compile("\\bGBP\\b");
    public static final Pattern CHF_CODE = Pattern.compile("\\bCHF\\b");

    // ---------------------------------------------------------------------
    // E-mail
    // ---------------------------------------------------------------------

    public static final Pattern EMAIL = Pattern.compile("[\\w.+-]+@[\\w-]+(?:\\.[\\w-]+)*\\.[A-Za-z]{2,}");

    public static final List<String> SENDER_EMAIL_PREFIXES = List.of(
            "support@", "billing@", "info@", "invoices@", "accounts@", "sales@", "contact@", "hello@");

    public static final Pattern CONTACT_LABEL = Pattern.compile(
            "(?i)^\\s*(?:E-?Mail|Tel\\.?|Telefon|Phone|Fax|Web|Website|Mobil|Mobile)\\b\\s*:?.*$");

    // ---------------------------------------------------------------------
    // Banking
    // ---------------------------------------------------------------------

    public static final Pattern IBAN_LABELED = Pattern.compile(
            "(?i:IBAN)\\s*[:.]?\\s*([A-Za-z]{2}\\s?\\d{2}(?:\\s?[A-Za-z0-9]{1,4}){2,8})");
    public static final Pattern IBAN_UNLABELED = Pattern.compile(
            "\\b([A-Z]{2}\\d{2}(?:\\s?[A-Z0-9]{4}){2,7}(?:\\s?[A-Z0-9]{1,3})?)\\b");

    public static final Pattern BIC_LABELED = Pattern.compile(
            "(?i:BIC|SWIFT)(?:\\s*/\\s*(?i:SWIFT|BIC))?(?:\\s+(?i:Code))?\\s*[:.]?\\s*([A-Za-z0-9]{8,11})\\b");

    public static final Pattern ROUTING_NUMBER = Pattern.compile(
            "(?i)\\b(?:Routing\\s+Number|Routing\\s+No\\.?|Routing|ABA\\s+Number|ABA|RTN)\\s*[:#]?\\s*(\\d{9})\\b");
    public static final Pattern ACCOUNT_NUMBER = Pattern.compile(
            "(?i)(?:\\bAccount\\s+Number|\\bAccount\\s+No\\.?|\\bAcct\\s*#|\\bBank\\s+Account|\\bBanking\\s+Account|\\bKontonummer|(?<![\\w/])A/C)\\s*[:#]?\\s*(\\d[\\d -]{2,22}\\d)\\b");
    public static final Pattern SORT_CODE = Pattern.compile(
            "(?i)\\b(?:Sort\\s+Code|SC)\\s*[:#]?\\s*(\\d{2}[\\s-]?\\d{2}[\\s-]?\\d{2})\\b");

    public static final Pattern BANK_NAME_LABELED = Pattern.compile(
            "(?im)^[ \\t]*(?:Bank[ \\t]+Name|Bankname|Bank|Kreditinstitut)[ \\t]*:[ \\t]*(.+?)[ \\t]*$");
    public static final Pattern BANK_NAME_LINE = Pattern.compile(
            "(?m)^[ \\t]*((?:[A-Z][A-Za-z&.\\-]*[ \\t]+)*(?:Bank|Sparkasse|Volksbank|Postbank|Commerzbank|Raiffeisenbank)(?:[ \\t]+[A-Za-z&.\\-]+)*)[ \\t]*$");

    public static final Pattern PAYMENT_ADDRESS_HEADER = Pattern.compile("(?i)PAYMENT\\s+ADDRESS");
    public static final int PAYMENT_ADDRESS_MAX_LINES = 4;

    /** IBAN countries participating in the SEPA scheme. */
    public static final Set<String> SEPA_COUNTRIES = Set.of(
            "AD", "AT", "BE", "BG", "CH", "CY", "CZ", "DE", "DK", "EE", "ES", "FI", "FR", "GB", "GI",
            "GR", "HR", "HU", "IE", "IS", "IT", "LI", "LT", "LU", "LV", "MC", "MT", "NL", "NO", "PL",
            "PT", "RO", "SE", "SI", "SK", "SM", "VA");

    // ---------------------------------------------------------------------
    // Addresses
    // ---------------------------------------------------------------------

    public static final List<Pattern> POSTAL_CODE_PATTERNS = List.of(
            Pattern.compile("\\b\\d{5}(?:-\\d{4})?\\b"),
            Pattern.compile("\\b[A-Z]{1,2}\\d{1,2}[A-Z]?\\s*\\d[A-Z]{2}\\b"),
            Pattern.compile("\\b\\d{4}\\s?[A-Z]{2}\\b"),
            Pattern.compile("\\b(?:A|CH|D)-\\d{4,5}\\b")
    );

    /** Five-digit postal codes, used to split two addresses sharing one row. */
    public static final Pattern FIVE_DIGIT_POSTAL = Pattern.compile("\\b\\d{5}\\b");

    public static final List<Pattern> STREET_PATTERNS = List.of(
            Pattern.compile("\\b\\d+[A-Z]?\\s+(?:[A-Z][a-z]+\\s+){1,3}(?:Street|St\\.?|Avenue|Ave\\.?|Road|Rd\\.?|Drive|Dr\\.?|Lane|Ln\\.?|Boulevard|Blvd\\.?|Way|Court|Ct\\.?)(?:\\W|$)"),
            Pattern.compile("[A-ZÄÖÜ][a-zäöüß]+(?:straße|strasse|str\\.|weg|platz|allee|gasse|ring|damm)\\s+\\d+[a-zA-Z]?"),
            Pattern.compile("\\b(?:[A-ZÄÖÜ][a-zäöüß]+\\s+)+(?:Straße|Strasse|Weg|Platz|Allee)\\s+\\d+[a-zA-Z]?"),
            Pattern.compile("\\bPMB\\s+\\d+"),
            Pattern.compile("(?i)\\bP\\.?\\s?O\\.?\\s+Box\\s+\\d+"),
            Pattern.compile("\\bPostfach\\s+\\d+"),
            Pattern.compile("(?i)\\b(?:Suite|Ste\\.?|Floor|Unit)\\s+\\d+")
    );

    public static final List<String> COUNTRIES = List.of(
            "Germany", "United States", "USA", "United Kingdom", "UK", "France", "Netherlands",
            "Belgium", "Austria", "Switzerland", "Italy", "Spain", "Portugal", "Sweden", "Denmark",
            "Norway", "Poland", "Czech Republic", "Ireland", "Canada",
            "Deutschland", "Vereinigte Staaten", "Großbritannien", "Frankreich", "Niederlande",
            "Belgien", "Österreich", "Schweiz", "Italien", "Spanien");

    private static final List<Pattern> COUNTRY_PATTERNS = COUNTRIES.stream()
            .map(country -> Pattern.compile("(?<![\\p{L}])" + Pattern.quote(country) + "(?![\\p{L}])"))
            .toList();

    private static final Pattern HORIZONTAL_RULE = Pattern.compile("^[-=_*]{3,}$");
    private static final Pattern LABEL_STYLE = Pattern.compile("^[A-Za-zÄÖÜäöüß][A-Za-zÄÖÜäöüß .#/-]{0,30}:(?:\\s.*)?$");

    public static final List<String> SECTION_KEYWORDS = List.of(
            "invoice", "rechnung", "description", "beschreibung", "item", "quantity", "qty", "price",
            "amount", "total", "subtotal", "tax", "vat", "mwst", "payment", "due", "date", "datum",
            "number", "reference", "iban", "bic", "swift", "bank", "account", "routing", "sort code",
            "currency", "betrag", "summe", "zahlung");

    /** Splits a two-column row at a wide gap. */
    public static final Pattern COLUMN_GAP = Pattern.compile("\\s{3,}");

    // ---------------------------------------------------------------------
    // Language detection
    // ---------------------------------------------------------------------

    public static final List<String> GERMAN_INDICATORS = List.of(
            "Rechnung", "Rechnungsnummer", "Absender", "Rechnungsempfänger", "Gesamtbetrag",
            "Rechnungsbetrag", "MwSt", "Mehrwertsteuer", "Zahlungsbedingungen", "Fälligkeitsdatum",
            "Kundennummer", "straße", "strasse", "GmbH", "AG");

    public static final List<String> ENGLISH_INDICATORS = List.of(
            "Invoice", "Bill to", "From:", "To:", "Amount Due", "Total Amount", "Payment Terms",
            "Due Date", "Customer", "Street", "Avenue", "Road", "Inc", "Corp", "LLC");

    public static final List<String> INVOICE_KEYWORDS = List.of("invoice", "rechnung", "bill", "receipt", "quittung");

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    /**
     * German only when strictly more German indicators are present than English ones.
     */
    public static DocumentLanguage detectLanguage(String text) {
        if (text == null || text.isBlank()) return DocumentLanguage.EN;
        long german = GERMAN_INDICATORS.stream().filter(text::contains).count();
        long english = ENGLISH_INDICATORS.stream().filter(text::contains).count();
        return german > english ? DocumentLanguage.DE : DocumentLanguage.EN;
    }

    public static boolean isSenderEmail(String email) {
        if (email == null) return false;
        String lower = email.toLowerCase(Locale.ROOT);
        return SENDER_EMAIL_PREFIXES.stream().anyMatch(lower::startsWith);
    }

    public static List<String> findEmails(String text) {
        if (text == null || text.isEmpty()) return List.of();
        List<String> out = new ArrayList<>();
        Matcher m = EMAIL.matcher(text);
        while (m.find()) {
            out.add(m.group());
        }
        return Collections.unmodifiableList(out);
    }

    public static Optional<String> firstEmail(String line) {
        if (line == null) return Optional.empty();
        Matcher m = EMAIL.matcher(line);
        return m.find() ? Optional.of(m.group()) : Optional.empty();
    }

    public static Optional<VendorProfile> findVendor(String text) {
        if (text == null || text.isEmpty()) return Optional.empty();
        return VENDOR_PROFILES.stream().filter(p -> p.matches(text)).findFirst();
    }

    public static boolean containsCountry(String line) {
        if (line == null) return false;
        return COUNTRY_PATTERNS.stream().anyMatch(p -> p.matcher(line).find());
    }

    public static boolean containsPostalCode(String line) {
        if (line == null) return false;
        return POSTAL_CODE_PATTERNS.stream().anyMatch(p -> p.matcher(line).find());
    }

    public static boolean containsStreet(String line) {
        if (line == null) return false;
        return STREET_PATTERNS.stream().anyMatch(p -> p.matcher(line).find());
    }

    /**
     * Postal code, street or country. City-only lines are not recognized here.
     */
    public static boolean isAddressLine(String line) {
        if (line == null || line.length() < 3) return false;
        if (line.endsWith(":")) return false;
        return containsPostalCode(line) || containsStreet(line) || containsCountry(line);
    }

    public static boolean isPartyLabel(String line) {
        if (line == null) return false;
        return TWO_COLUMN_SENDER_LABEL.matcher(line).matches()
                || TWO_COLUMN_RECIPIENT_LABEL.matcher(line).matches()
                || SINGLE_COLUMN_SENDER_LABEL.matcher(line).matches()
                || SINGLE_COLUMN_RECIPIENT_LABEL.matcher(line).matches();
    }

    public static boolean isContactLine(String line) {
        return line != null && CONTACT_LABEL.matcher(line).matches();
    }

    /**
     * True when a line ends a party block: another party label, a {@code Label:} line other than
     * contact details, a horizontal rule, or a line opening with an invoice section keyword.
     */
    public static boolean isSectionBoundary(String line) {
        if (line == null) return false;
        String trimmed = line.trim();
        if (trimmed.isEmpty()) return false;

        if (isPartyLabel(trimmed)) return true;
        if (HORIZONTAL_RULE.matcher(trimmed).matches()) return true;
        if (isContactLine(trimmed)) return false;
        if (trimmed.endsWith(":") || LABEL_STYLE.matcher(trimmed).matches()) return true;

        String lower = trimmed.toLowerCase(Locale.ROOT);
        for (String keyword : SECTION_KEYWORDS) {
            if (lower.startsWith(keyword)
                    && (lower.length() == keyword.length() || !Character.isLetter(lower.charAt(keyword.length())))) {
                return true;
            }
        }
        return false;
    }

    public static boolean isHorizontalRule(String line) {
        return line != null && HORIZONTAL_RULE.matcher(line.trim()).matches();
    }

    public static boolean hasVendorFingerprint(String text) {
        return findVendor(text).isPresent();
    }

    public static boolean containsInvoiceKeyword(String text) {
        if (text == null) return false;
        String lower = text.toLowerCase(Locale.ROOT);
        return INVOICE_KEYWORDS.stream().anyMatch(lower::contains);
    }
}
