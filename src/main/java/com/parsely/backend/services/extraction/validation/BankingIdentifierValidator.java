package com.parsely.backend.services.extraction.validation;

import java.math.BigInteger;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Checksum and format checks for IBAN, BIC, ABA routing numbers and UK sort codes.
 */
public final class BankingIdentifierValidator {

    private static final Pattern IBAN_SHAPE = Pattern.compile("^[A-Z]{2}\\d{2}[A-Z0-9]+$");
    private static final Pattern BIC_SHAPE = Pattern.compile("^[A-Z]{4}[A-Z]{2}[A-Z0-9]{2}([A-Z0-9]{3})?$");
    private static final Pattern BIC_LOOSE = Pattern.compile("^[A-Z0-9]{6,12}$");
    private static final Pattern NINE_DIGITS = Pattern.compile("^\\d{9}$");

    private static final BigInteger NINETY_SEVEN = BigInteger.valueOf(97);

    private static final int IBAN_MIN_LENGTH = 15;
    private static final int IBAN_MAX_LENGTH = 34;

    private BankingIdentifierValidator() {
    }

    /**
     * Removes whitespace and uppercases. Returns an empty string for null.
     */
    public static String compact(String token) {
        if (token == null) return "";
        return token.replaceAll("\\s+", "").toUpperCase(Locale.ROOT);
    }

    /**
     * ISO 7064 mod-97 check: the first four characters move to the end, letters map to 10..35,
     * and the resulting number must leave remainder 1.
     */
    public static boolean validateIban(String token) {
        String iban = compact(token);
        if (!hasIbanShape(iban)) return false;
        return mod97(iban) == 1;
    }

    public static ValidatedToken<String> checkIban(String token) {
        return validateIban(token) ? ValidatedToken.valid(token, compact(token)) : ValidatedToken.invalid(token);
    }

    /**
     * True when the token has the length and {@code LL99...} layout of an IBAN, whatever its checksum.
     */
    public static boolean hasIbanShape(String token) {
        String iban = compact(token);
        if (iban.length() < IBAN_MIN_LENGTH || iban.length() > IBAN_MAX_LENGTH) return false;
        return IBAN_SHAPE.matcher(iban).matches();
    }

    /**
     * Remainder of the rearranged IBAN modulo 97. Callers must check the shape first.
     */
    static int mod97(String compactIban) {
        String rearranged = compactIban.substring(4) + compactIban.substring(0, 4);
        StringBuilder digits = new StringBuilder(rearranged.length() * 2);
        for (char c : rearranged.toCharArray()) {
            if (Character.isDigit(c)) {
                digits.append(c);
            } else {
                digits.append(c - 'A' + 10);
            }
        }
        return new BigInteger(digits.toString()).mod(NINETY_SEVEN).intValue();
    }

    /**
     * Two-letter country prefix of a shaped IBAN, or empty.
     */
    public static Optional<String> ibanCountry(String token) {
        String iban = compact(token);
        if (!hasIbanShape(iban)) return Optional.empty();
        return Optional.of(iban.substring(0, 2));
    }

    public static boolean validateBic(String token) {
        String bic = compact(token);
        if (bic.length() != 8 && bic.length() != 11) return false;
        return BIC_SHAPE.matcher(bic).matches();
    }

    /**
     * Loose alphanumeric shape, used to give partial credit to a BIC-like value that fails the format check.
     */
    public static boolean hasBicLikeShape(String token) {
        return BIC_LOOSE.matcher(compact(token)).matches();
    }

    /**
     * Nine digits, a Federal Reserve prefix (01-12, 21-32, 61-72, 80) and a 3-7-1 weighted checksum.
     * Strings made of one repeated digit are rejected even when the checksum holds.
     */
    public static boolean validateAbaRouting(String token) {
        String routing = compact(token);
        if (!NINE_DIGITS.matcher(routing).matches()) return false;

        if (routing.chars().distinct().count() == 1) return false;

        int prefix = Integer.parseInt(routing.substring(0, 2));
        boolean prefixOk = (prefix >= 1 && prefix <= 12)
                || (prefix >= 21 && prefix <= 32)
                || (prefix >= 61 && prefix <= 72)
                || prefix == 80;
        if (!prefixOk) return false;

        int[] d = new int[9];
        for (int i = 0; i < 9; i++) {
            d[i] = routing.charAt(i) - '0';
        }
        int checksum = 3 * (d[0] + d[3] + d[6])
                + 7 * (d[1] + d[4] + d[7])
                + (d[2] + d[5] + d[8]);
        return checksum % 10 == 0;
    }

    /**
     * Formats a UK sort code as {@code DD-DD-DD}. Any non-digit is ignored; exactly six digits must remain.
     * There is no checksum for sort codes.
     */
    public static Optional<String> normalizeSortCode(String token) {
        if (token == null) return Optional.empty();
        String digits = token.replaceAll("\\D", "");
        if (digits.length() != 6) return Optional.empty();
        return Optional.of(digits.substring(0, 2) + "-" + digits.substring(2, 4) + "-" + digits.substring(4, 6));
    }

    public static ValidatedToken<String> checkSortCode(String token) {
        return normalizeSortCode(token)
                .map(code -> ValidatedToken.valid(token, code))
                .orElseGet(() -> ValidatedToken.invalid(token));
    }
}
