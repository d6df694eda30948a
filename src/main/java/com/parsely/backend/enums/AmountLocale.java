package com.parsely.backend.enums;

/**
 * Number formatting convention used to read an amount token.
 * US: "1,234.56" (comma groups, dot decimal). EU: "1.234,56" (dot groups, comma decimal).
 */
public enum AmountLocale {
    US('.', ','),
    EU(',', '.');

    private final char decimalSeparator;
    private final char groupingSeparator;

    AmountLocale(char decimalSeparator, char groupingSeparator) {
        this.decimalSeparator = decimalSeparator;
        this.groupingSeparator = groupingSeparator;
    }

    public char getDecimalSeparator() {
        return decimalSeparator;
    }

    public char getGroupingSeparator() {
        return groupingSeparator;
    }
}
