package com.parsely.backend.enums;

/**
 * Closed set of fields every extraction produces.
 * Declaration order is the output order of a field map.
 */
public enum FieldName {
    SENDER("sender"),
    RECIPIENT("recipient"),
    AMOUNT("amount"),
    CURRENCY("currency"),
    SENDER_ADDRESS("sender_address"),
    RECIPIENT_ADDRESS("recipient_address"),
    SENDER_EMAIL("sender_email"),
    RECIPIENT_EMAIL("recipient_email"),
    IBAN("iban"),
    BIC("bic"),
    BANK_NAME("bank_name"),
    PAYMENT_ADDRESS("payment_address"),
    ROUTING_NUMBER("routing_number"),
    ACCOUNT_NUMBER("account_number"),
    SORT_CODE("sort_code"),
    PAYMENT_METHOD("payment_method");

    private final String key;

    FieldName(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
