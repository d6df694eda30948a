package com.parsely.backend.enums;

public enum PaymentMethod {
    SEPA,
    SEPA_INTERNATIONAL,
    ACH,
    BACS
}
