package com.parsely.backend.services.extraction.validation;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class EmailValidatorTest {

    @Test
    void acceptsOrdinaryAddresses() {
        assertTrue(EmailValidator.isValidEmail("billing@acme.com"));
        assertTrue(EmailValidator.isValidEmail("jane.doe+invoices@mail.example.co.uk"));
    }

    @Test
    void rejectsMalformedAddresses() {
        assertFalse(EmailValidator.isValidEmail(null));
        assertFalse(EmailValidator.isValidEmail(""));
        assertFalse(EmailValidator.isValidEmail("@acme.com"));
        assertFalse(EmailValidator.isValidEmail("billing@acme"));
        assertFalse(EmailValidator.isValidEmail("billing@@acme.com"));
        assertFalse(EmailValidator.isValidEmail("billing@acme..com"));
        assertFalse(EmailValidator.isValidEmail("bill ing@acme.com"));
    }
}
