package com.parsely.backend.services.extraction.strategies;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.parsely.backend.enums.FieldName;
import com.parsely.backend.services.extraction.DocumentText;
import com.parsely.backend.services.extraction.FieldMap;

class TwoColumnStrategyTest {

    private final TwoColumnStrategy strategy = new TwoColumnStrategy();

    @Test
    void stackedBlocks_areParsedUpToTheNextLabel() {
        DocumentText doc = DocumentText.of(List.of(
                "INVOICE",
                "From: Acme Consulting GmbH",
                "Hauptstraße 5",
                "10115 Berlin",
                "billing@acme.de",
                "To: Tech Solutions Ltd",
                "221B Baker Street",
                "London NW1 6XE",
                "jane@techsolutions.co.uk",
                "Amount: 1,250.00",
                "Currency: EUR"
        ));

        assertTrue(strategy.canHandle(doc));
        FieldMap fields = strategy.parse(doc);

        assertEquals("Acme Consulting GmbH", fields.get(FieldName.SENDER).get());
        assertEquals("Hauptstraße 5, 10115 Berlin", fields.get(FieldName.SENDER_ADDRESS).get());
        assertEquals("billing@acme.de", fields.get(FieldName.SENDER_EMAIL).get());
        assertEquals("Tech Solutions Ltd", fields.get(FieldName.RECIPIENT).get());
        assertEquals("221B Baker Street, London NW1 6XE", fields.get(FieldName.RECIPIENT_ADDRESS).get());
        assertEquals("jane@techsolutions.co.uk", fields.get(FieldName.RECIPIENT_EMAIL).get());
        assertEquals("1250.00", fields.get(FieldName.AMOUNT).get());
        assertEquals("EUR", fields.get(FieldName.CURRENCY).get());
        assertFalse(fields.isResolved(FieldName.IBAN));
        assertFalse(fields.isResolved(FieldName.PAYMENT_METHOD));
    }

    @Test
    void sideBySideColumns_areSplitAtTheGap() {
        DocumentText doc = DocumentText.of(List.of(
                "From: Acme Consulting GmbH      To: Globex Corporation",
                "Hauptstraße 5                   42 Wallaby Way",
                "10115 Berlin                    Sydney",
                "billing@acme.de                 jane@globex.com",
                "",
                "Total: 980.00 USD"
        ));

        assertTrue(strategy.canHandle(doc));
        FieldMap fields = strategy.parse(doc);

        assertEquals("Acme Consulting GmbH", fields.get(FieldName.SENDER).get());
        assertEquals("Globex Corporation", fields.get(FieldName.RECIPIENT).get());
        assertEquals("Hauptstraße 5, 10115 Berlin", fields.get(FieldName.SENDER_ADDRESS).get());
        assertEquals("42 Wallaby Way, Sydney", fields.get(FieldName.RECIPIENT_ADDRESS).get());
        assertEquals("billing@acme.de", fields.get(FieldName.SENDER_EMAIL).get());
        assertEquals("jane@globex.com", fields.get(FieldName.RECIPIENT_EMAIL).get());
        assertEquals("980.00", fields.get(FieldName.AMOUNT).get());
        assertEquals("USD", fields.get(FieldName.CURRENCY).get());
    }

    @Test
    void senderLabelAlone_isNotEnough() {
        DocumentText doc = DocumentText.of(List.of("From: Acme Consulting GmbH", "Amount: 10.00"));
        assertFalse(strategy.canHandle(doc));
    }

    @Test
    void blankDocument_isNotHandledAndParsesToUnresolved() {
        DocumentText doc = DocumentText.of(List.of("", "  "));
        assertFalse(strategy.canHandle(doc));
        assertTrue(strategy.parse(doc).isEmpty());
    }
}
