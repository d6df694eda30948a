package com.parsely.backend.services.extraction.strategies;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.parsely.backend.enums.FieldName;
import com.parsely.backend.services.extraction.DocumentText;
import com.parsely.backend.services.extraction.FieldMap;

class CompanySpecificStrategyTest {

    private final CompanySpecificStrategy strategy = new CompanySpecificStrategy();

    @Test
    void deutscheBahnLayout_readsSenderFromHeaderAndRecipientFromNameLine() {
        DocumentText doc = DocumentText.of(List.of(
                "DB Fernverkehr AG",
                "Stephensonstraße 1 · 60326 Frankfurt am Main",
                "Rechnung",
                "Max Mustermann",
                "Musterweg 12",
                "12345 Berlin",
                "Gesamtbetrag 89,90"
        ));

        assertTrue(strategy.canHandle(doc));
        FieldMap fields = strategy.parse(doc);

        assertEquals("DB Fernverkehr AG", fields.get(FieldName.SENDER).get());
        assertEquals("Stephensonstraße 1, 60326 Frankfurt am Main", fields.get(FieldName.SENDER_ADDRESS).get());
        assertEquals("Max Mustermann", fields.get(FieldName.RECIPIENT).get());
        assertEquals("Musterweg 12, 12345 Berlin", fields.get(FieldName.RECIPIENT_ADDRESS).get());
        assertEquals("89.90", fields.get(FieldName.AMOUNT).get());
    }

    @Test
    void vendorDefaultCurrency_appliesWhenTextHasNone() {
        DocumentText doc = DocumentText.of(List.of("Telekom Deutschland GmbH", "Rechnungsbetrag 49,95"));

        FieldMap fields = strategy.parse(doc);

        assertEquals("EUR", fields.get(FieldName.CURRENCY).get());
        assertEquals("49.95", fields.get(FieldName.AMOUNT).get());
    }

    @Test
    void unknownVendor_isNotApplicable() {
        assertFalse(strategy.canHandle(DocumentText.of(List.of("Acme Consulting GmbH", "Total: 10.00"))));
    }

    @Test
    void personName_heuristic() {
        assertTrue(CompanySpecificStrategy.looksLikePersonName("Max Mustermann"));
        assertTrue(CompanySpecificStrategy.looksLikePersonName("Anna Maria Schmidt"));
        assertFalse(CompanySpecificStrategy.looksLikePersonName("Kundennummer: 123"));
        assertFalse(CompanySpecificStrategy.looksLikePersonName("Max"));
        assertFalse(CompanySpecificStrategy.looksLikePersonName("max mustermann"));
    }
}
