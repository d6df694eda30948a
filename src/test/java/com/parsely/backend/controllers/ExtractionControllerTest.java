package com.parsely.backend.controllers;

import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.nullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class ExtractionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void extract_twoColumnInvoice_returnsFields() throws Exception {
        String body = """
                {"lines": ["INVOICE", "From: Acme Consulting GmbH", "To: Tech Solutions Ltd",
                           "Amount: 1,250.00", "Currency: EUR"]}
                """;

        mockMvc.perform(post("/api/extractions").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.strategy").value("TWO_COLUMN"))
                .andExpect(jsonPath("$.data.fields.sender").value("Acme Consulting GmbH"))
                .andExpect(jsonPath("$.data.fields.amount").value("1250.00"))
                .andExpect(jsonPath("$.data.fields.iban").value(nullValue()))
                .andExpect(jsonPath("$.data.unresolvedFields", hasItem("payment_method")))
                .andExpect(jsonPath("$.data.requiresReview").value(true));
    }

    @Test
    void extract_rawText_isAccepted() throws Exception {
        String body = """
                {"text": "IBAN: DE89370400440532013000\\nBIC: DEUTDEFF"}
                """;

        mockMvc.perform(post("/api/extractions").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.fields.iban").value("DE89370400440532013000"))
                .andExpect(jsonPath("$.data.fields.payment_method").value("SEPA"));
    }

    @Test
    void extract_withoutContent_returnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/extractions").contentType(MediaType.APPLICATION_JSON).content("{\"text\": \"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("Validation failed"))
                .andExpect(jsonPath("$.errors[0]").value("contentPresent: lines or text is required"));
    }

    @Test
    void extract_malformedJson_returnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/extractions").contentType(MediaType.APPLICATION_JSON).content("{\"lines\": ["))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Malformed request body"));
    }

    @Test
    void batch_returnsOneResultPerDocumentInOrder() throws Exception {
        String body = """
                {"documents": [
                  {"lines": ["Routing Number: 121000248", "Account Number: 1234567890"]},
                  {"lines": ["From: Acme Consulting GmbH", "To: Tech Solutions Ltd"]}
                ]}
                """;

        mockMvc.perform(post("/api/extractions/batch").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("2 documents processed"))
                .andExpect(jsonPath("$.data[0].fields.payment_method").value("ACH"))
                .andExpect(jsonPath("$.data[1].fields.recipient").value("Tech Solutions Ltd"));
    }

    @Test
    void batch_withInvalidDocument_returnsBadRequest() throws Exception {
        String body = """
                {"documents": [{"lines": []}]}
                """;

        mockMvc.perform(post("/api/extractions/batch").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Validation failed"));
    }

    @Test
    void batch_empty_returnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/extractions/batch").contentType(MediaType.APPLICATION_JSON).content("{\"documents\": []}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors[0]").value("documents: documents is required"));
    }

    @Test
    void apiDocs_describeExtractionEndpoints() throws Exception {
        mockMvc.perform(get("/v3/api-docs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.info.title").value("Parsely Extraction API"))
                .andExpect(jsonPath("$.paths['/api/extractions/batch']").exists());
    }
}
