package com.chainbridge.payment.kafka;

import com.chainbridge.payment.canonical.CreditTransferCommand;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CreditTransferCommandSerializerTest {

    private final CreditTransferCommandSerializer serializer = new CreditTransferCommandSerializer();

    @Test
    public void testWireFieldNames() throws Exception {
        CreditTransferCommand command = CreditTransferCommand.builder()
            .transactionId("TX-1")
            .fromAccount("US33BOFA12345678901234")
            .toAccount("GB82WEST12345698765432")
            .amount("50000.00")
            .currency("USD")
            .reference("E2E-1")
            .memo("Invoice 42")
            .source("ISO20022:pacs.008")
            .originalMessageId("MSG-1")
            .build();

        JsonNode json = new ObjectMapper().readTree(serializer.serialize("ledger", command));

        assertEquals("CREDIT_TRANSFER", json.get("command").asText());
        assertEquals("TX-1", json.get("transaction_id").asText());
        assertEquals("US33BOFA12345678901234", json.get("from_account").asText());
        assertEquals("GB82WEST12345698765432", json.get("to_account").asText());
        assertTrue(json.get("amount").isTextual(), "Amount is sent as a decimal string");
        assertEquals("50000.00", json.get("amount").asText());
        assertEquals("USD", json.get("currency").asText());
        assertEquals("E2E-1", json.get("reference").asText());
        assertEquals("Invoice 42", json.get("memo").asText());
        assertEquals("ISO20022:pacs.008", json.get("source").asText());
        assertEquals("MSG-1", json.get("original_message_id").asText());
        assertFalse(json.has("transactionId"));
        assertEquals(10, json.size(), "Only the declared wire properties are written");
    }

    @Test
    public void testNullFieldsOmitted() throws Exception {
        JsonNode json = new ObjectMapper().readTree(
            serializer.serialize("ledger", CreditTransferCommand.builder().transactionId("TX-2").build()));

        assertFalse(json.has("memo"));
        assertEquals(2, json.size());
    }

    @Test
    public void testNullCommand() {
        assertNull(serializer.serialize("ledger", null));
    }
}
