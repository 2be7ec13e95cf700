package com.chainbridge.payment.canonical.enums;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class StatusCodesTest {

    @Test
    public void testTransactionStatusCategories() {
        assertEquals(TransactionStatus.Category.ACCEPTED, TransactionStatus.ACSC.getCategory());
        assertEquals(TransactionStatus.Category.IN_FLIGHT, TransactionStatus.PDNG.getCategory());
        assertTrue(TransactionStatus.RJCT.isRejection());
        assertFalse(TransactionStatus.ACCP.isRejection());
    }

    @Test
    public void testFromValue() {
        assertEquals(TransactionStatus.RCVD, TransactionStatus.fromValue("RCVD"));
        assertEquals(StatusReasonCode.AM04, StatusReasonCode.fromValue("AM04"));
        assertEquals("Insufficient funds", StatusReasonCode.AM04.getDescription());
        assertThrows(IllegalArgumentException.class, () -> TransactionStatus.fromValue("XXXX"));
        assertThrows(IllegalArgumentException.class, () -> StatusReasonCode.fromValue(null));
    }

    @Test
    public void testMessageTypeNamespaces() {
        assertEquals("urn:iso:std:iso:20022:tech:xsd:pacs.008.001.08", Iso20022MessageType.PACS_008.getNamespace());
        assertEquals("pacs.002", Iso20022MessageType.PACS_002.getFamily());
        assertTrue(Iso20022MessageType.PACS_008.matchesNamespace("urn:iso:std:iso:20022:tech:xsd:pacs.008.001.10"));
        assertFalse(Iso20022MessageType.PACS_008.matchesNamespace("urn:iso:std:iso:20022:tech:xsd:pacs.009.001.08"));
        assertFalse(Iso20022MessageType.PACS_008.matchesNamespace(null));
    }
}
