package com.chainbridge.payment.canonical;

import com.chainbridge.payment.canonical.enums.StatusReasonCode;
import com.chainbridge.payment.canonical.enums.TransactionStatus;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class PaymentInstructionTest {

    private PaymentInstruction.PaymentInstructionBuilder instruction() {
        return PaymentInstruction.builder()
            .messageId("MSGID-2026-01-11-001")
            .instructionId("INSTR-20260111-ABC123")
            .endToEndId("E2E-REF-INVOICE-9876")
            .transactionId("TXN-UETR-550e8400-e29b")
            .amount(PaymentAmount.of("50000.00", "USD"))
            .debtor(PaymentParty.builder().name("Acme Corporation").accountId("US33BOFA12345678901234").build())
            .creditor(PaymentParty.builder().name("Global Widgets Ltd").accountId("GB82WEST12345698765432").build())
            .remittanceInfo("Payment for Invoice INV-2026-9876");
    }

    @Test
    public void testDefaultsAreEmpty() {
        PaymentInstruction empty = PaymentInstruction.builder().build();

        assertEquals("", empty.getMessageId());
        assertEquals("", empty.getRawXml());
        assertSame(PaymentParty.EMPTY, empty.getDebtor());
        assertFalse(empty.getDebtor().isIdentified());
        assertNull(empty.getAmount());
        assertNotNull(empty.getParsedAt());
    }

    @Test
    public void testCreditTransferCommand() {
        CreditTransferCommand command = instruction().build().toCreditTransferCommand();

        assertEquals("CREDIT_TRANSFER", command.getCommand());
        assertEquals("TXN-UETR-550e8400-e29b", command.getTransactionId());
        assertEquals("US33BOFA12345678901234", command.getFromAccount());
        assertEquals("GB82WEST12345698765432", command.getToAccount());
        assertEquals("50000.00", command.getAmount());
        assertEquals("USD", command.getCurrency());
        assertEquals("E2E-REF-INVOICE-9876", command.getReference());
        assertEquals("Payment for Invoice INV-2026-9876", command.getMemo());
        assertEquals("ISO20022:pacs.008", command.getSource());
        assertEquals("MSGID-2026-01-11-001", command.getOriginalMessageId());
    }

    @Test
    public void testCommandFallsBackToInstructionId() {
        CreditTransferCommand command = instruction().transactionId("").build().toCreditTransferCommand();

        assertEquals("INSTR-20260111-ABC123", command.getTransactionId());
    }

    @Test
    public void testRawXmlExcludedFromToString() {
        PaymentInstruction withXml = instruction().rawXml("<Document>secret</Document>").build();

        assertFalse(withXml.toString().contains("secret"));
    }

    @Test
    public void testStatusReportForInstruction() {
        StatusReport report = StatusReport.forInstruction(instruction().build(),
            TransactionStatus.RJCT, StatusReasonCode.AC04, "Closed account");

        assertEquals("MSGID-2026-01-11-001", report.getOriginalMessageId());
        assertEquals("INSTR-20260111-ABC123", report.getOriginalInstructionId());
        assertEquals("E2E-REF-INVOICE-9876", report.getOriginalEndToEndId());
        assertTrue(report.hasReason());
        assertNotNull(report.getReportId());
        assertNotEquals(report.getReportId(), StatusReport.forInstruction(instruction().build(),
            TransactionStatus.RJCT, StatusReasonCode.AC04, null).getReportId());
    }

    @Test
    public void testStatusReportRequiresStatus() {
        assertThrows(NullPointerException.class, () -> StatusReport.builder().build());
    }
}
