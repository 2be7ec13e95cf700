package com.chainbridge.payment.gateway.validation;

import com.chainbridge.payment.canonical.PaymentAmount;
import com.chainbridge.payment.canonical.PaymentInstruction;
import com.chainbridge.payment.error.LosslessTranslationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class LosslessTranslationVerifierTest {

    private final LosslessTranslationVerifier verifier = new LosslessTranslationVerifier();

    private PaymentInstruction instruction(String amount, String currency, String instructionId) {
        return PaymentInstruction.builder()
            .instructionId(instructionId)
            .amount(PaymentAmount.of(amount, currency))
            .build();
    }

    @Test
    public void testMatchingFields() throws Exception {
        assertTrue(verifier.verify(instruction("50000.00", "USD", "I-1"), instruction("50000.00", "USD", "I-1")));
    }

    @Test
    public void testScaleDifferenceIsNotAMismatch() throws Exception {
        assertTrue(verifier.verify(instruction("100", "USD", "I-1"), instruction("100.00", "USD", "I-1")));
    }

    @Test
    public void testAmountMismatch() {
        LosslessTranslationException e = assertThrows(LosslessTranslationException.class,
            () -> verifier.verify(instruction("100.00", "USD", "I-1"), instruction("100.01", "USD", "I-1")));

        assertEquals("Amount", e.getField());
        assertEquals("100.00 USD", e.getOriginalValue());
        assertEquals("100.01 USD", e.getReparsedValue());
        assertEquals("Amount mismatch: 100.00 USD != 100.01 USD", e.getMessage());
    }

    @Test
    public void testCurrencyMismatch() {
        LosslessTranslationException e = assertThrows(LosslessTranslationException.class,
            () -> verifier.verify(instruction("100", "USD", "I-1"), instruction("100", "EUR", "I-1")));

        assertEquals("Amount", e.getField());
    }

    @Test
    public void testInstructionIdMismatch() {
        LosslessTranslationException e = assertThrows(LosslessTranslationException.class,
            () -> verifier.verify(instruction("1", "USD", "I-1"), instruction("1", "USD", "I-2")));

        assertEquals("InstrId", e.getField());
        assertEquals("InstrId mismatch: I-1 != I-2", e.getMessage());
        assertEquals("LOSSLESS_TRANSLATION", e.getErrorCode());
    }

    @Test
    public void testAmountCheckedBeforeInstructionId() {
        LosslessTranslationException e = assertThrows(LosslessTranslationException.class,
            () -> verifier.verify(instruction("1", "USD", "I-1"), instruction("2", "USD", "I-2")));

        assertEquals("Amount", e.getField());
    }
}
