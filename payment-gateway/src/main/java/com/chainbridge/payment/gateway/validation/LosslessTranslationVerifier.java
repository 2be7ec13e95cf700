package com.chainbridge.payment.gateway.validation;

import com.chainbridge.payment.canonical.PaymentInstruction;
import com.chainbridge.payment.error.LosslessTranslationException;

import java.util.Objects;

/**
 * Checks that two parses of the same message agree on the critical fields: amount
 * (magnitude and currency) and instruction id.
 */
public class LosslessTranslationVerifier {

    /**
     * @return true when the critical fields match
     * @throws LosslessTranslationException naming the first mismatching field and both values
     */
    public boolean verify(PaymentInstruction original, PaymentInstruction reparsed) throws LosslessTranslationException {
        if (!Objects.equals(original.getAmount(), reparsed.getAmount())) {
            throw new LosslessTranslationException("Amount", original.getAmount(), reparsed.getAmount());
        }
        if (!Objects.equals(original.getInstructionId(), reparsed.getInstructionId())) {
            throw new LosslessTranslationException("InstrId", original.getInstructionId(), reparsed.getInstructionId());
        }
        return true;
    }
}
