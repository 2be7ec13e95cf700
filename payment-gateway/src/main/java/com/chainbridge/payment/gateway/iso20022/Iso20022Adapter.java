package com.chainbridge.payment.gateway.iso20022;

import com.chainbridge.payment.canonical.PaymentInstruction;
import com.chainbridge.payment.canonical.StatusReport;
import com.chainbridge.payment.canonical.enums.StatusReasonCode;
import com.chainbridge.payment.canonical.enums.TransactionStatus;
import com.chainbridge.payment.currency.CurrencyAllowList;
import com.chainbridge.payment.error.CurrencyValidationException;
import com.chainbridge.payment.error.LosslessTranslationException;
import com.chainbridge.payment.error.MalformedXmlException;
import com.chainbridge.payment.error.SchemaValidationException;
import com.chainbridge.payment.gateway.validation.InstructionValidator;
import com.chainbridge.payment.gateway.validation.LosslessTranslationVerifier;
import com.chainbridge.payment.gateway.validation.ValidationResult;

import java.util.Objects;

/**
 * Adapter between ISO 20022 messages and the canonical payment model.
 *
 * Parses pacs.008 customer credit transfers into {@link PaymentInstruction}s and generates
 * pacs.002 status reports. Parse and generate are synchronous and CPU-only; failures are
 * permanent for the input and are never retried. The only mutable state is the
 * {@link AdapterStatistics} counter, so one instance may be shared across threads.
 *
 * Usage example:
 * <pre>{@code
 * Iso20022Adapter adapter = new Iso20022Adapter();
 * PaymentInstruction instruction = adapter.parseCreditTransfer(xml);
 * String ack = adapter.generateAcknowledgment(instruction);
 * }</pre>
 */
public class Iso20022Adapter {

    private final Pacs008Parser parser;
    private final Pacs002Generator generator;
    private final InstructionValidator validator;
    private final LosslessTranslationVerifier losslessVerifier;
    private final AdapterStatistics statistics = new AdapterStatistics();

    public Iso20022Adapter() {
        this(CurrencyAllowList.defaults());
    }

    public Iso20022Adapter(CurrencyAllowList currencyAllowList) {
        this.parser = new Pacs008Parser(currencyAllowList);
        this.generator = new Pacs002Generator();
        this.validator = new InstructionValidator(currencyAllowList);
        this.losslessVerifier = new LosslessTranslationVerifier();
    }

    /**
     * Parse a pacs.008 message.
     *
     * @throws MalformedXmlException if the input is empty or not well-formed
     * @throws SchemaValidationException if a required element is missing or the amount is unparsable
     * @throws CurrencyValidationException if the amount currency is not in the allow-list
     */
    public PaymentInstruction parseCreditTransfer(String xmlMessage)
            throws MalformedXmlException, SchemaValidationException, CurrencyValidationException {
        PaymentInstruction instruction = parser.parse(xmlMessage);
        statistics.recordParsed();
        return instruction;
    }

    public String generateStatusReport(StatusReport report) {
        String xml = generator.generate(report);
        statistics.recordGenerated();
        return xml;
    }

    /**
     * Generate a status report for the instruction.
     *
     * @param reasonCode null for no StsRsnInf block
     * @param additionalInfo optional free text, only emitted together with a reason code
     */
    public String generateStatusReport(PaymentInstruction instruction,
                                       TransactionStatus status,
                                       StatusReasonCode reasonCode,
                                       String additionalInfo) {
        return generateStatusReport(StatusReport.forInstruction(instruction, status, reasonCode, additionalInfo));
    }

    /**
     * ACCP report without a reason.
     */
    public String generateAcknowledgment(PaymentInstruction instruction) {
        return generateStatusReport(instruction, TransactionStatus.ACCP, null, null);
    }

    /**
     * RJCT report with a mandatory reason code.
     */
    public String generateRejection(PaymentInstruction instruction, StatusReasonCode reasonCode, String additionalInfo) {
        Objects.requireNonNull(reasonCode, "reasonCode is required for a rejection");
        return generateStatusReport(instruction, TransactionStatus.RJCT, reasonCode, additionalInfo);
    }

    public ValidationResult validateInstruction(PaymentInstruction instruction) {
        return validator.validate(instruction);
    }

    public boolean verifyLosslessTranslation(PaymentInstruction original, PaymentInstruction reparsed)
            throws LosslessTranslationException {
        return losslessVerifier.verify(original, reparsed);
    }

    /**
     * Re-parse the retained XML of an instruction and compare the critical fields.
     */
    public boolean verifyRoundTrip(PaymentInstruction instruction)
            throws MalformedXmlException, SchemaValidationException, CurrencyValidationException,
                   LosslessTranslationException {
        PaymentInstruction reparsed = parseCreditTransfer(instruction.getRawXml());
        return verifyLosslessTranslation(instruction, reparsed);
    }

    public AdapterStatistics.Snapshot getStatistics() {
        return statistics.snapshot();
    }

    public void resetStatistics() {
        statistics.reset();
    }
}
