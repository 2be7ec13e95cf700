package com.chainbridge.payment.canonical;

import com.chainbridge.payment.canonical.enums.Iso20022MessageType;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.time.Instant;

/**
 * Canonical representation of one customer credit transfer parsed from a pacs.008 message.
 *
 * Instances are immutable. A correction requires parsing a new message.
 * Persistence and history are the concern of downstream consumers.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PaymentInstruction {

    private static final String COMMAND_SOURCE = "ISO20022:" + Iso20022MessageType.PACS_008.getFamily();

    /**
     * GrpHdr/MsgId.
     */
    @Builder.Default
    String messageId = "";

    /**
     * PmtId/InstrId.
     */
    @Builder.Default
    String instructionId = "";

    /**
     * PmtId/EndToEndId.
     */
    @Builder.Default
    String endToEndId = "";

    /**
     * PmtId/UETR when present, otherwise PmtId/TxId.
     */
    @Builder.Default
    String transactionId = "";

    @Builder.Default
    PaymentParty debtor = PaymentParty.EMPTY;

    @Builder.Default
    PaymentParty creditor = PaymentParty.EMPTY;

    /**
     * Debtor's bank.
     */
    @Builder.Default
    PaymentParty debtorAgent = PaymentParty.EMPTY;

    /**
     * Creditor's bank.
     */
    @Builder.Default
    PaymentParty creditorAgent = PaymentParty.EMPTY;

    PaymentAmount amount;

    /**
     * GrpHdr/CreDtTm as sent.
     */
    @Builder.Default
    String creationDateTime = "";

    /**
     * IntrBkSttlmDt as sent.
     */
    @Builder.Default
    String settlementDate = "";

    /**
     * Unstructured remittance information.
     */
    @Builder.Default
    String remittanceInfo = "";

    /**
     * Sanitized message text, retained for audit.
     */
    @JsonIgnore
    @ToString.Exclude
    @Builder.Default
    String rawXml = "";

    @Builder.Default
    Instant parsedAt = Instant.now();

    /**
     * Translate into the command consumed by the ledger.
     */
    public CreditTransferCommand toCreditTransferCommand() {
        return CreditTransferCommand.builder()
            .transactionId(transactionId.isEmpty() ? instructionId : transactionId)
            .fromAccount(debtor.getAccountId())
            .toAccount(creditor.getAccountId())
            .amount(amount != null ? amount.toPlainString() : null)
            .currency(amount != null ? amount.getCurrency() : null)
            .reference(endToEndId)
            .memo(remittanceInfo)
            .source(COMMAND_SOURCE)
            .originalMessageId(messageId)
            .build();
    }
}
