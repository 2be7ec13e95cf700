package com.chainbridge.payment.canonical;

import com.chainbridge.payment.canonical.enums.StatusReasonCode;
import com.chainbridge.payment.canonical.enums.TransactionStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Outcome to acknowledge or reject a payment instruction, serialized once as pacs.002.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StatusReport {

    @Builder.Default
    String originalMessageId = "";

    @Builder.Default
    String originalInstructionId = "";

    @Builder.Default
    String originalEndToEndId = "";

    @NonNull
    TransactionStatus status;

    /**
     * Present for rejections; null means no reason block is emitted.
     */
    StatusReasonCode reasonCode;

    String additionalInfo;

    @Builder.Default
    String reportId = UUID.randomUUID().toString();

    @Builder.Default
    Instant createdAt = Instant.now();

    public boolean hasReason() {
        return reasonCode != null;
    }

    /**
     * Report referencing the identifiers of the given instruction.
     */
    public static StatusReport forInstruction(PaymentInstruction instruction,
                                              TransactionStatus status,
                                              StatusReasonCode reasonCode,
                                              String additionalInfo) {
        return StatusReport.builder()
            .originalMessageId(instruction.getMessageId())
            .originalInstructionId(instruction.getInstructionId())
            .originalEndToEndId(instruction.getEndToEndId())
            .status(status)
            .reasonCode(reasonCode)
            .additionalInfo(additionalInfo)
            .build();
    }
}
