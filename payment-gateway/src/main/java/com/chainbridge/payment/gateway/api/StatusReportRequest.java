package com.chainbridge.payment.gateway.api;

import com.chainbridge.payment.canonical.StatusReport;
import com.chainbridge.payment.canonical.enums.StatusReasonCode;
import com.chainbridge.payment.canonical.enums.TransactionStatus;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body for generating a pacs.002 status report from decision output.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatusReportRequest {

    @NotBlank
    private String originalMessageId;

    private String originalInstructionId;

    @NotBlank
    private String originalEndToEndId;

    @NotNull
    private TransactionStatus status;

    /**
     * Optional; omit for no StsRsnInf block.
     */
    private StatusReasonCode reasonCode;

    @Size(max = 105)
    private String additionalInfo;

    public StatusReport toStatusReport() {
        return StatusReport.builder()
            .originalMessageId(originalMessageId)
            .originalInstructionId(originalInstructionId != null ? originalInstructionId : "")
            .originalEndToEndId(originalEndToEndId)
            .status(status)
            .reasonCode(reasonCode)
            .additionalInfo(additionalInfo)
            .build();
    }
}
