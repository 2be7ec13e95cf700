package com.chainbridge.payment.canonical.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * ISO 20022 transaction status codes carried in the TxSts element of a pacs.002 status report.
 */
public enum TransactionStatus {
    /**
     * ACCP - Accepted customer profile.
     */
    ACCP("ACCP", Category.ACCEPTED),

    /**
     * ACSC - Accepted, settlement completed.
     */
    ACSC("ACSC", Category.ACCEPTED),

    /**
     * ACSP - Accepted, settlement in process.
     */
    ACSP("ACSP", Category.ACCEPTED),

    /**
     * ACTC - Accepted after technical validation.
     */
    ACTC("ACTC", Category.ACCEPTED),

    /**
     * ACWC - Accepted with change.
     */
    ACWC("ACWC", Category.ACCEPTED),

    /**
     * PDNG - Pending further checks.
     */
    PDNG("PDNG", Category.IN_FLIGHT),

    /**
     * RCVD - Received by the instructed agent.
     */
    RCVD("RCVD", Category.IN_FLIGHT),

    /**
     * RJCT - Rejected.
     */
    RJCT("RJCT", Category.REJECTED);

    /**
     * Coarse grouping of the status codes.
     */
    public enum Category {
        ACCEPTED,
        IN_FLIGHT,
        REJECTED
    }

    private final String value;
    private final Category category;

    TransactionStatus(String value, Category category) {
        this.value = value;
        this.category = category;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public Category getCategory() {
        return category;
    }

    public boolean isRejection() {
        return category == Category.REJECTED;
    }

    /**
     * Get status from string value.
     */
    public static TransactionStatus fromValue(String value) {
        for (TransactionStatus status : values()) {
            if (status.value.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown TransactionStatus: " + value);
    }
}
