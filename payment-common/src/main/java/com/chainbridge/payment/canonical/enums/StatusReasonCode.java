package com.chainbridge.payment.canonical.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * ISO 20022 status reason codes used in the StsRsnInf block of a pacs.002 report.
 */
public enum StatusReasonCode {
    AC00("AC00", "Reference accepted"),
    AC01("AC01", "Incorrect account number"),
    AC04("AC04", "Closed account number"),
    AC06("AC06", "Blocked account"),
    AG01("AG01", "Transaction forbidden"),
    AM01("AM01", "Zero amount"),
    AM02("AM02", "Not allowed amount"),
    AM03("AM03", "Not allowed currency"),
    AM04("AM04", "Insufficient funds"),
    AM05("AM05", "Duplication"),
    BE01("BE01", "Inconsistent with end customer"),
    FF01("FF01", "Invalid file format"),
    RC01("RC01", "Bank identifier incorrect"),
    TM01("TM01", "Cut off time");

    private final String value;
    private final String description;

    StatusReasonCode(String value, String description) {
        this.value = value;
        this.description = description;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getDescription() {
        return description;
    }

    public static StatusReasonCode fromValue(String value) {
        for (StatusReasonCode code : values()) {
            if (code.value.equals(value)) {
                return code;
            }
        }
        throw new IllegalArgumentException("Unknown StatusReasonCode: " + value);
    }
}
