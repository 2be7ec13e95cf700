package com.chainbridge.payment.error;

/**
 * A critical field differs between two parses of the same message.
 *
 * Signals a defect in the adapter itself, not bad input.
 */
public class LosslessTranslationException extends Iso20022Exception {

    private final String field;
    private final String originalValue;
    private final String reparsedValue;

    public LosslessTranslationException(String field, Object originalValue, Object reparsedValue) {
        super(String.format("%s mismatch: %s != %s", field, originalValue, reparsedValue));
        this.field = field;
        this.originalValue = String.valueOf(originalValue);
        this.reparsedValue = String.valueOf(reparsedValue);
    }

    public String getField() {
        return field;
    }

    public String getOriginalValue() {
        return originalValue;
    }

    public String getReparsedValue() {
        return reparsedValue;
    }

    @Override
    public String getErrorCode() {
        return "LOSSLESS_TRANSLATION";
    }
}
