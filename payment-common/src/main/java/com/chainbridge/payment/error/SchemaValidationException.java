package com.chainbridge.payment.error;

/**
 * Well-formed XML that lacks a required element or carries an unparsable value.
 */
public class SchemaValidationException extends Iso20022Exception {

    private final String element;

    public SchemaValidationException(String element, String message) {
        super(message);
        this.element = element;
    }

    public SchemaValidationException(String element, String message, Throwable cause) {
        super(message, cause);
        this.element = element;
    }

    /**
     * Local name of the missing or invalid element.
     */
    public String getElement() {
        return element;
    }

    @Override
    public String getErrorCode() {
        return "SCHEMA_VALIDATION";
    }
}
