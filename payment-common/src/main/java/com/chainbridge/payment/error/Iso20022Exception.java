package com.chainbridge.payment.error;

/**
 * Base class for failures raised while translating ISO 20022 messages.
 */
public abstract class Iso20022Exception extends Exception {

    protected Iso20022Exception(String message) {
        super(message);
    }

    protected Iso20022Exception(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Stable code used when the failure is reported to callers (e.g. "MALFORMED_XML").
     */
    public abstract String getErrorCode();
}
