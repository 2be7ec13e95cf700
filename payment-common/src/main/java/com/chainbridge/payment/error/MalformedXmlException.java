package com.chainbridge.payment.error;

/**
 * Input is empty or not well-formed XML. The message must be rejected without any financial action.
 */
public class MalformedXmlException extends Iso20022Exception {

    public MalformedXmlException(String message) {
        super(message);
    }

    public MalformedXmlException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorCode() {
        return "MALFORMED_XML";
    }
}
