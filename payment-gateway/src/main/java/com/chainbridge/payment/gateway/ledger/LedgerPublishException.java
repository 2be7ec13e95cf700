package com.chainbridge.payment.gateway.ledger;

/**
 * A credit transfer command could not be delivered to the ledger topic.
 */
public class LedgerPublishException extends RuntimeException {

    public LedgerPublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
