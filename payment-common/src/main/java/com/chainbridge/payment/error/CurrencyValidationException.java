package com.chainbridge.payment.error;

/**
 * Structurally valid amount whose currency code is outside the allow-list.
 */
public class CurrencyValidationException extends Iso20022Exception {

    private final String currency;

    public CurrencyValidationException(String currency) {
        super("Invalid currency: " + currency);
        this.currency = currency;
    }

    public String getCurrency() {
        return currency;
    }

    @Override
    public String getErrorCode() {
        return "CURRENCY_VALIDATION";
    }
}
