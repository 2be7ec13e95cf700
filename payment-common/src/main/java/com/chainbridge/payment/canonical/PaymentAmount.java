package com.chainbridge.payment.canonical;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Monetary amount: decimal magnitude plus currency code.
 *
 * Two amounts are equal when their magnitudes compare equal and their currency codes are
 * identical. There is no currency conversion.
 */
@Getter
public final class PaymentAmount {

    private final BigDecimal value;
    private final String currency;

    private PaymentAmount(BigDecimal value, String currency) {
        this.value = Objects.requireNonNull(value, "value");
        this.currency = Objects.requireNonNull(currency, "currency");
    }

    public static PaymentAmount of(BigDecimal value, String currency) {
        return new PaymentAmount(value, currency);
    }

    public static PaymentAmount of(String value, String currency) {
        return new PaymentAmount(new BigDecimal(value), currency);
    }

    @JsonIgnore
    public boolean isPositive() {
        return value.signum() > 0;
    }

    /**
     * Magnitude as written, without exponent notation (e.g. "50000.00").
     */
    public String toPlainString() {
        return value.toPlainString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PaymentAmount)) {
            return false;
        }
        PaymentAmount other = (PaymentAmount) o;
        return value.compareTo(other.value) == 0 && currency.equals(other.currency);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value.stripTrailingZeros(), currency);
    }

    @Override
    public String toString() {
        return value.toPlainString() + " " + currency;
    }
}
