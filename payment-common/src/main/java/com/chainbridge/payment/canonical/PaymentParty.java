package com.chainbridge.payment.canonical;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * A named actor in a credit transfer: debtor, creditor, or one of their agents (banks).
 *
 * Absent fields are empty strings, never null.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PaymentParty {

    public static final PaymentParty EMPTY = PaymentParty.builder().build();

    /**
     * Party or institution name.
     */
    @Builder.Default
    String name = "";

    /**
     * IBAN or local account number.
     */
    @Builder.Default
    String accountId = "";

    /**
     * BIC, or a clearing system member id when the institution has no BIC.
     */
    @Builder.Default
    String bic = "";

    /**
     * Free-text address derived from the postal address block.
     */
    @Builder.Default
    String address = "";

    /**
     * ISO 3166-1 alpha-2 country code.
     */
    @Builder.Default
    String country = "";

    /**
     * True if the party carries an account id or a name.
     */
    @JsonIgnore
    public boolean isIdentified() {
        return !accountId.isEmpty() || !name.isEmpty();
    }
}
