package com.chainbridge.payment.canonical;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * Generic credit transfer command handed to the ledger.
 *
 * Property names are part of the ledger's wire contract and must not change.
 * The gateway produces this command but never interprets it.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CreditTransferCommand {

    public static final String COMMAND_TYPE = "CREDIT_TRANSFER";

    @JsonProperty("command")
    @Builder.Default
    String command = COMMAND_TYPE;

    @JsonProperty("transaction_id")
    String transactionId;

    @JsonProperty("from_account")
    String fromAccount;

    @JsonProperty("to_account")
    String toAccount;

    /**
     * Plain decimal string, scale preserved.
     */
    @JsonProperty("amount")
    String amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("reference")
    String reference;

    @JsonProperty("memo")
    String memo;

    /**
     * Provenance tag, e.g. "ISO20022:pacs.008".
     */
    @JsonProperty("source")
    String source;

    @JsonProperty("original_message_id")
    String originalMessageId;
}
