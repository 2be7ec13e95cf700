package com.chainbridge.payment.gateway.validation;

import com.chainbridge.payment.canonical.PaymentAmount;
import com.chainbridge.payment.canonical.PaymentInstruction;
import com.chainbridge.payment.currency.CurrencyAllowList;

import java.util.ArrayList;
import java.util.List;

/**
 * Business validity rules for a parsed instruction. Pure; all rules are checked on every call.
 *
 * An instruction is valid when its amount is strictly positive, its currency is in the
 * allow-list, and both debtor and creditor carry an account id or a name.
 */
public class InstructionValidator {

    private final CurrencyAllowList currencyAllowList;

    public InstructionValidator(CurrencyAllowList currencyAllowList) {
        this.currencyAllowList = currencyAllowList;
    }

    public ValidationResult validate(PaymentInstruction instruction) {
        List<String> errors = new ArrayList<>();
        PaymentAmount amount = instruction.getAmount();

        if (amount == null || !amount.isPositive()) {
            errors.add("Amount must be positive");
        }
        String currency = amount != null ? amount.getCurrency() : null;
        if (!currencyAllowList.isAllowed(currency)) {
            errors.add("Invalid currency: " + currency);
        }
        if (!instruction.getDebtor().isIdentified()) {
            errors.add("Debtor information missing");
        }
        if (!instruction.getCreditor().isIdentified()) {
            errors.add("Creditor information missing");
        }

        return ValidationResult.of(errors);
    }
}
