package com.chainbridge.payment.gateway.validation;

import lombok.Value;

import java.util.List;

/**
 * Outcome of instruction validation: the verdict plus every violated rule.
 */
@Value
public class ValidationResult {

    boolean valid;
    List<String> errors;

    public static ValidationResult of(List<String> errors) {
        return new ValidationResult(errors.isEmpty(), List.copyOf(errors));
    }
}
