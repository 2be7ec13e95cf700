package com.chainbridge.payment.gateway.iso20022;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Relative element path used by the field extraction table.
 *
 * Supported forms: {@code Name}, {@code A/B/C} (child steps) and {@code .//A/B}
 * (first step matched at any depth below the context element).
 */
public final class ElementPath {

    private static final String DESCENDANT_PREFIX = ".//";

    private final String expression;
    private final boolean descendant;
    private final List<String> steps;

    private ElementPath(String expression, boolean descendant, List<String> steps) {
        this.expression = expression;
        this.descendant = descendant;
        this.steps = steps;
    }

    public static ElementPath parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Element path cannot be empty");
        }
        boolean descendant = expression.startsWith(DESCENDANT_PREFIX);
        String body = descendant ? expression.substring(DESCENDANT_PREFIX.length()) : expression;
        List<String> steps = Arrays.asList(body.split("/"));
        for (String step : steps) {
            if (step.isEmpty()) {
                throw new IllegalArgumentException("Invalid element path: " + expression);
            }
        }
        return new ElementPath(expression, descendant, Collections.unmodifiableList(steps));
    }

    public boolean isDescendant() {
        return descendant;
    }

    public List<String> getSteps() {
        return steps;
    }

    /**
     * Local name of the element the path resolves to.
     */
    public String getTargetName() {
        return steps.get(steps.size() - 1);
    }

    @Override
    public String toString() {
        return expression;
    }
}
