package com.samplepairs.pairing;

import java.util.List;

/**
 * Outcome of {@link PlanValidator#validate(PairingPlan, int)}: every defect found, in discovery order.
 */
public final class ValidationResult {
    private final List<String> errors;

    private ValidationResult(List<String> errors) {
        this.errors = List.copyOf(errors);
    }

    public static ValidationResult of(List<String> errors) {
        return new ValidationResult(errors);
    }

    public boolean isOk() {
        return errors.isEmpty();
    }

    public List<String> getErrors() {
        return errors;
    }

    public String getErrorMessage() {
        return String.join("; ", errors);
    }

    @Override
    public String toString() {
        return "ValidationResult{ok=" + isOk() + ", errors=" + errors + "}";
    }
}
