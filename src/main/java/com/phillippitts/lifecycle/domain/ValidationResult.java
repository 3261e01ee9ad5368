package com.phillippitts.lifecycle.domain;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Outcome of validating a transition or an event.
 *
 * @param valid true if the subject may proceed
 * @param errors reasons the subject was rejected, empty when valid
 * @param warnings non-blocking remarks
 * @param validatorName name of the validator that produced the result
 * @param durationMs time the validation took
 */
public record ValidationResult(boolean valid,
                               List<String> errors,
                               List<String> warnings,
                               String validatorName,
                               long durationMs) {

    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        validatorName = validatorName == null ? "anonymous" : validatorName;
    }

    public static ValidationResult valid(String validatorName) {
        return new ValidationResult(true, List.of(), List.of(), validatorName, 0L);
    }

    public static ValidationResult invalid(String validatorName, String... errors) {
        return new ValidationResult(false, List.of(errors), List.of(), validatorName, 0L);
    }

    public ValidationResult withDuration(long newDurationMs) {
        return new ValidationResult(valid, errors, warnings, validatorName, newDurationMs);
    }

    /**
     * Merges several results: valid only if every input is valid, errors and warnings
     * flattened in input order.
     */
    public static ValidationResult merge(Collection<ValidationResult> results, String validatorName,
                                         long durationMs) {
        boolean allValid = true;
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        for (ValidationResult result : results) {
            allValid &= result.valid();
            errors.addAll(result.errors());
            warnings.addAll(result.warnings());
        }
        return new ValidationResult(allValid, errors, warnings, validatorName, durationMs);
    }
}
