package com.phillippitts.lifecycle.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ValidationResultTest {

    @Test
    void mergeIsInvalidIfAnyInputIsInvalid() {
        ValidationResult ok = new ValidationResult(true, List.of(), List.of("slow"), "a", 1);
        ValidationResult bad = ValidationResult.invalid("b", "missing field", "bad value");

        ValidationResult merged = ValidationResult.merge(List.of(ok, bad), "merged", 3);

        assertThat(merged.valid()).isFalse();
        assertThat(merged.errors()).containsExactly("missing field", "bad value");
        assertThat(merged.warnings()).containsExactly("slow");
        assertThat(merged.validatorName()).isEqualTo("merged");
        assertThat(merged.durationMs()).isEqualTo(3);
    }

    @Test
    void mergeOfNothingIsValid() {
        assertThat(ValidationResult.merge(List.of(), "none", 0).valid()).isTrue();
    }
}
