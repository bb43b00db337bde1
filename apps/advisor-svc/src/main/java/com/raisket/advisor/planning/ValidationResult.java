package com.raisket.advisor.planning;

import java.util.List;

public record ValidationResult(List<String> violations) {

    public ValidationResult {
        violations = List.copyOf(violations);
    }

    public boolean valid() {
        return violations.isEmpty();
    }

    public void throwIfInvalid() {
        if (!valid()) {
            throw new InvalidInputException(violations);
        }
    }
}
