package com.raisket.advisor.planning;

import java.util.List;

public class InvalidInputException extends PlanningException {

    private final List<String> violations;

    public InvalidInputException(List<String> violations) {
        super(PlanningErrorCode.INVALID_INPUT, String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> violations() {
        return violations;
    }
}
