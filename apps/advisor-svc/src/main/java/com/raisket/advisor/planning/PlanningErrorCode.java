package com.raisket.advisor.planning;

public enum PlanningErrorCode {
    INVALID_INPUT,
    PAYMENT_TOO_LOW,
    DEBT_UNPAYABLE,
    INSUFFICIENT_INCOME
}
