package com.raisket.advisor.planning;

public class DebtUnpayableException extends PlanningException {

    private final String debtName;

    public DebtUnpayableException(String debtName, PaymentTooLowException cause) {
        super(PlanningErrorCode.DEBT_UNPAYABLE,
                "Debt '" + debtName + "' cannot be paid off: " + cause.getMessage(), cause);
        this.debtName = debtName;
    }

    public String debtName() {
        return debtName;
    }
}
