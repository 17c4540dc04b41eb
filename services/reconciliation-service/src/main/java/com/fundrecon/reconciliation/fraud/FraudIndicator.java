package com.fundrecon.reconciliation.fraud;

/**
 * Anomaly rules in evaluation order, with the text reported for review.
 */
public enum FraudIndicator {
    PAYMENT_VELOCITY("Multiple payments in 24 hours"),
    AMOUNT_DEVIATION("Amount differs by >10% from expected"),
    OVERDUE_PAYMENT("Payment more than 60 days overdue"),
    LARGE_FIRST_PAYMENT("First-time payment over threshold"),
    REPEATED_FAILURES("Multiple failed payment attempts");

    private final String description;

    FraudIndicator(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
