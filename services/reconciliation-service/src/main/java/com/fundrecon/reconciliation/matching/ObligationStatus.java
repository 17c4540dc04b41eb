package com.fundrecon.reconciliation.matching;

/**
 * Lifecycle of a capital call obligation as seen by reconciliation.
 */
public enum ObligationStatus {
    DRAFT,
    AWAITING_PAYMENT,
    RECONCILED,
    CANCELLED;

    public boolean isOpenForMatching() {
        return this == AWAITING_PAYMENT;
    }
}
