package com.fundrecon.reconciliation.fraud;

public enum PriorTransactionStatus {
    PENDING,
    COMPLETED,
    RECONCILED,
    FAILED;

    /**
     * Money actually arrived
     */
    public boolean isSettled() {
        return this == COMPLETED || this == RECONCILED;
    }
}
