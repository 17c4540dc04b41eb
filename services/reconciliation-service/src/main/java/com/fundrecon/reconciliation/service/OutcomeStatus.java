package com.fundrecon.reconciliation.service;

public enum OutcomeStatus {
    MATCHED,
    UNMATCHED,
    /** Matched an obligation that the store reports as already reconciled */
    CONFLICT,
    /** Matching or the store update failed; needs manual review */
    FAILED
}
