package com.fundrecon.reconciliation.store;

/**
 * Result of asking the store to mark an obligation reconciled.
 */
public enum ReconcileOutcome {
    SUCCESS,
    /** The obligation was already reconciled by another transaction */
    CONFLICT
}
