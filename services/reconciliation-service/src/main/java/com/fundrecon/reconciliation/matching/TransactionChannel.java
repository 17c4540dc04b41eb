package com.fundrecon.reconciliation.matching;

/**
 * Where a transaction was reported from. Selects the amount+date rule used by the matcher.
 */
public enum TransactionChannel {
    WIRE,
    STATEMENT
}
