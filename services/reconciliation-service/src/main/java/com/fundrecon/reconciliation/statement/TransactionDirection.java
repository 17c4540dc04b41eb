package com.fundrecon.reconciliation.statement;

public enum TransactionDirection {
    CREDIT,
    DEBIT
}
