package com.fundrecon.reconciliation.matching;

/**
 * Strategy that produced a match, in the order the matcher tries them.
 */
public enum MatchStrategy {
    REFERENCE,
    AMOUNT_DATE,
    FUZZY,
    NONE
}
