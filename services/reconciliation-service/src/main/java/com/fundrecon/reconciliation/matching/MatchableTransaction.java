package com.fundrecon.reconciliation.matching;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A bank-reported money movement that can be matched against obligations.
 * Implemented by parsed wire messages and extracted statement lines.
 */
public interface MatchableTransaction {

    /**
     * Identifier carried by the payer, or {@code null} when none was found
     */
    String getReference();

    BigDecimal getAmount();

    LocalDate getTransactionDate();

    /**
     * ISO currency code, or {@code null} when the source does not state one
     */
    String getCurrency();

    /**
     * Free text used for counterparty name matching
     */
    String getNarrative();

    TransactionChannel getChannel();
}
