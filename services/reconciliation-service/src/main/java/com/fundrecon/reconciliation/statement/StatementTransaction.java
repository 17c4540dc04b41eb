package com.fundrecon.reconciliation.statement;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fundrecon.reconciliation.matching.MatchableTransaction;
import com.fundrecon.reconciliation.matching.TransactionChannel;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One transaction line detected in bank statement text.
 */
@Value
@Builder
public class StatementTransaction implements MatchableTransaction {

    /**
     * 1-based line of the statement text the transaction was read from
     */
    int lineNumber;
    LocalDate date;
    String description;
    BigDecimal amount;
    TransactionDirection direction;
    String reference;

    public boolean isCredit() {
        return direction == TransactionDirection.CREDIT;
    }

    @Override
    @JsonIgnore
    public LocalDate getTransactionDate() {
        return date;
    }

    /**
     * Statement lines do not state a currency; the account currency applies.
     */
    @Override
    @JsonIgnore
    public String getCurrency() {
        return null;
    }

    @Override
    @JsonIgnore
    public String getNarrative() {
        return description;
    }

    @Override
    @JsonIgnore
    public TransactionChannel getChannel() {
        return TransactionChannel.STATEMENT;
    }
}
