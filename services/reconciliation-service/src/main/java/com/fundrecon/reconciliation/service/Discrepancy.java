package com.fundrecon.reconciliation.service;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Statement transaction that could not be attributed to an obligation.
 */
@Value
@Builder
public class Discrepancy {

    LocalDate transactionDate;
    String description;
    BigDecimal amount;
    String reason;

    static Discrepancy of(TransactionOutcome outcome) {
        return Discrepancy.builder()
            .transactionDate(outcome.getTransaction().getTransactionDate())
            .description(outcome.getTransaction().getNarrative())
            .amount(outcome.getTransaction().getAmount())
            .reason(outcome.getReason())
            .build();
    }
}
