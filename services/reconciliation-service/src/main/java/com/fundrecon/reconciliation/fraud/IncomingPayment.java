package com.fundrecon.reconciliation.fraud;

import com.fundrecon.reconciliation.matching.MatchableTransaction;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Payment under fraud review.
 */
@Value
@Builder
public class IncomingPayment {

    String transactionId;
    String counterpartyId;
    BigDecimal amount;
    String currency;
    LocalDateTime receivedAt;

    /**
     * Statement and wire dates carry no time of day; the payment is placed at the last instant of
     * that day, after any history recorded on the same day.
     */
    public static IncomingPayment of(String transactionId, String counterpartyId,
                                     MatchableTransaction transaction, String currency) {
        return IncomingPayment.builder()
            .transactionId(transactionId)
            .counterpartyId(counterpartyId)
            .amount(transaction.getAmount())
            .currency(transaction.getCurrency() != null ? transaction.getCurrency() : currency)
            .receivedAt(transaction.getTransactionDate().atTime(LocalTime.MAX))
            .build();
    }
}
