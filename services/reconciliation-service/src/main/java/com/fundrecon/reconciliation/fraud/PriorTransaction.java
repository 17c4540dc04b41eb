package com.fundrecon.reconciliation.fraud;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Earlier payment activity of a counterparty, supplied by the history collaborator.
 */
@Value
@Builder
public class PriorTransaction {

    String transactionId;
    String counterpartyId;
    BigDecimal amount;
    LocalDateTime occurredAt;
    PriorTransactionStatus status;
}
