package com.fundrecon.reconciliation.service;

import com.fundrecon.reconciliation.fraud.FraudAssessment;
import com.fundrecon.reconciliation.matching.MatchResult;
import com.fundrecon.reconciliation.matching.MatchableTransaction;
import lombok.Builder;
import lombok.Value;

/**
 * Result of reconciling a single transaction. Exactly one outcome is produced
 * per processed transaction, failures included.
 */
@Value
@Builder
public class TransactionOutcome {

    String transactionId;

    /**
     * Null only for wire messages that could not be parsed
     */
    MatchableTransaction transaction;

    OutcomeStatus status;

    /**
     * Null when matching itself failed
     */
    MatchResult matchResult;

    /**
     * Present for matched transactions when counterparty history was available
     */
    FraudAssessment fraudAssessment;

    /**
     * Why the transaction needs review; null when matched
     */
    String reason;

    public static TransactionOutcome matched(String transactionId, MatchableTransaction transaction,
                                             MatchResult matchResult, FraudAssessment fraudAssessment) {
        return TransactionOutcome.builder()
            .transactionId(transactionId)
            .transaction(transaction)
            .status(OutcomeStatus.MATCHED)
            .matchResult(matchResult)
            .fraudAssessment(fraudAssessment)
            .build();
    }

    public static TransactionOutcome unmatched(String transactionId, MatchableTransaction transaction,
                                               MatchResult matchResult, String reason) {
        return TransactionOutcome.builder()
            .transactionId(transactionId)
            .transaction(transaction)
            .status(OutcomeStatus.UNMATCHED)
            .matchResult(matchResult)
            .reason(reason)
            .build();
    }

    public static TransactionOutcome conflict(String transactionId, MatchableTransaction transaction,
                                              MatchResult matchResult, String reason) {
        return TransactionOutcome.builder()
            .transactionId(transactionId)
            .transaction(transaction)
            .status(OutcomeStatus.CONFLICT)
            .matchResult(matchResult)
            .reason(reason)
            .build();
    }

    public static TransactionOutcome failed(String transactionId, MatchableTransaction transaction, String reason) {
        return TransactionOutcome.builder()
            .transactionId(transactionId)
            .transaction(transaction)
            .status(OutcomeStatus.FAILED)
            .reason(reason)
            .build();
    }

    public boolean isMatched() {
        return status == OutcomeStatus.MATCHED;
    }

    public String getObligationId() {
        return matchResult != null ? matchResult.getObligationId() : null;
    }
}
