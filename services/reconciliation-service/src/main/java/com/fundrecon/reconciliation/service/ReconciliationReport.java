package com.fundrecon.reconciliation.service;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Aggregate of one statement reconciliation run.
 */
@Value
@Builder
public class ReconciliationReport {

    String statementId;

    /**
     * Credits found in the statement within the requested period
     */
    int creditCount;

    int matchedCount;
    int unmatchedCount;
    List<Discrepancy> discrepancies;
    List<TransactionOutcome> outcomes;

    /**
     * True when the run was interrupted before every credit was processed
     */
    boolean cancelled;

    static ReconciliationReport of(String statementId, int creditCount,
                                   List<TransactionOutcome> outcomes, boolean cancelled) {
        List<Discrepancy> discrepancies = outcomes.stream()
            .filter(outcome -> !outcome.isMatched())
            .map(Discrepancy::of)
            .collect(Collectors.toList());

        return ReconciliationReport.builder()
            .statementId(statementId)
            .creditCount(creditCount)
            .matchedCount(outcomes.size() - discrepancies.size())
            .unmatchedCount(discrepancies.size())
            .discrepancies(List.copyOf(discrepancies))
            .outcomes(List.copyOf(outcomes))
            .cancelled(cancelled)
            .build();
    }
}
