package com.fundrecon.reconciliation.service;

import com.fundrecon.reconciliation.fraud.FraudAssessment;
import com.fundrecon.reconciliation.fraud.FraudScorer;
import com.fundrecon.reconciliation.fraud.IncomingPayment;
import com.fundrecon.reconciliation.fraud.PriorTransaction;
import com.fundrecon.reconciliation.matching.MatchableTransaction;
import com.fundrecon.reconciliation.matching.Obligation;
import com.fundrecon.reconciliation.store.CounterpartyHistoryProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Annotates reconciled payments with a fraud assessment based on the
 * counterparty's recent history.
 */
@Slf4j
@RequiredArgsConstructor
public class FraudScreeningService {

    private final FraudScorer fraudScorer;
    private final CounterpartyHistoryProvider historyProvider;
    private final int historyWindowDays;

    /**
     * @return empty when the obligation names no counterparty or the history lookup failed
     */
    public Optional<FraudAssessment> screen(String transactionId, MatchableTransaction transaction,
                                            Obligation obligation, String defaultCurrency) {
        if (obligation == null || obligation.getCounterpartyId() == null) {
            return Optional.empty();
        }

        IncomingPayment payment = IncomingPayment.of(
            transactionId, obligation.getCounterpartyId(), transaction, defaultCurrency);

        List<PriorTransaction> history;
        try {
            history = historyProvider.getCounterpartyHistory(
                obligation.getCounterpartyId(), historyWindowDays, payment.getReceivedAt());
        } catch (RuntimeException e) {
            log.warn("Counterparty history unavailable for {}, skipping fraud screening of {}: {}",
                obligation.getCounterpartyId(), transactionId, e.getMessage());
            return Optional.empty();
        }

        return Optional.of(fraudScorer.assess(payment, obligation, history));
    }
}
