package com.fundrecon.reconciliation.store;

import com.fundrecon.reconciliation.fraud.PriorTransaction;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Source of a counterparty's recent payment activity.
 */
public interface CounterpartyHistoryProvider {

    /**
     * @return transactions of the counterparty in the {@code windowDays} days up to {@code asOf},
     *         empty when none
     */
    List<PriorTransaction> getCounterpartyHistory(String counterpartyId, int windowDays, LocalDateTime asOf);

    /**
     * History in the {@code windowDays} days up to now.
     */
    default List<PriorTransaction> getCounterpartyHistory(String counterpartyId, int windowDays) {
        return getCounterpartyHistory(counterpartyId, windowDays, LocalDateTime.now());
    }
}
