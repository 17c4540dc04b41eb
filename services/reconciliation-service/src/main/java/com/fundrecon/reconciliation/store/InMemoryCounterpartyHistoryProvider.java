package com.fundrecon.reconciliation.store;

import com.fundrecon.reconciliation.fraud.PriorTransaction;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Counterparty history kept in memory, for local runs and tests.
 */
public class InMemoryCounterpartyHistoryProvider implements CounterpartyHistoryProvider {

    private final Map<String, List<PriorTransaction>> history = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryCounterpartyHistoryProvider(Clock clock) {
        this.clock = clock;
    }

    public void record(PriorTransaction transaction) {
        history.computeIfAbsent(transaction.getCounterpartyId(), id -> new CopyOnWriteArrayList<>())
            .add(transaction);
    }

    @Override
    public List<PriorTransaction> getCounterpartyHistory(String counterpartyId, int windowDays) {
        return getCounterpartyHistory(counterpartyId, windowDays, LocalDateTime.now(clock));
    }

    @Override
    public List<PriorTransaction> getCounterpartyHistory(String counterpartyId, int windowDays, LocalDateTime asOf) {
        LocalDateTime since = asOf.minusDays(windowDays);
        return history.getOrDefault(counterpartyId, List.of()).stream()
            .filter(transaction -> transaction.getOccurredAt() != null)
            .filter(transaction -> !transaction.getOccurredAt().isBefore(since))
            .filter(transaction -> !transaction.getOccurredAt().isAfter(asOf))
            .collect(Collectors.toList());
    }
}
