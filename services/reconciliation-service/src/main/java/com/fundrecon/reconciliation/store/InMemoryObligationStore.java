package com.fundrecon.reconciliation.store;

import com.fundrecon.reconciliation.matching.Obligation;
import com.fundrecon.reconciliation.matching.ObligationStatus;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Obligation store kept in memory, for local runs and tests. Reconciliation is
 * a compare-and-swap on the obligation's status.
 */
@Slf4j
public class InMemoryObligationStore implements ObligationStore {

    private final Map<String, Obligation> obligations = new ConcurrentHashMap<>();
    private final Map<String, String> reconciledBy = new ConcurrentHashMap<>();
    private final int maxCandidates;

    public InMemoryObligationStore(int maxCandidates) {
        this.maxCandidates = maxCandidates;
    }

    public void save(Obligation obligation) {
        obligations.put(obligation.getId(), obligation);
    }

    public void saveAll(Collection<Obligation> toSave) {
        toSave.forEach(this::save);
    }

    public Optional<Obligation> findById(String obligationId) {
        return Optional.ofNullable(obligations.get(obligationId));
    }

    /**
     * @return id of the transaction the obligation was reconciled against
     */
    public Optional<String> findReconcilingTransaction(String obligationId) {
        return Optional.ofNullable(reconciledBy.get(obligationId));
    }

    @Override
    public List<Obligation> findCandidateObligations(BigDecimal amount, String currency, DateWindow dueDateWindow) {
        return obligations.values().stream()
            .filter(Obligation::isOpenForMatching)
            .filter(obligation -> currency == null || currency.equalsIgnoreCase(obligation.getCurrency()))
            .filter(obligation -> dueDateWindow.contains(obligation.getDueDate()))
            .sorted(Comparator.comparing((Obligation obligation) -> distance(obligation, amount))
                .thenComparing(Obligation::getId))
            .limit(maxCandidates)
            .collect(Collectors.toList());
    }

    @Override
    public ReconcileOutcome markReconciled(String obligationId, String transactionId) {
        Obligation current = obligations.get(obligationId);
        if (current == null) {
            throw new IllegalArgumentException("Unknown obligation: " + obligationId);
        }
        if (current.getStatus() != ObligationStatus.AWAITING_PAYMENT) {
            log.warn("Obligation {} is {}, rejecting reconcile by {}", obligationId, current.getStatus(), transactionId);
            return ReconcileOutcome.CONFLICT;
        }

        boolean swapped = obligations.replace(obligationId, current, current.withStatus(ObligationStatus.RECONCILED));
        if (!swapped) {
            log.warn("Concurrent update of obligation {}, rejecting reconcile by {}", obligationId, transactionId);
            return ReconcileOutcome.CONFLICT;
        }

        reconciledBy.put(obligationId, transactionId);
        log.debug("Obligation {} reconciled by transaction {}", obligationId, transactionId);
        return ReconcileOutcome.SUCCESS;
    }

    private static BigDecimal distance(Obligation obligation, BigDecimal amount) {
        if (amount == null || obligation.getExpectedAmount() == null) {
            return BigDecimal.ZERO;
        }
        return obligation.getExpectedAmount().subtract(amount).abs();
    }
}
