package com.fundrecon.reconciliation.store;

import com.fundrecon.reconciliation.matching.Obligation;

import java.math.BigDecimal;
import java.util.List;

/**
 * Storage of capital call obligations, owned outside the reconciliation core.
 */
public interface ObligationStore {

    /**
     * Obligations awaiting payment that are plausible matches for a payment of
     * {@code amount} in {@code currency}, due inside {@code dueDateWindow}.
     *
     * @param currency ISO code, or {@code null} for any currency
     */
    List<Obligation> findCandidateObligations(BigDecimal amount, String currency, DateWindow dueDateWindow);

    /**
     * Marks an obligation reconciled against a transaction. Must be atomic per
     * obligation: a second reconcile of the same obligation returns
     * {@link ReconcileOutcome#CONFLICT}. Implementations backed by optimistic
     * locking may throw {@code StorageConflictException} instead.
     */
    ReconcileOutcome markReconciled(String obligationId, String transactionId);
}
