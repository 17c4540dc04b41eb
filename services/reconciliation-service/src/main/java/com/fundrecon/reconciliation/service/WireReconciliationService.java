package com.fundrecon.reconciliation.service;

import com.fundrecon.common.exception.BusinessException;
import com.fundrecon.reconciliation.config.ReconciliationProperties;
import com.fundrecon.reconciliation.exception.MalformedMessageException;
import com.fundrecon.reconciliation.exception.StorageConflictException;
import com.fundrecon.reconciliation.fraud.FraudAssessment;
import com.fundrecon.reconciliation.matching.MatchResult;
import com.fundrecon.reconciliation.matching.Obligation;
import com.fundrecon.reconciliation.matching.ObligationMatcher;
import com.fundrecon.reconciliation.store.DateWindow;
import com.fundrecon.reconciliation.store.ObligationStore;
import com.fundrecon.reconciliation.store.ReconcileOutcome;
import com.fundrecon.reconciliation.wire.WireMessage;
import com.fundrecon.reconciliation.wire.WireMessageParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;

/**
 * Reconciles incoming wire messages against obligations in the store.
 */
@Slf4j
@RequiredArgsConstructor
public class WireReconciliationService {

    static final String BATCH_FAILED_PREFIX = "wire reconciliation failed: ";

    private final WireMessageParser parser;
    private final ObligationMatcher matcher;
    private final ObligationStore obligationStore;
    private final FraudScreeningService fraudScreening;
    private final ReconciliationMetrics metrics;
    private final ReconciliationProperties properties;

    /**
     * Parses and reconciles a single wire.
     *
     * @throws MalformedMessageException when the message cannot be parsed
     * @throws com.fundrecon.reconciliation.exception.AmbiguousMatchException
     *         when the reference matches several equally close obligations
     */
    public TransactionOutcome reconcileWire(String rawMessage) {
        WireMessage message;
        try {
            message = parser.parse(rawMessage);
        } catch (MalformedMessageException e) {
            metrics.recordMalformedWire();
            throw e;
        }

        String transactionId = "wire:" + message.getSenderReference();
        MDC.put("wireReference", message.getSenderReference());
        try {
            TransactionOutcome outcome = reconcile(transactionId, message);
            metrics.recordOutcome(outcome);
            return outcome;
        } finally {
            MDC.remove("wireReference");
        }
    }

    /**
     * Reconciles a batch of wires. Items that cannot be parsed, matched or
     * recorded in the store are reported as failed and the batch continues.
     */
    public List<TransactionOutcome> reconcileWires(List<String> rawMessages) {
        List<TransactionOutcome> outcomes = new ArrayList<>(rawMessages.size());
        int index = 0;
        for (String rawMessage : rawMessages) {
            index++;
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Wire batch cancelled after {} of {} messages", outcomes.size(), rawMessages.size());
                break;
            }
            try {
                outcomes.add(reconcileWire(rawMessage));
            } catch (BusinessException e) {
                log.warn("Wire {} of batch needs review [{}]: {}", index, e.getErrorCode().getCode(), e.getMessage());
                outcomes.add(batchFailure(index, e.getMessage()));
            } catch (RuntimeException e) {
                log.error("Wire {} of batch could not be reconciled", index, e);
                outcomes.add(batchFailure(index, BATCH_FAILED_PREFIX + e.getMessage()));
            }
        }
        return outcomes;
    }

    private TransactionOutcome batchFailure(int index, String reason) {
        TransactionOutcome failed = TransactionOutcome.failed("wire-batch:" + index, null, reason);
        metrics.recordOutcome(failed);
        return failed;
    }

    private TransactionOutcome reconcile(String transactionId, WireMessage message) {
        DateWindow window = DateWindow.around(message.getValueDate(), properties.getCandidates().getWireLookbackDays());
        List<Obligation> candidates = obligationStore.findCandidateObligations(
            message.getAmount(), message.getCurrency(), window);

        MatchResult match = matcher.match(message, candidates);
        if (!match.isMatched()) {
            log.info("Wire {} ({} {}) matched no obligation", message.getSenderReference(),
                message.getAmount(), message.getCurrency());
            return TransactionOutcome.unmatched(transactionId, message, match,
                StatementReconciliationService.NO_MATCH_REASON);
        }

        String obligationId = match.getObligationId();
        try {
            if (obligationStore.markReconciled(obligationId, transactionId) == ReconcileOutcome.CONFLICT) {
                log.warn("Obligation {} already reconciled, wire {} left for review", obligationId, transactionId);
                return TransactionOutcome.conflict(transactionId, message, match,
                    "Obligation " + obligationId + " already reconciled");
            }
        } catch (StorageConflictException e) {
            log.warn("Store rejected reconciliation of obligation {} by {}", obligationId, transactionId);
            return TransactionOutcome.conflict(transactionId, message, match, e.getMessage());
        }

        Obligation obligation = candidates.stream()
            .filter(candidate -> obligationId.equals(candidate.getId()))
            .findFirst()
            .orElse(null);
        FraudAssessment assessment = fraudScreening
            .screen(transactionId, message, obligation, message.getCurrency())
            .orElse(null);

        log.info("Wire {} reconciled to obligation {} via {} (confidence {})",
            message.getSenderReference(), obligationId, match.getStrategy(), match.getConfidence());
        return TransactionOutcome.matched(transactionId, message, match, assessment);
    }
}
