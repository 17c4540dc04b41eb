package com.fundrecon.reconciliation.service;

import com.fundrecon.reconciliation.config.ReconciliationProperties;
import com.fundrecon.reconciliation.exception.StorageConflictException;
import com.fundrecon.reconciliation.fraud.FraudAssessment;
import com.fundrecon.reconciliation.matching.MatchResult;
import com.fundrecon.reconciliation.matching.Obligation;
import com.fundrecon.reconciliation.matching.ObligationMatcher;
import com.fundrecon.reconciliation.statement.StatementLineExtractor;
import com.fundrecon.reconciliation.statement.StatementTransaction;
import com.fundrecon.reconciliation.statement.document.StatementDocumentReader;
import com.fundrecon.reconciliation.store.DateWindow;
import com.fundrecon.reconciliation.store.ObligationStore;
import com.fundrecon.reconciliation.store.ReconcileOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Reconciles the credits of a bank statement against open obligations.
 *
 * <p>Credits are processed sequentially in statement order. An obligation
 * reconciled earlier in the run is not offered to later credits. A failure on one
 * transaction is recorded as a discrepancy and never aborts the run; an
 * interrupt of the calling thread stops the run between transactions and the
 * partial report is returned flagged as cancelled.
 */
@Slf4j
@RequiredArgsConstructor
public class StatementReconciliationService {

    static final String NO_MATCH_REASON = "No matching obligation found";
    static final String MATCH_FAILED_PREFIX = "match evaluation failed: ";

    private final StatementLineExtractor lineExtractor;
    private final ObligationMatcher matcher;
    private final ObligationStore obligationStore;
    private final FraudScreeningService fraudScreening;
    private final StatementDocumentReader documentReader;
    private final ReconciliationMetrics metrics;
    private final ReconciliationProperties properties;

    /**
     * Reconciles statement text against a fixed pool of candidates.
     */
    public ReconciliationReport reconcile(String statementText, List<Obligation> candidatePool) {
        String statementId = "stmt-" + UUID.randomUUID();
        List<Obligation> pool = List.copyOf(candidatePool);
        return run(statementId, statementText, null, null, properties.getDefaultCurrency(), transaction -> pool);
    }

    /**
     * Reconciles statement text, looking up candidates per transaction in the
     * obligation store.
     */
    public ReconciliationReport reconcile(StatementReconciliationRequest request) {
        String currency = request.getCurrency() != null ? request.getCurrency() : properties.getDefaultCurrency();
        int lookbackDays = properties.getCandidates().getStatementLookbackDays();

        return run(request.getStatementId(), request.getStatementText(),
            request.getStartDate(), request.getEndDate(), currency,
            transaction -> obligationStore.findCandidateObligations(
                transaction.getAmount(), currency, DateWindow.around(transaction.getDate(), lookbackDays)));
    }

    /**
     * Reads a PDF statement and reconciles its text. Any text already on the
     * request is replaced.
     */
    public ReconciliationReport reconcileDocument(byte[] pdfBytes, StatementReconciliationRequest request) {
        String text = documentReader.readText(pdfBytes);
        log.info("Read {} characters from statement document {}", text.length(), request.getStatementId());
        return reconcile(request.toBuilder().statementText(text).build());
    }

    private ReconciliationReport run(String statementId, String statementText, LocalDate startDate, LocalDate endDate,
                                     String currency, Function<StatementTransaction, List<Obligation>> candidateSource) {
        MDC.put("statementId", statementId);
        try {
            return metrics.statementTimer().record(() ->
                process(statementId, statementText, startDate, endDate, currency, candidateSource));
        } finally {
            MDC.remove("statementId");
        }
    }

    private ReconciliationReport process(String statementId, String statementText, LocalDate startDate,
                                         LocalDate endDate, String currency,
                                         Function<StatementTransaction, List<Obligation>> candidateSource) {
        List<StatementTransaction> credits = lineExtractor.extract(statementText == null ? "" : statementText)
            .stream()
            .filter(StatementTransaction::isCredit)
            .filter(transaction -> startDate == null || !transaction.getDate().isBefore(startDate))
            .filter(transaction -> endDate == null || !transaction.getDate().isAfter(endDate))
            .collect(Collectors.toList());

        log.info("Reconciling {} credits from statement {}", credits.size(), statementId);

        List<TransactionOutcome> outcomes = new ArrayList<>(credits.size());
        Set<String> reconciledInRun = new HashSet<>();
        boolean cancelled = false;

        for (StatementTransaction credit : credits) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Reconciliation of statement {} cancelled after {} of {} credits",
                    statementId, outcomes.size(), credits.size());
                cancelled = true;
                break;
            }

            TransactionOutcome outcome = reconcileCredit(statementId, credit, currency, candidateSource, reconciledInRun);
            metrics.recordOutcome(outcome);
            outcomes.add(outcome);
        }

        ReconciliationReport report = ReconciliationReport.of(statementId, credits.size(), outcomes, cancelled);
        log.info("Statement {} reconciled: matched={}, unmatched={}, cancelled={}",
            statementId, report.getMatchedCount(), report.getUnmatchedCount(), report.isCancelled());
        return report;
    }

    private TransactionOutcome reconcileCredit(String statementId, StatementTransaction credit, String currency,
                                               Function<StatementTransaction, List<Obligation>> candidateSource,
                                               Set<String> reconciledInRun) {
        String transactionId = statementId + ":" + credit.getLineNumber();

        List<Obligation> candidates;
        MatchResult match;
        try {
            candidates = candidateSource.apply(credit).stream()
                .filter(candidate -> !reconciledInRun.contains(candidate.getId()))
                .collect(Collectors.toList());
            match = matcher.match(credit, candidates);
        } catch (RuntimeException e) {
            log.warn("Match evaluation failed for transaction {}: {}", transactionId, e.getMessage());
            return TransactionOutcome.failed(transactionId, credit, MATCH_FAILED_PREFIX + e.getMessage());
        }

        if (!match.isMatched()) {
            log.debug("No obligation matched transaction {}", transactionId);
            return TransactionOutcome.unmatched(transactionId, credit, match, NO_MATCH_REASON);
        }

        TransactionOutcome conflict = markReconciled(transactionId, credit, match);
        if (conflict != null) {
            return conflict;
        }
        reconciledInRun.add(match.getObligationId());

        Obligation obligation = findById(candidates, match.getObligationId());
        FraudAssessment assessment = fraudScreening.screen(transactionId, credit, obligation, currency).orElse(null);
        log.debug("Transaction {} reconciled to obligation {} via {}",
            transactionId, match.getObligationId(), match.getStrategy());
        return TransactionOutcome.matched(transactionId, credit, match, assessment);
    }

    /**
     * @return the outcome to report when the store refused the update, otherwise null
     */
    private TransactionOutcome markReconciled(String transactionId, StatementTransaction credit, MatchResult match) {
        String obligationId = match.getObligationId();
        try {
            if (obligationStore.markReconciled(obligationId, transactionId) == ReconcileOutcome.CONFLICT) {
                log.warn("Obligation {} already reconciled, transaction {} left for review", obligationId, transactionId);
                return TransactionOutcome.conflict(transactionId, credit, match,
                    "Obligation " + obligationId + " already reconciled");
            }
            return null;
        } catch (StorageConflictException e) {
            log.warn("Store rejected reconciliation of obligation {} by {}: {}", obligationId, transactionId, e.getMessage());
            return TransactionOutcome.conflict(transactionId, credit, match, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Failed to mark obligation {} reconciled by {}", obligationId, transactionId, e);
            return TransactionOutcome.failed(transactionId, credit, "reconciliation update failed: " + e.getMessage());
        }
    }

    private static Obligation findById(List<Obligation> candidates, String obligationId) {
        return candidates.stream()
            .filter(candidate -> obligationId.equals(candidate.getId()))
            .findFirst()
            .orElse(null);
    }
}
