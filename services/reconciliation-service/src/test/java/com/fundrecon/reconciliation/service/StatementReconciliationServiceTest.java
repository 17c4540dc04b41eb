package com.fundrecon.reconciliation.service;

import com.fundrecon.reconciliation.config.ReconciliationProperties;
import com.fundrecon.reconciliation.exception.StorageConflictException;
import com.fundrecon.reconciliation.fraud.FraudScorer;
import com.fundrecon.reconciliation.matching.MatchStrategy;
import com.fundrecon.reconciliation.matching.Obligation;
import com.fundrecon.reconciliation.matching.ObligationMatcher;
import com.fundrecon.reconciliation.matching.ObligationStatus;
import com.fundrecon.reconciliation.statement.StatementLineExtractor;
import com.fundrecon.reconciliation.statement.document.StatementDocumentReader;
import com.fundrecon.reconciliation.store.CounterpartyHistoryProvider;
import com.fundrecon.reconciliation.store.DateWindow;
import com.fundrecon.reconciliation.store.ObligationStore;
import com.fundrecon.reconciliation.store.ReconcileOutcome;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.endsWith;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("StatementReconciliationService Tests")
class StatementReconciliationServiceTest {

    private static final String STATEMENT = String.join("\n",
        "FIRST NATIONAL BANK - STATEMENT DECEMBER 2025",
        "12/15/2025 WIRE REF:CALL-001 CAPITAL CALL $250,000.00",
        "12/15/2025 MANAGEMENT FEE DEBIT $5,000.00",
        "12/16/2025 INCOMING TRANSFER UNKNOWN PAYER $42,000.00");

    @Mock
    private ObligationStore obligationStore;

    @Mock
    private CounterpartyHistoryProvider historyProvider;

    @Mock
    private StatementDocumentReader documentReader;

    private SimpleMeterRegistry meterRegistry;
    private StatementReconciliationService service;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        ReconciliationProperties properties = new ReconciliationProperties();
        service = new StatementReconciliationService(
            new StatementLineExtractor(),
            new ObligationMatcher(),
            obligationStore,
            new FraudScreeningService(new FraudScorer(), historyProvider, 90),
            documentReader,
            new ReconciliationMetrics(meterRegistry),
            properties);
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Nested
    @DisplayName("Reconciling against a candidate pool")
    class CandidatePool {

        @Test
        @DisplayName("Should match credits, skip debits and report unmatched credits")
        void shouldReconcileStatement() {
            // Given
            when(obligationStore.markReconciled(eq("OB-1"), endsWith(":2"))).thenReturn(ReconcileOutcome.SUCCESS);
            when(historyProvider.getCounterpartyHistory(eq("CP-1"), eq(90), any(LocalDateTime.class)))
                .thenReturn(List.of());

            // When
            ReconciliationReport report = service.reconcile(STATEMENT, List.of(
                obligation("OB-1", "CALL-001", "250000.00", LocalDate.of(2025, 12, 15)),
                obligation("OB-2", "CALL-002", "100000.00", LocalDate.of(2025, 12, 20))));

            // Then
            assertThat(report.getCreditCount()).isEqualTo(2);
            assertThat(report.getMatchedCount()).isEqualTo(1);
            assertThat(report.getUnmatchedCount()).isEqualTo(1);
            assertThat(report.isCancelled()).isFalse();

            TransactionOutcome matched = report.getOutcomes().get(0);
            assertThat(matched.getStatus()).isEqualTo(OutcomeStatus.MATCHED);
            assertThat(matched.getObligationId()).isEqualTo("OB-1");
            assertThat(matched.getMatchResult().getStrategy()).isEqualTo(MatchStrategy.REFERENCE);
            assertThat(matched.getFraudAssessment()).isNotNull();
            assertThat(matched.getFraudAssessment().getIndicators())
                .containsExactly("First-time payment over threshold");

            assertThat(report.getDiscrepancies()).singleElement().satisfies(discrepancy -> {
                assertThat(discrepancy.getTransactionDate()).isEqualTo(LocalDate.of(2025, 12, 16));
                assertThat(discrepancy.getAmount()).isEqualByComparingTo(new BigDecimal("42000.00"));
                assertThat(discrepancy.getDescription()).isEqualTo("INCOMING TRANSFER UNKNOWN PAYER");
                assertThat(discrepancy.getReason()).isEqualTo("No matching obligation found");
            });

            assertThat(meterRegistry.get("fundrecon.reconciliation.transactions")
                .tag("outcome", "matched").counter().count()).isEqualTo(1.0);
            assertThat(meterRegistry.get("fundrecon.reconciliation.transactions")
                .tag("outcome", "unmatched").counter().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should not offer an obligation reconciled earlier in the run to a later credit")
        void shouldSkipObligationsReconciledInRun() {
            // Given
            String statement = String.join("\n",
                "12/15/2025 INCOMING TRANSFER ACME $100,000.00",
                "12/15/2025 INCOMING TRANSFER ACME $100,000.00");
            when(obligationStore.markReconciled(anyString(), anyString())).thenReturn(ReconcileOutcome.SUCCESS);
            when(historyProvider.getCounterpartyHistory(anyString(), anyInt(), any(LocalDateTime.class)))
                .thenReturn(List.of());

            // When
            ReconciliationReport report = service.reconcile(statement, List.of(
                obligation("OB-A", "CALL-A", "100000.00", LocalDate.of(2025, 12, 15)),
                obligation("OB-B", "CALL-B", "100000.00", LocalDate.of(2025, 12, 15))));

            // Then
            assertThat(report.getOutcomes())
                .extracting(TransactionOutcome::getStatus)
                .containsExactly(OutcomeStatus.MATCHED, OutcomeStatus.MATCHED);
            assertThat(report.getOutcomes())
                .extracting(TransactionOutcome::getObligationId)
                .containsExactly("OB-A", "OB-B");
            assertThat(report.getDiscrepancies()).isEmpty();
            verify(obligationStore).markReconciled(eq("OB-A"), endsWith(":1"));
            verify(obligationStore).markReconciled(eq("OB-B"), endsWith(":2"));
        }

        @Test
        @DisplayName("Should report an obligation the store already reconciled")
        void shouldReportReturnedConflict() {
            when(obligationStore.markReconciled(eq("OB-1"), anyString())).thenReturn(ReconcileOutcome.CONFLICT);

            ReconciliationReport report = service.reconcile(STATEMENT,
                List.of(obligation("OB-1", "CALL-001", "250000.00", LocalDate.of(2025, 12, 15))));

            assertThat(report.getMatchedCount()).isZero();
            assertThat(report.getOutcomes().get(0).getStatus()).isEqualTo(OutcomeStatus.CONFLICT);
            assertThat(report.getDiscrepancies())
                .extracting(Discrepancy::getReason)
                .containsExactly("Obligation OB-1 already reconciled", "No matching obligation found");
            verifyNoInteractions(historyProvider);
        }

        @Test
        @DisplayName("Should report a conflict raised by the store and continue")
        void shouldReportThrownConflict() {
            when(obligationStore.markReconciled(eq("OB-1"), anyString()))
                .thenThrow(new StorageConflictException("OB-1", "stmt:2"));

            ReconciliationReport report = service.reconcile(STATEMENT,
                List.of(obligation("OB-1", "CALL-001", "250000.00", LocalDate.of(2025, 12, 15))));

            assertThat(report.getOutcomes())
                .extracting(TransactionOutcome::getStatus)
                .containsExactly(OutcomeStatus.CONFLICT, OutcomeStatus.UNMATCHED);
            assertThat(report.getDiscrepancies().get(0).getReason()).isEqualTo("Obligation OB-1 is already reconciled");
        }

        @Test
        @DisplayName("Should record an ambiguous reference as a failed match and continue")
        void shouldRecordAmbiguousMatch() {
            ReconciliationReport report = service.reconcile(STATEMENT, List.of(
                obligation("OB-1", "CALL-001", "250000.00", LocalDate.of(2025, 12, 15)),
                obligation("OB-9", "CALL-001", "250000.00", LocalDate.of(2025, 12, 18))));

            assertThat(report.getOutcomes())
                .extracting(TransactionOutcome::getStatus)
                .containsExactly(OutcomeStatus.FAILED, OutcomeStatus.UNMATCHED);
            assertThat(report.getDiscrepancies().get(0).getReason())
                .startsWith("match evaluation failed: Reference CALL-001");
            verify(obligationStore, never()).markReconciled(anyString(), anyString());
        }

        @Test
        @DisplayName("Should keep the match when counterparty history is unavailable")
        void shouldSkipFraudWhenHistoryFails() {
            when(obligationStore.markReconciled(eq("OB-1"), anyString())).thenReturn(ReconcileOutcome.SUCCESS);
            when(historyProvider.getCounterpartyHistory(anyString(), anyInt(), any(LocalDateTime.class)))
                .thenThrow(new IllegalStateException("history service down"));

            ReconciliationReport report = service.reconcile(STATEMENT,
                List.of(obligation("OB-1", "CALL-001", "250000.00", LocalDate.of(2025, 12, 15))));

            TransactionOutcome outcome = report.getOutcomes().get(0);
            assertThat(outcome.isMatched()).isTrue();
            assertThat(outcome.getFraudAssessment()).isNull();
        }
    }

    @Test
    @DisplayName("Should stop between transactions when the thread is interrupted")
    void shouldHonourCancellation() {
        // Given
        Thread.currentThread().interrupt();

        // When
        ReconciliationReport report = service.reconcile(STATEMENT,
            List.of(obligation("OB-1", "CALL-001", "250000.00", LocalDate.of(2025, 12, 15))));

        // Then
        assertThat(report.isCancelled()).isTrue();
        assertThat(report.getCreditCount()).isEqualTo(2);
        assertThat(report.getOutcomes()).isEmpty();
        verifyNoInteractions(obligationStore);
    }

    @Nested
    @DisplayName("Reconciling against the store")
    class StoreCandidates {

        @Test
        @DisplayName("Should query candidates per credit and ignore credits outside the period")
        void shouldReconcileRequest() {
            // Given
            String statement = String.join("\n",
                "2025-12-01 WIRE REF:OLD-1 CAPITAL CALL $90,000.00",
                "2025-12-15 WIRE REF:CALL-001 CAPITAL CALL $250,000.00");
            Obligation obligation = obligation("OB-1", "CALL-001", "250000.00", LocalDate.of(2025, 12, 15));
            when(obligationStore.findCandidateObligations(new BigDecimal("250000.00"), "EUR",
                DateWindow.around(LocalDate.of(2025, 12, 15), 60))).thenReturn(List.of(obligation));
            when(obligationStore.markReconciled("OB-1", "STMT-2025-12:2")).thenReturn(ReconcileOutcome.SUCCESS);
            when(historyProvider.getCounterpartyHistory(eq("CP-1"), eq(90), any(LocalDateTime.class)))
                .thenReturn(List.of());

            StatementReconciliationRequest request = StatementReconciliationRequest.builder()
                .statementId("STMT-2025-12")
                .statementText(statement)
                .currency("EUR")
                .startDate(LocalDate.of(2025, 12, 10))
                .endDate(LocalDate.of(2025, 12, 31))
                .build();

            // When
            ReconciliationReport report = service.reconcile(request);

            // Then
            assertThat(report.getStatementId()).isEqualTo("STMT-2025-12");
            assertThat(report.getCreditCount()).isEqualTo(1);
            assertThat(report.getMatchedCount()).isEqualTo(1);
            assertThat(report.getOutcomes().get(0).getTransactionId()).isEqualTo("STMT-2025-12:2");
        }

        @Test
        @DisplayName("Should record a failing candidate lookup as a failed match")
        void shouldRecordStoreLookupFailure() {
            when(obligationStore.findCandidateObligations(any(), any(), any()))
                .thenThrow(new IllegalStateException("store unavailable"));

            ReconciliationReport report = service.reconcile(StatementReconciliationRequest.builder()
                .statementId("STMT-1")
                .statementText("2025-12-15 WIRE REF:CALL-001 $250,000.00")
                .build());

            assertThat(report.getDiscrepancies()).singleElement()
                .extracting(Discrepancy::getReason)
                .isEqualTo("match evaluation failed: store unavailable");
        }

        @Test
        @DisplayName("Should reconcile the text read from a statement document")
        void shouldReconcileDocument() {
            byte[] pdf = {1, 2, 3};
            when(documentReader.readText(pdf)).thenReturn("2025-12-16 INCOMING TRANSFER $42,000.00");
            when(obligationStore.findCandidateObligations(any(), eq("USD"), any())).thenReturn(List.of());

            ReconciliationReport report = service.reconcileDocument(pdf,
                StatementReconciliationRequest.builder().statementId("STMT-PDF").build());

            assertThat(report.getStatementId()).isEqualTo("STMT-PDF");
            assertThat(report.getUnmatchedCount()).isEqualTo(1);
        }
    }

    private static Obligation obligation(String id, String reference, String amount, LocalDate dueDate) {
        return Obligation.builder()
            .id(id)
            .counterpartyId("CP-1")
            .counterpartyName("Acme Corp")
            .expectedAmount(new BigDecimal(amount))
            .currency("USD")
            .dueDate(dueDate)
            .wireReference(reference)
            .status(ObligationStatus.AWAITING_PAYMENT)
            .build();
    }
}
