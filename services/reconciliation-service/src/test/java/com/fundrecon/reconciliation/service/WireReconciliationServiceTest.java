package com.fundrecon.reconciliation.service;

import com.fundrecon.reconciliation.config.ReconciliationProperties;
import com.fundrecon.reconciliation.exception.AmbiguousMatchException;
import com.fundrecon.reconciliation.exception.MalformedMessageException;
import com.fundrecon.reconciliation.fraud.FraudScorer;
import com.fundrecon.reconciliation.matching.MatchStrategy;
import com.fundrecon.reconciliation.matching.Obligation;
import com.fundrecon.reconciliation.matching.ObligationMatcher;
import com.fundrecon.reconciliation.matching.ObligationStatus;
import com.fundrecon.reconciliation.store.CounterpartyHistoryProvider;
import com.fundrecon.reconciliation.store.DateWindow;
import com.fundrecon.reconciliation.store.ObligationStore;
import com.fundrecon.reconciliation.store.ReconcileOutcome;
import com.fundrecon.reconciliation.wire.WireMessage;
import com.fundrecon.reconciliation.wire.WireMessageParser;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
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
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("WireReconciliationService Tests")
class WireReconciliationServiceTest {

    private static final String CAPITAL_CALL_WIRE = String.join("\n",
        ":20:ABC123",
        ":32A:251115USD500000,00",
        ":50K:ACME CORP",
        ":59:APOLLO FUND XI",
        ":70:CAPITAL CALL PAYMENT");

    private static final LocalDate VALUE_DATE = LocalDate.of(2025, 11, 15);

    @Mock
    private ObligationStore obligationStore;

    @Mock
    private CounterpartyHistoryProvider historyProvider;

    private SimpleMeterRegistry meterRegistry;
    private WireReconciliationService service;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        service = new WireReconciliationService(
            new WireMessageParser(),
            new ObligationMatcher(),
            obligationStore,
            new FraudScreeningService(new FraudScorer(), historyProvider, 90),
            new ReconciliationMetrics(meterRegistry),
            new ReconciliationProperties());
    }

    @Nested
    @DisplayName("Single wire")
    class SingleWire {

        @Test
        @DisplayName("Should reconcile a wire by reference and attach a fraud assessment")
        void shouldReconcileWire() {
            // Given
            when(obligationStore.findCandidateObligations(new BigDecimal("500000.00"), "USD",
                DateWindow.around(VALUE_DATE, 30)))
                .thenReturn(List.of(obligation("OB-1", "ABC123", "500000.00")));
            when(obligationStore.markReconciled("OB-1", "wire:ABC123")).thenReturn(ReconcileOutcome.SUCCESS);
            when(historyProvider.getCounterpartyHistory(eq("CP-1"), eq(90), any(LocalDateTime.class)))
                .thenReturn(List.of());

            // When
            TransactionOutcome outcome = service.reconcileWire(CAPITAL_CALL_WIRE);

            // Then
            assertThat(outcome.getStatus()).isEqualTo(OutcomeStatus.MATCHED);
            assertThat(outcome.getObligationId()).isEqualTo("OB-1");
            assertThat(outcome.getMatchResult().getStrategy()).isEqualTo(MatchStrategy.REFERENCE);
            assertThat(outcome.getMatchResult().getConfidence()).isEqualTo(1.0);
            assertThat(outcome.getTransaction()).isInstanceOf(WireMessage.class);
            assertThat(outcome.getFraudAssessment().getRiskScore()).isEqualByComparingTo(new BigDecimal("0.25"));
            assertThat(meterRegistry.get("fundrecon.reconciliation.matches")
                .tag("strategy", "reference").counter().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should report an unmatched wire without touching the store")
        void shouldReportUnmatchedWire() {
            when(obligationStore.findCandidateObligations(any(), any(), any())).thenReturn(List.of());

            TransactionOutcome outcome = service.reconcileWire(CAPITAL_CALL_WIRE);

            assertThat(outcome.getStatus()).isEqualTo(OutcomeStatus.UNMATCHED);
            assertThat(outcome.getReason()).isEqualTo("No matching obligation found");
            verify(obligationStore, never()).markReconciled(anyString(), anyString());
            verifyNoInteractions(historyProvider);
        }

        @Test
        @DisplayName("Should report a conflict when the obligation is already reconciled")
        void shouldReportConflict() {
            when(obligationStore.findCandidateObligations(any(), any(), any()))
                .thenReturn(List.of(obligation("OB-1", "ABC123", "500000.00")));
            when(obligationStore.markReconciled("OB-1", "wire:ABC123")).thenReturn(ReconcileOutcome.CONFLICT);

            TransactionOutcome outcome = service.reconcileWire(CAPITAL_CALL_WIRE);

            assertThat(outcome.getStatus()).isEqualTo(OutcomeStatus.CONFLICT);
            assertThat(outcome.getReason()).isEqualTo("Obligation OB-1 already reconciled");
        }

        @Test
        @DisplayName("Should surface a malformed wire and count it")
        void shouldRejectMalformedWire() {
            assertThatThrownBy(() -> service.reconcileWire(":70:NO REFERENCE"))
                .isInstanceOf(MalformedMessageException.class);

            assertThat(meterRegistry.get("fundrecon.reconciliation.wire.malformed").counter().count()).isEqualTo(1.0);
            verifyNoInteractions(obligationStore);
        }

        @Test
        @DisplayName("Should surface an ambiguous reference for manual review")
        void shouldRejectAmbiguousReference() {
            when(obligationStore.findCandidateObligations(any(), any(), any())).thenReturn(List.of(
                obligation("OB-1", "ABC123", "500000.00"),
                obligation("OB-2", "ABC123", "500000.00")));

            assertThatThrownBy(() -> service.reconcileWire(CAPITAL_CALL_WIRE))
                .isInstanceOf(AmbiguousMatchException.class);
            verify(obligationStore, never()).markReconciled(anyString(), anyString());
        }
    }

    @Test
    @DisplayName("Should continue a batch past malformed wires")
    void shouldReconcileBatch() {
        // Given
        when(obligationStore.findCandidateObligations(any(), any(), any()))
            .thenReturn(List.of(obligation("OB-1", "ABC123", "500000.00")));
        when(obligationStore.markReconciled("OB-1", "wire:ABC123")).thenReturn(ReconcileOutcome.SUCCESS);
        when(historyProvider.getCounterpartyHistory(eq("CP-1"), eq(90), any(LocalDateTime.class)))
            .thenReturn(List.of());

        // When
        List<TransactionOutcome> outcomes = service.reconcileWires(List.of(":20:BROKEN", CAPITAL_CALL_WIRE));

        // Then
        assertThat(outcomes).extracting(TransactionOutcome::getStatus)
            .containsExactly(OutcomeStatus.FAILED, OutcomeStatus.MATCHED);
        assertThat(outcomes.get(0).getTransactionId()).isEqualTo("wire-batch:1");
        assertThat(outcomes.get(0).getReason()).contains(":32A:");
        assertThat(meterRegistry.get("fundrecon.reconciliation.transactions")
            .tag("outcome", "failed").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should record a failing store as failed items and finish the batch")
    void shouldContinueBatchWhenStoreFails() {
        // Given
        when(obligationStore.findCandidateObligations(any(), any(), any()))
            .thenThrow(new IllegalStateException("db down"));
        String secondWire = CAPITAL_CALL_WIRE.replace(":20:ABC123", ":20:A2");

        // When
        List<TransactionOutcome> outcomes = service.reconcileWires(List.of(CAPITAL_CALL_WIRE, secondWire));

        // Then
        assertThat(outcomes).extracting(TransactionOutcome::getStatus)
            .containsExactly(OutcomeStatus.FAILED, OutcomeStatus.FAILED);
        assertThat(outcomes).extracting(TransactionOutcome::getTransactionId)
            .containsExactly("wire-batch:1", "wire-batch:2");
        assertThat(outcomes).extracting(TransactionOutcome::getReason)
            .containsOnly("wire reconciliation failed: db down");
        assertThat(meterRegistry.get("fundrecon.reconciliation.transactions")
            .tag("outcome", "failed").counter().count()).isEqualTo(2.0);
        verifyNoInteractions(historyProvider);
    }

    private static Obligation obligation(String id, String reference, String amount) {
        return Obligation.builder()
            .id(id)
            .counterpartyId("CP-1")
            .counterpartyName("Acme Corp")
            .expectedAmount(new BigDecimal(amount))
            .currency("USD")
            .dueDate(VALUE_DATE.plusDays(5))
            .wireReference(reference)
            .status(ObligationStatus.AWAITING_PAYMENT)
            .build();
    }
}
