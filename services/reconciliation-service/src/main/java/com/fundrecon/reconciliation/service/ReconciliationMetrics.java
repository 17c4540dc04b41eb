package com.fundrecon.reconciliation.service;

import com.fundrecon.reconciliation.matching.MatchStrategy;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Micrometer counters for reconciliation runs
 */
public class ReconciliationMetrics {

    private final Map<OutcomeStatus, Counter> outcomeCounters = new EnumMap<>(OutcomeStatus.class);
    private final Map<MatchStrategy, Counter> strategyCounters = new EnumMap<>(MatchStrategy.class);
    private final Counter malformedWireCounter;
    private final Counter fraudFlagCounter;
    private final Timer statementTimer;

    public ReconciliationMetrics(MeterRegistry meterRegistry) {
        for (OutcomeStatus status : OutcomeStatus.values()) {
            outcomeCounters.put(status, Counter.builder("fundrecon.reconciliation.transactions")
                .description("Reconciled transactions by outcome")
                .tag("outcome", status.name().toLowerCase(Locale.ROOT))
                .register(meterRegistry));
        }
        for (MatchStrategy strategy : MatchStrategy.values()) {
            strategyCounters.put(strategy, Counter.builder("fundrecon.reconciliation.matches")
                .description("Match results by strategy")
                .tag("strategy", strategy.name().toLowerCase(Locale.ROOT))
                .register(meterRegistry));
        }
        malformedWireCounter = Counter.builder("fundrecon.reconciliation.wire.malformed")
            .description("Wire messages rejected as malformed")
            .register(meterRegistry);
        fraudFlagCounter = Counter.builder("fundrecon.reconciliation.fraud.flagged")
            .description("Payments with at least one fraud indicator")
            .tag("severity", "review")
            .register(meterRegistry);
        statementTimer = Timer.builder("fundrecon.reconciliation.statement.duration")
            .description("Time to reconcile one statement")
            .register(meterRegistry);
    }

    public void recordOutcome(TransactionOutcome outcome) {
        outcomeCounters.get(outcome.getStatus()).increment();
        if (outcome.getMatchResult() != null) {
            strategyCounters.get(outcome.getMatchResult().getStrategy()).increment();
        }
        if (outcome.getFraudAssessment() != null && outcome.getFraudAssessment().hasIndicators()) {
            fraudFlagCounter.increment();
        }
    }

    public void recordMalformedWire() {
        malformedWireCounter.increment();
    }

    public Timer statementTimer() {
        return statementTimer;
    }
}
