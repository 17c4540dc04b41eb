package com.fundrecon.reconciliation.fraud;

import com.fundrecon.reconciliation.matching.Obligation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Rule based anomaly scoring of a reconciled or unreconciled payment.
 *
 * Five independent rules are all evaluated; each triggered rule adds its
 * weight and its indicator. The summed score is capped at 1.0. Rules that
 * compare against the obligation are skipped when there is none. An empty
 * history means the counterparty has no prior activity.
 *
 * The assessment is advisory; it never blocks a match.
 */
@Slf4j
@RequiredArgsConstructor
public class FraudScorer {

    private final FraudRules rules;

    public FraudScorer() {
        this(FraudRules.defaults());
    }

    public FraudAssessment assess(IncomingPayment payment, Obligation obligation, List<PriorTransaction> history) {
        List<PriorTransaction> priorActivity = history != null ? history : List.of();
        List<String> indicators = new ArrayList<>();
        BigDecimal score = BigDecimal.ZERO;

        // 1. Velocity
        if (recentPayments(payment, priorActivity) > rules.getVelocityMaxPayments()) {
            score = score.add(rules.getVelocityWeight());
            indicators.add(FraudIndicator.PAYMENT_VELOCITY.getDescription());
        }

        // 2. Amount anomaly
        if (obligation != null && deviatesFromExpected(payment, obligation)) {
            score = score.add(rules.getAmountDeviationWeight());
            indicators.add(FraudIndicator.AMOUNT_DEVIATION.getDescription());
        }

        // 3. Late payment
        if (obligation != null && isOverdue(payment, obligation)) {
            score = score.add(rules.getOverdueWeight());
            indicators.add(FraudIndicator.OVERDUE_PAYMENT.getDescription());
        }

        // 4. Large first payment
        if (isFirstSettledPayment(payment, priorActivity)
                && payment.getAmount().compareTo(rules.getLargeAmountThreshold()) > 0) {
            score = score.add(rules.getLargeFirstPaymentWeight());
            indicators.add(FraudIndicator.LARGE_FIRST_PAYMENT.getDescription());
        }

        // 5. Failed attempts
        if (failedAttempts(priorActivity) > rules.getMaxFailedAttempts()) {
            score = score.add(rules.getFailedAttemptsWeight());
            indicators.add(FraudIndicator.REPEATED_FAILURES.getDescription());
        }

        BigDecimal riskScore = score.min(BigDecimal.ONE);

        if (!indicators.isEmpty()) {
            log.info("Fraud indicators for transaction {} (counterparty {}): score={}, indicators={}",
                payment.getTransactionId(), payment.getCounterpartyId(), riskScore, indicators);
        }

        return new FraudAssessment(riskScore, indicators);
    }

    private long recentPayments(IncomingPayment payment, List<PriorTransaction> history) {
        LocalDateTime windowStart = payment.getReceivedAt().minusHours(rules.getVelocityWindowHours());
        return history.stream()
            .filter(prior -> prior.getOccurredAt() != null)
            .filter(prior -> !prior.getOccurredAt().isBefore(windowStart))
            .filter(prior -> !prior.getOccurredAt().isAfter(payment.getReceivedAt()))
            .count();
    }

    private boolean deviatesFromExpected(IncomingPayment payment, Obligation obligation) {
        BigDecimal expected = obligation.getExpectedAmount();
        if (expected == null || expected.signum() == 0) {
            return false;
        }
        BigDecimal deviation = payment.getAmount().subtract(expected).abs()
            .divide(expected.abs(), 6, RoundingMode.HALF_UP);
        return deviation.compareTo(rules.getAmountDeviation()) > 0;
    }

    private boolean isOverdue(IncomingPayment payment, Obligation obligation) {
        if (obligation.getDueDate() == null) {
            return false;
        }
        long daysLate = ChronoUnit.DAYS.between(obligation.getDueDate(), payment.getReceivedAt().toLocalDate());
        return daysLate > rules.getOverdueDays();
    }

    private boolean isFirstSettledPayment(IncomingPayment payment, List<PriorTransaction> history) {
        return history.stream()
            .filter(prior -> prior.getStatus() != null && prior.getStatus().isSettled())
            .noneMatch(prior -> prior.getOccurredAt() == null || prior.getOccurredAt().isBefore(payment.getReceivedAt()));
    }

    private long failedAttempts(List<PriorTransaction> history) {
        return history.stream()
            .filter(prior -> prior.getStatus() == PriorTransactionStatus.FAILED)
            .count();
    }
}
