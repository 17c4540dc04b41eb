package com.fundrecon.reconciliation.fraud;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Thresholds and weights of the anomaly rules evaluated by {@link FraudScorer}.
 */
@Value
@Builder
public class FraudRules {

    @Builder.Default
    int velocityWindowHours = 24;

    /** Velocity rule fires above this many payments inside the window */
    @Builder.Default
    int velocityMaxPayments = 3;

    @Builder.Default
    BigDecimal velocityWeight = new BigDecimal("0.30");

    /** Relative deviation from the expected amount, 0.10 = 10% */
    @Builder.Default
    BigDecimal amountDeviation = new BigDecimal("0.10");

    @Builder.Default
    BigDecimal amountDeviationWeight = new BigDecimal("0.20");

    @Builder.Default
    int overdueDays = 60;

    @Builder.Default
    BigDecimal overdueWeight = new BigDecimal("0.15");

    @Builder.Default
    BigDecimal largeAmountThreshold = new BigDecimal("100000");

    @Builder.Default
    BigDecimal largeFirstPaymentWeight = new BigDecimal("0.25");

    /** Failure rule fires above this many failed attempts */
    @Builder.Default
    int maxFailedAttempts = 2;

    @Builder.Default
    BigDecimal failedAttemptsWeight = new BigDecimal("0.10");

    public static FraudRules defaults() {
        return FraudRules.builder().build();
    }
}
