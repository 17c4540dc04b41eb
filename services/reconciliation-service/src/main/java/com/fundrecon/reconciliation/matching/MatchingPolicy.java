package com.fundrecon.reconciliation.matching;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Tolerances, windows and fuzzy weights used by {@link ObligationMatcher}.
 * The fuzzy weights and threshold are empirical and should be tuned against
 * labelled historical matches.
 */
@Value
@Builder
public class MatchingPolicy {

    /** Relative tolerance for amount comparisons, 0.01 = 1% */
    @Builder.Default
    BigDecimal amountTolerance = new BigDecimal("0.01");

    /** Absolute difference below which amounts count as exactly equal */
    @Builder.Default
    BigDecimal exactAmountTolerance = BigDecimal.ONE;

    /** Due date window around a statement transaction date, in days */
    @Builder.Default
    int statementDateWindowDays = 1;

    /** Due date window around a wire value date, in days */
    @Builder.Default
    int wireDateWindowDays = 30;

    @Builder.Default
    double amountDateConfidence = 0.9;

    @Builder.Default
    double exactAmountWeight = 0.5;

    @Builder.Default
    double nameTokenWeight = 0.3;

    @Builder.Default
    double referenceSimilarityWeight = 0.2;

    /** Fuzzy scores must exceed this value to be accepted */
    @Builder.Default
    double fuzzyAcceptanceThreshold = 0.7;

    public static MatchingPolicy defaults() {
        return MatchingPolicy.builder().build();
    }
}
