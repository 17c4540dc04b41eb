package com.fundrecon.reconciliation.matching;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of matching one transaction. {@code obligationId} is null exactly
 * when the strategy is {@link MatchStrategy#NONE}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MatchResult {

    private static final MatchResult NO_MATCH = new MatchResult(null, 0.0, MatchStrategy.NONE);

    String obligationId;
    double confidence;
    MatchStrategy strategy;

    public static MatchResult matched(String obligationId, double confidence, MatchStrategy strategy) {
        if (obligationId == null || strategy == MatchStrategy.NONE) {
            throw new IllegalArgumentException("A match needs an obligation id and a matching strategy");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence out of range: " + confidence);
        }
        return new MatchResult(obligationId, confidence, strategy);
    }

    public static MatchResult noMatch() {
        return NO_MATCH;
    }

    public boolean isMatched() {
        return strategy != MatchStrategy.NONE;
    }
}
