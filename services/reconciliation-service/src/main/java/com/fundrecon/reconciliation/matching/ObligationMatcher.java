package com.fundrecon.reconciliation.matching;

import com.fundrecon.reconciliation.exception.AmbiguousMatchException;
import com.fundrecon.reconciliation.text.StringSimilarity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Matches one transaction against a caller supplied pool of candidate
 * obligations. Strategies run in strict priority order and the first one that
 * succeeds decides the result:
 * <ol>
 *     <li>exact wire reference</li>
 *     <li>amount within tolerance and due date within the channel's window</li>
 *     <li>weighted fuzzy score above the acceptance threshold</li>
 * </ol>
 * Candidates that are not awaiting payment are ignored. Holds no state between
 * calls.
 */
@Slf4j
@RequiredArgsConstructor
public class ObligationMatcher {

    private final MatchingPolicy policy;

    public ObligationMatcher() {
        this(MatchingPolicy.defaults());
    }

    /**
     * @throws AmbiguousMatchException when several candidates carry the
     *         transaction's reference and are equally close in amount
     */
    public MatchResult match(MatchableTransaction transaction, List<Obligation> candidates) {
        List<Obligation> open = candidates.stream()
            .filter(Obligation::isOpenForMatching)
            .collect(Collectors.toList());

        if (open.isEmpty()) {
            log.debug("No open candidates for transaction {}", describe(transaction));
            return MatchResult.noMatch();
        }

        Optional<MatchResult> result = matchByReference(transaction, open)
            .or(() -> matchByAmountAndDate(transaction, open))
            .or(() -> matchFuzzy(transaction, open));

        MatchResult matchResult = result.orElseGet(MatchResult::noMatch);
        log.debug("Transaction {} matched with strategy {} (confidence {})",
            describe(transaction), matchResult.getStrategy(), matchResult.getConfidence());
        return matchResult;
    }

    private Optional<MatchResult> matchByReference(MatchableTransaction transaction, List<Obligation> candidates) {
        String reference = transaction.getReference();
        if (reference == null || reference.isEmpty()) {
            return Optional.empty();
        }

        List<Obligation> sameReference = candidates.stream()
            .filter(candidate -> reference.equals(candidate.getWireReference()))
            .sorted(Comparator.comparing(candidate -> amountDifference(transaction, candidate)))
            .collect(Collectors.toList());

        if (sameReference.isEmpty()) {
            return Optional.empty();
        }

        if (sameReference.size() > 1) {
            BigDecimal best = amountDifference(transaction, sameReference.get(0));
            List<String> tied = sameReference.stream()
                .filter(candidate -> amountDifference(transaction, candidate).compareTo(best) == 0)
                .map(Obligation::getId)
                .collect(Collectors.toList());
            if (tied.size() > 1) {
                throw new AmbiguousMatchException(reference, tied);
            }
        }

        return Optional.of(MatchResult.matched(sameReference.get(0).getId(), 1.0, MatchStrategy.REFERENCE));
    }

    private Optional<MatchResult> matchByAmountAndDate(MatchableTransaction transaction, List<Obligation> candidates) {
        return candidates.stream()
            .filter(candidate -> withinAmountTolerance(transaction, candidate))
            .filter(candidate -> withinDateWindow(transaction, candidate))
            .min(Comparator.comparingLong(candidate -> daysApart(transaction, candidate)))
            .map(candidate -> MatchResult.matched(
                candidate.getId(), policy.getAmountDateConfidence(), MatchStrategy.AMOUNT_DATE));
    }

    private Optional<MatchResult> matchFuzzy(MatchableTransaction transaction, List<Obligation> candidates) {
        Set<String> narrativeTokens = tokens(transaction.getNarrative());

        Obligation bestCandidate = null;
        double bestScore = 0.0;

        for (Obligation candidate : candidates) {
            double score = fuzzyScore(transaction, candidate, narrativeTokens);
            if (score > bestScore) {
                bestScore = score;
                bestCandidate = candidate;
            }
        }

        if (bestCandidate == null || bestScore <= policy.getFuzzyAcceptanceThreshold()) {
            return Optional.empty();
        }
        return Optional.of(MatchResult.matched(bestCandidate.getId(), Math.min(bestScore, 1.0), MatchStrategy.FUZZY));
    }

    double fuzzyScore(MatchableTransaction transaction, Obligation candidate, Set<String> narrativeTokens) {
        double score = 0.0;

        if (amountDifference(transaction, candidate).compareTo(policy.getExactAmountTolerance()) < 0) {
            score += policy.getExactAmountWeight();
        }

        List<String> nameTokens = tokenList(candidate.getCounterpartyName());
        if (!nameTokens.isEmpty()) {
            long found = nameTokens.stream().filter(narrativeTokens::contains).count();
            score += policy.getNameTokenWeight() * found / nameTokens.size();
        }

        if (candidate.getWireReference() != null && transaction.getReference() != null) {
            score += policy.getReferenceSimilarityWeight()
                * StringSimilarity.similarity(candidate.getWireReference(), transaction.getReference());
        }

        return score;
    }

    private boolean withinAmountTolerance(MatchableTransaction transaction, Obligation candidate) {
        BigDecimal allowed = transaction.getAmount().abs().multiply(policy.getAmountTolerance());
        return amountDifference(transaction, candidate).compareTo(allowed) <= 0;
    }

    private boolean withinDateWindow(MatchableTransaction transaction, Obligation candidate) {
        if (candidate.getDueDate() == null || transaction.getTransactionDate() == null) {
            return false;
        }
        switch (transaction.getChannel()) {
            case STATEMENT:
                return daysApart(transaction, candidate) <= policy.getStatementDateWindowDays();
            case WIRE:
                return transaction.getCurrency() != null
                    && transaction.getCurrency().equalsIgnoreCase(candidate.getCurrency())
                    && daysApart(transaction, candidate) <= policy.getWireDateWindowDays();
            default:
                throw new IllegalStateException("Unknown transaction channel: " + transaction.getChannel());
        }
    }

    private static long daysApart(MatchableTransaction transaction, Obligation candidate) {
        if (candidate.getDueDate() == null || transaction.getTransactionDate() == null) {
            return Long.MAX_VALUE;
        }
        return Math.abs(ChronoUnit.DAYS.between(transaction.getTransactionDate(), candidate.getDueDate()));
    }

    private static BigDecimal amountDifference(MatchableTransaction transaction, Obligation candidate) {
        if (candidate.getExpectedAmount() == null) {
            return transaction.getAmount().abs();
        }
        return candidate.getExpectedAmount().subtract(transaction.getAmount()).abs();
    }

    private static Set<String> tokens(String text) {
        return new HashSet<>(tokenList(text));
    }

    private static List<String> tokenList(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return Arrays.asList(text.toLowerCase(Locale.ROOT).trim().split("\\s+"));
    }

    private static String describe(MatchableTransaction transaction) {
        return transaction.getChannel() + "[" + transaction.getTransactionDate() + " "
            + transaction.getAmount() + " ref=" + transaction.getReference() + "]";
    }
}
