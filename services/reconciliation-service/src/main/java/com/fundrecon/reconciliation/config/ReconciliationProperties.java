package com.fundrecon.reconciliation.config;

import com.fundrecon.reconciliation.fraud.FraudRules;
import com.fundrecon.reconciliation.matching.MatchingPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Tunable thresholds, weights and windows of the reconciliation pipeline.
 * Defaults mirror {@link MatchingPolicy#defaults()} and {@link FraudRules#defaults()}.
 */
@Data
@ConfigurationProperties(prefix = "fundrecon.reconciliation")
public class ReconciliationProperties {

    /**
     * Currency assumed for statements that do not state one
     */
    private String defaultCurrency = "USD";

    private Matching matching = new Matching();

    private Fraud fraud = new Fraud();

    private Statement statement = new Statement();

    private Candidates candidates = new Candidates();

    public MatchingPolicy toMatchingPolicy() {
        return MatchingPolicy.builder()
            .amountTolerance(matching.getAmountTolerance())
            .exactAmountTolerance(matching.getExactAmountTolerance())
            .statementDateWindowDays(matching.getStatementDateWindowDays())
            .wireDateWindowDays(matching.getWireDateWindowDays())
            .amountDateConfidence(matching.getAmountDateConfidence())
            .exactAmountWeight(matching.getExactAmountWeight())
            .nameTokenWeight(matching.getNameTokenWeight())
            .referenceSimilarityWeight(matching.getReferenceSimilarityWeight())
            .fuzzyAcceptanceThreshold(matching.getFuzzyAcceptanceThreshold())
            .build();
    }

    public FraudRules toFraudRules() {
        return FraudRules.builder()
            .velocityWindowHours(fraud.getVelocityWindowHours())
            .velocityMaxPayments(fraud.getVelocityMaxPayments())
            .velocityWeight(fraud.getVelocityWeight())
            .amountDeviation(fraud.getAmountDeviation())
            .amountDeviationWeight(fraud.getAmountDeviationWeight())
            .overdueDays(fraud.getOverdueDays())
            .overdueWeight(fraud.getOverdueWeight())
            .largeAmountThreshold(fraud.getLargeAmountThreshold())
            .largeFirstPaymentWeight(fraud.getLargeFirstPaymentWeight())
            .maxFailedAttempts(fraud.getMaxFailedAttempts())
            .failedAttemptsWeight(fraud.getFailedAttemptsWeight())
            .build();
    }

    @Data
    public static class Matching {
        /**
         * Relative amount tolerance (0.01 = 1%)
         */
        private BigDecimal amountTolerance = new BigDecimal("0.01");

        /**
         * Absolute difference below which amounts count as equal in fuzzy scoring
         */
        private BigDecimal exactAmountTolerance = BigDecimal.ONE;

        private int statementDateWindowDays = 1;

        private int wireDateWindowDays = 30;

        /**
         * Confidence reported for amount and date matches
         */
        private double amountDateConfidence = 0.9;

        private double exactAmountWeight = 0.5;

        private double nameTokenWeight = 0.3;

        private double referenceSimilarityWeight = 0.2;

        private double fuzzyAcceptanceThreshold = 0.7;
    }

    @Data
    public static class Fraud {
        private int velocityWindowHours = 24;
        private int velocityMaxPayments = 3;
        private BigDecimal velocityWeight = new BigDecimal("0.30");
        private BigDecimal amountDeviation = new BigDecimal("0.10");
        private BigDecimal amountDeviationWeight = new BigDecimal("0.20");
        private int overdueDays = 60;
        private BigDecimal overdueWeight = new BigDecimal("0.15");
        private BigDecimal largeAmountThreshold = new BigDecimal("100000");
        private BigDecimal largeFirstPaymentWeight = new BigDecimal("0.25");
        private int maxFailedAttempts = 2;
        private BigDecimal failedAttemptsWeight = new BigDecimal("0.10");
    }

    @Data
    public static class Statement {
        /**
         * Text layers shorter than this are treated as scanned pages
         */
        private int minimumTextLength = 20;

        private Ocr ocr = new Ocr();
    }

    @Data
    public static class Ocr {
        private boolean enabled = false;

        /**
         * Directory holding the Tesseract traineddata files
         */
        private String datapath;

        private String language = "eng";

        private float dpi = 300f;
    }

    @Data
    public static class Candidates {
        /**
         * Due date lookback around a statement transaction when querying the store
         */
        private int statementLookbackDays = 60;

        private int wireLookbackDays = 30;

        /**
         * Counterparty history considered by the fraud rules
         */
        private int historyWindowDays = 90;

        /**
         * Cap on candidates returned by the in-memory store
         */
        private int maxCandidates = 50;
    }
}
