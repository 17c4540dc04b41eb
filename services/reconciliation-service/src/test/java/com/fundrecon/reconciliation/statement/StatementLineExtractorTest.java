package com.fundrecon.reconciliation.statement;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("StatementLineExtractor Tests")
class StatementLineExtractorTest {

    private final StatementLineExtractor extractor = new StatementLineExtractor();

    @Nested
    @DisplayName("Line layouts")
    class LineLayouts {

        @Test
        @DisplayName("Should read a US dated line with a dollar amount")
        void shouldReadDollarAmountLine() {
            // When
            List<StatementTransaction> transactions =
                extractor.extract("12/15/2025 WIRE REF:XYZ789 CAPITAL CALL $250,000.00");

            // Then
            assertThat(transactions).hasSize(1);
            StatementTransaction transaction = transactions.get(0);
            assertThat(transaction.getDate()).isEqualTo(LocalDate.of(2025, 12, 15));
            assertThat(transaction.getAmount()).isEqualByComparingTo(new BigDecimal("250000.00"));
            assertThat(transaction.getDirection()).isEqualTo(TransactionDirection.CREDIT);
            assertThat(transaction.getReference()).isEqualTo("XYZ789");
            assertThat(transaction.getDescription()).isEqualTo("WIRE REF:XYZ789 CAPITAL CALL");
            assertThat(transaction.getLineNumber()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should read a short year date with a CR marker")
        void shouldReadShortYearWithMarker() {
            List<StatementTransaction> transactions =
                extractor.extract("3/7/25 INCOMING TRANSFER NORTHWIND LP 1,500,000.00 CR");

            assertThat(transactions).singleElement().satisfies(transaction -> {
                assertThat(transaction.getDate()).isEqualTo(LocalDate.of(2025, 3, 7));
                assertThat(transaction.getAmount()).isEqualByComparingTo(new BigDecimal("1500000.00"));
                assertThat(transaction.isCredit()).isTrue();
            });
        }

        @Test
        @DisplayName("Should read an ISO dated line")
        void shouldReadIsoLine() {
            List<StatementTransaction> transactions =
                extractor.extract("2025-11-15 CAPITAL CALL APOLLO-CALL-Q4-2025 $75,000.00");

            assertThat(transactions).singleElement().satisfies(transaction -> {
                assertThat(transaction.getDate()).isEqualTo(LocalDate.of(2025, 11, 15));
                assertThat(transaction.getReference()).isEqualTo("APOLLO-CALL-Q4-2025");
            });
        }
    }

    @Nested
    @DisplayName("Direction")
    class Direction {

        @Test
        @DisplayName("Should treat a DR marker as a debit")
        void shouldDetectDebitMarker() {
            List<StatementTransaction> transactions = extractor.extract("11/02/2025 MANAGEMENT FEE 12,000.00 DR");

            assertThat(transactions).singleElement()
                .extracting(StatementTransaction::getDirection)
                .isEqualTo(TransactionDirection.DEBIT);
        }

        @Test
        @DisplayName("Should treat a DR marker after a dollar amount as a debit")
        void shouldDetectDebitMarkerAfterDollarAmount() {
            // When
            List<StatementTransaction> transactions =
                extractor.extract("12/15/2025 OUTGOING PAYMENT $250,000.00 DR");

            // Then
            assertThat(transactions).singleElement().satisfies(transaction -> {
                assertThat(transaction.getDirection()).isEqualTo(TransactionDirection.DEBIT);
                assertThat(transaction.getAmount()).isEqualByComparingTo(new BigDecimal("250000.00"));
                assertThat(transaction.getDescription()).isEqualTo("OUTGOING PAYMENT");
            });
        }

        @Test
        @DisplayName("Should treat a CR marker after a dollar amount as a credit")
        void shouldDetectCreditMarkerAfterDollarAmount() {
            List<StatementTransaction> transactions =
                extractor.extract("12/15/2025 WIRE REF:CALL-001 $250,000.00 CR");

            assertThat(transactions).singleElement()
                .extracting(StatementTransaction::getDirection)
                .isEqualTo(TransactionDirection.CREDIT);
        }

        @Test
        @DisplayName("Should treat a line mentioning DEBIT as a debit")
        void shouldDetectDebitKeyword() {
            List<StatementTransaction> transactions = extractor.extract("2025-11-03 DEBIT CARD FEE 25.00");

            assertThat(transactions).singleElement()
                .extracting(StatementTransaction::isCredit)
                .isEqualTo(false);
        }
    }

    @Nested
    @DisplayName("Noise and invalid lines")
    class Noise {

        @Test
        @DisplayName("Should skip headers, balances and blank lines and keep line numbers")
        void shouldSkipNoise() {
            String statement = String.join("\n",
                "FIRST NATIONAL BANK - ACCOUNT STATEMENT",
                "",
                "Opening balance",
                "12/01/2025 WIRE REF:CALL-001 $100,000.00",
                "Page 1 of 2",
                "12/02/2025 WIRE REF:CALL-002 $200,000.00");

            List<StatementTransaction> transactions = extractor.extract(statement);

            assertThat(transactions)
                .extracting(StatementTransaction::getLineNumber)
                .containsExactly(4, 6);
            assertThat(transactions)
                .extracting(StatementTransaction::getReference)
                .containsExactly("CALL-001", "CALL-002");
        }

        @Test
        @DisplayName("Should skip a line whose date is not a calendar date")
        void shouldSkipInvalidDate() {
            List<StatementTransaction> transactions = extractor.extract(
                "02/30/2025 IMPOSSIBLE DATE $1,000.00\n12/15/2025 VALID LINE $2,000.00");

            assertThat(transactions).singleElement()
                .extracting(StatementTransaction::getDescription)
                .isEqualTo("VALID LINE");
        }

        @Test
        @DisplayName("Should return nothing for empty text")
        void shouldHandleEmptyText() {
            assertThat(extractor.extract("")).isEmpty();
            assertThat(extractor.extract(null)).isEmpty();
        }
    }
}
