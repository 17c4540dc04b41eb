package com.fundrecon.reconciliation.statement;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * Turns plain statement text into transaction records.
 *
 * Each line is tested against the {@link StatementLinePattern}s in order and the
 * first matching pattern wins. Lines matching no pattern are headers, balances
 * or other noise and are skipped without error. A line is a debit when it
 * carries a {@code DR} marker or the word {@code DEBIT}; otherwise a credit.
 */
@Slf4j
@RequiredArgsConstructor
public class StatementLineExtractor {

    private static final String DEBIT_MARKER = "DR";
    private static final String DEBIT_KEYWORD = "DEBIT";

    private final ReferenceExtractor referenceExtractor;

    public StatementLineExtractor() {
        this(new ReferenceExtractor());
    }

    public List<StatementTransaction> extract(String statementText) {
        if (statementText == null || statementText.isBlank()) {
            return Collections.emptyList();
        }

        String[] lines = statementText.split("\\r?\\n");
        List<StatementTransaction> transactions = new ArrayList<>();

        for (int i = 0; i < lines.length; i++) {
            parseLine(lines[i], i + 1).ifPresent(transactions::add);
        }

        log.debug("Extracted {} transactions from {} statement lines", transactions.size(), lines.length);
        return transactions;
    }

    private Optional<StatementTransaction> parseLine(String line, int lineNumber) {
        for (StatementLinePattern linePattern : StatementLinePattern.values()) {
            Matcher matcher = linePattern.pattern().matcher(line);
            if (!matcher.find()) {
                continue;
            }
            // first matching pattern decides the line, even when its date is not a calendar date
            return toTransaction(linePattern, matcher, line, lineNumber);
        }
        return Optional.empty();
    }

    private Optional<StatementTransaction> toTransaction(StatementLinePattern linePattern, Matcher matcher,
                                                         String line, int lineNumber) {
        String dateText = matcher.group(StatementLinePattern.DATE_GROUP);
        LocalDate date;
        try {
            date = LocalDate.parse(dateText, linePattern.dateFormat(dateText));
        } catch (DateTimeParseException e) {
            log.debug("Skipping statement line {} with invalid date '{}'", lineNumber, dateText);
            return Optional.empty();
        }

        String description = matcher.group(StatementLinePattern.DESCRIPTION_GROUP).trim();
        BigDecimal amount = new BigDecimal(matcher.group(StatementLinePattern.AMOUNT_GROUP).replace(",", ""));
        String marker = matcher.group(StatementLinePattern.MARKER_GROUP);

        TransactionDirection direction = DEBIT_MARKER.equals(marker) || line.contains(DEBIT_KEYWORD)
            ? TransactionDirection.DEBIT
            : TransactionDirection.CREDIT;

        return Optional.of(StatementTransaction.builder()
            .lineNumber(lineNumber)
            .date(date)
            .description(description)
            .amount(amount)
            .direction(direction)
            .reference(referenceExtractor.extract(description))
            .build());
    }
}
