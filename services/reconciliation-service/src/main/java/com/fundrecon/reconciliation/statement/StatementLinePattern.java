package com.fundrecon.reconciliation.statement;

import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.util.regex.Pattern;

/**
 * Line layouts recognised in statement text, in the order they are tried.
 * Every pattern captures date, description and amount as groups 1 to 3 and
 * an optional CR/DR marker as group 4.
 */
enum StatementLinePattern {

    /** 12/15/2025 DESCRIPTION 1,234.56 [CR|DR], also M/D/YY */
    US_DATE_WITH_MARKER("(\\d{1,2}/\\d{1,2}/\\d{2,4})\\s+(.+?)\\s+([\\d,]+\\.\\d{2})(?:\\s*(CR|DR)\\b)?") {
        @Override
        DateTimeFormatter dateFormat(String dateText) {
            return dateText.length() - dateText.lastIndexOf('/') - 1 == 2 ? US_SHORT_YEAR : US_LONG_YEAR;
        }
    },

    /** 12/15/2025 DESCRIPTION $1,234.56 [CR|DR] */
    US_DATE_DOLLAR_AMOUNT("(\\d{2}/\\d{2}/\\d{4})\\s+(.+?)\\s+\\$([\\d,]+\\.\\d{2})(?:\\s*(CR|DR)\\b)?") {
        @Override
        DateTimeFormatter dateFormat(String dateText) {
            return US_LONG_YEAR;
        }
    },

    /** 2025-12-15 DESCRIPTION [$]1,234.56 [CR|DR] */
    ISO_DATE("(\\d{4}-\\d{2}-\\d{2})\\s+(.+?)\\s+\\$?([\\d,]+\\.\\d{2})(?:\\s*(CR|DR)\\b)?") {
        @Override
        DateTimeFormatter dateFormat(String dateText) {
            return DateTimeFormatter.ISO_LOCAL_DATE;
        }
    };

    private static final DateTimeFormatter US_LONG_YEAR =
        DateTimeFormatter.ofPattern("M/d/uuuu").withResolverStyle(ResolverStyle.STRICT);
    private static final DateTimeFormatter US_SHORT_YEAR =
        DateTimeFormatter.ofPattern("M/d/uu").withResolverStyle(ResolverStyle.STRICT);

    static final int DATE_GROUP = 1;
    static final int DESCRIPTION_GROUP = 2;
    static final int AMOUNT_GROUP = 3;
    static final int MARKER_GROUP = 4;

    private final Pattern pattern;

    StatementLinePattern(String regex) {
        this.pattern = Pattern.compile(regex);
    }

    Pattern pattern() {
        return pattern;
    }

    abstract DateTimeFormatter dateFormat(String dateText);
}
