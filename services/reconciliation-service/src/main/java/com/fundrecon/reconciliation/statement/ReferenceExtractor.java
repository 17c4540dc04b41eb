package com.fundrecon.reconciliation.statement;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds a payment reference inside a statement description. Patterns are
 * tried in order; the first hit wins.
 */
public class ReferenceExtractor {

    private static final List<Pattern> REFERENCE_PATTERNS = List.of(
        Pattern.compile("\\bREF\\b\\s*[:#]?\\s*([A-Z0-9][A-Z0-9-]*)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("\\bWIRE\\s*[:#]\\s*([A-Z0-9][A-Z0-9-]*)", Pattern.CASE_INSENSITIVE),
        // upper-case dash separated token holding letters and digits, e.g. APOLLO-CALL-Q4-2025
        Pattern.compile("\\b((?=[A-Z0-9-]*[A-Z])(?=[A-Z0-9-]*\\d)[A-Z0-9]+(?:-[A-Z0-9]+)+)\\b")
    );

    /**
     * @return the reference, or {@code null} when the description carries none
     */
    public String extract(String description) {
        if (description == null || description.isBlank()) {
            return null;
        }
        for (Pattern pattern : REFERENCE_PATTERNS) {
            Matcher matcher = pattern.matcher(description);
            if (matcher.find()) {
                return trimTrailingDashes(matcher.group(1));
            }
        }
        return null;
    }

    private static String trimTrailingDashes(String reference) {
        int end = reference.length();
        while (end > 0 && reference.charAt(end - 1) == '-') {
            end--;
        }
        return end == 0 ? null : reference.substring(0, end);
    }
}
