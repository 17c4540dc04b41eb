package com.fundrecon.reconciliation.service;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Statement to reconcile against obligations in the store.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class StatementReconciliationRequest {

    /**
     * Identifies the statement; transaction ids are derived from it
     */
    @NotBlank
    private String statementId;

    private String statementText;

    /**
     * Account currency; the configured default applies when absent
     */
    @Pattern(regexp = "[A-Z]{3}")
    private String currency;

    /**
     * Credits dated before this day are ignored
     */
    private LocalDate startDate;

    /**
     * Credits dated after this day are ignored
     */
    private LocalDate endDate;
}
