package com.fundrecon.reconciliation.matching;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Expected incoming payment on a capital call. Owned by the obligation store;
 * reconciliation only reads it.
 */
@Value
@Builder
@Jacksonized
public class Obligation {

    String id;

    /**
     * Investor expected to pay; keys the counterparty history
     */
    String counterpartyId;

    /**
     * Name looked for in remittance and description text
     */
    String counterpartyName;

    BigDecimal expectedAmount;
    String currency;
    LocalDate dueDate;
    String wireReference;

    @With
    ObligationStatus status;

    public boolean isOpenForMatching() {
        return status != null && status.isOpenForMatching();
    }
}
