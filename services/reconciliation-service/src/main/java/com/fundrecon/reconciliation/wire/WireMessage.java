package com.fundrecon.reconciliation.wire;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fundrecon.reconciliation.matching.MatchableTransaction;
import com.fundrecon.reconciliation.matching.TransactionChannel;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Decoded MT103 customer transfer. Optional text fields are empty, never null.
 */
@Value
@Builder
public class WireMessage implements MatchableTransaction {

    String senderReference;
    LocalDate valueDate;
    String currency;
    BigDecimal amount;
    String orderingParty;
    String beneficiaryParty;
    String remittanceInfo;
    String senderToReceiverInfo;

    @Override
    @JsonIgnore
    public String getReference() {
        return senderReference;
    }

    @Override
    @JsonIgnore
    public LocalDate getTransactionDate() {
        return valueDate;
    }

    @Override
    @JsonIgnore
    public String getNarrative() {
        return remittanceInfo;
    }

    @Override
    @JsonIgnore
    public TransactionChannel getChannel() {
        return TransactionChannel.WIRE;
    }
}
