package com.fundrecon.reconciliation.fraud;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Advisory risk annotation of a payment. Indicators keep rule evaluation order.
 */
@Value
public class FraudAssessment {

    BigDecimal riskScore;
    List<String> indicators;

    public FraudAssessment(BigDecimal riskScore, List<String> indicators) {
        this.riskScore = riskScore;
        this.indicators = List.copyOf(indicators);
    }

    public boolean hasIndicators() {
        return !indicators.isEmpty();
    }
}
