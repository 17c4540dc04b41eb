package com.fundrecon.reconciliation.exception;

import com.fundrecon.common.exception.BusinessException;
import com.fundrecon.common.exception.ErrorCode;

import java.util.List;
import java.util.Map;

/**
 * Two or more obligations share the transaction's reference and are equally
 * close in amount. Requires manual resolution; never retried.
 */
public class AmbiguousMatchException extends BusinessException {

    private final String reference;
    private final List<String> obligationIds;

    public AmbiguousMatchException(String reference, List<String> obligationIds) {
        super(ErrorCode.RECON_AMBIGUOUS_MATCH,
            String.format("Reference %s matches obligations %s with equal amount difference", reference, obligationIds),
            Map.of("reference", reference, "obligationIds", List.copyOf(obligationIds)));
        this.reference = reference;
        this.obligationIds = List.copyOf(obligationIds);
    }

    public String getReference() {
        return reference;
    }

    public List<String> getObligationIds() {
        return obligationIds;
    }
}
