package com.fundrecon.reconciliation.exception;

import com.fundrecon.common.exception.BusinessException;
import com.fundrecon.common.exception.ErrorCode;

import java.util.Map;

/**
 * The obligation store refused to reconcile an obligation that is already
 * reconciled (optimistic lock or unique constraint failure).
 */
public class StorageConflictException extends BusinessException {

    private final String obligationId;

    public StorageConflictException(String obligationId, String transactionId) {
        super(ErrorCode.RECON_STORAGE_CONFLICT,
            "Obligation " + obligationId + " is already reconciled",
            Map.of("obligationId", obligationId, "transactionId", transactionId));
        this.obligationId = obligationId;
    }

    public String getObligationId() {
        return obligationId;
    }
}
