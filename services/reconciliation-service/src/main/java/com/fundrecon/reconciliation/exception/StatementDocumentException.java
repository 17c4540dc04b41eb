package com.fundrecon.reconciliation.exception;

import com.fundrecon.common.exception.BusinessException;
import com.fundrecon.common.exception.ErrorCode;

public class StatementDocumentException extends BusinessException {

    public StatementDocumentException(String message, Throwable cause) {
        super(ErrorCode.RECON_STATEMENT_UNREADABLE, message, cause);
    }

    public StatementDocumentException(String message) {
        super(ErrorCode.RECON_STATEMENT_UNREADABLE, message);
    }
}
