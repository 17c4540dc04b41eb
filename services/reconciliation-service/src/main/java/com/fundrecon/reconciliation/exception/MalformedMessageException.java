package com.fundrecon.reconciliation.exception;

import com.fundrecon.common.exception.BusinessException;
import com.fundrecon.common.exception.ErrorCode;

/**
 * A wire message lacks a required tag or its value-date/currency/amount block
 * cannot be decoded. Fatal to that single message only.
 */
public class MalformedMessageException extends BusinessException {

    public MalformedMessageException(String message) {
        super(ErrorCode.RECON_MALFORMED_WIRE_MESSAGE, message);
    }

    public MalformedMessageException(String message, Throwable cause) {
        super(ErrorCode.RECON_MALFORMED_WIRE_MESSAGE, message, cause);
    }
}
