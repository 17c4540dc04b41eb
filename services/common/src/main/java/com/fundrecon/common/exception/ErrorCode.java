package com.fundrecon.common.exception;

import org.springframework.http.HttpStatus;

/**
 * Error codes for the FundRecon platform
 * Format: MODULE_SPECIFIC_ERROR
 */
public enum ErrorCode {

    // ===== RECONCILIATION ERRORS (RECON_XXX) =====
    RECON_MALFORMED_WIRE_MESSAGE("RECON_001", "Wire message is missing a required field", HttpStatus.UNPROCESSABLE_ENTITY),
    RECON_AMBIGUOUS_MATCH("RECON_002", "Several obligations match the same wire reference", HttpStatus.CONFLICT),
    RECON_STORAGE_CONFLICT("RECON_003", "Obligation is already reconciled", HttpStatus.CONFLICT),
    RECON_STATEMENT_UNREADABLE("RECON_004", "Statement document could not be read", HttpStatus.UNPROCESSABLE_ENTITY),

    // ===== VALIDATION ERRORS (VAL_XXX) =====
    VAL_REQUIRED_FIELD("VAL_001", "Required field is missing", HttpStatus.BAD_REQUEST),
    VAL_INVALID_FORMAT("VAL_002", "Invalid field format", HttpStatus.BAD_REQUEST),

    // ===== SYSTEM ERRORS (SYS_XXX) =====
    SYS_INTERNAL_ERROR("SYS_001", "Internal server error", HttpStatus.INTERNAL_SERVER_ERROR);

    private final String code;
    private final String defaultMessage;
    private final HttpStatus status;

    ErrorCode(String code, String defaultMessage, HttpStatus status) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.status = status;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
