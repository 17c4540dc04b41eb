package com.fundrecon.common.exception;

import com.fundrecon.common.error.ErrorResponse;
import org.springframework.http.HttpStatus;

import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Base exception for all business-related failures.
 *
 * Carries an {@link ErrorCode}, a unique error id for log correlation and a
 * metadata map that callers may enrich before the exception leaves the
 * service boundary:
 * <pre>
 * throw new BusinessException(ErrorCode.RECON_AMBIGUOUS_MATCH, "Reference ABC123 is shared")
 *     .withMetadata("reference", "ABC123");
 * </pre>
 */
public class BusinessException extends RuntimeException {

    private final String errorId;
    private final ErrorCode errorCode;
    private final Map<String, Object> metadata;
    private final ZonedDateTime timestamp;

    public BusinessException(ErrorCode errorCode, String message) {
        this(errorCode, message, null, null);
    }

    public BusinessException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, cause, null);
    }

    public BusinessException(ErrorCode errorCode, String message, Map<String, Object> metadata) {
        this(errorCode, message, null, metadata);
    }

    public BusinessException(ErrorCode errorCode, String message, Throwable cause, Map<String, Object> metadata) {
        super(message != null ? message : resolve(errorCode).getDefaultMessage(), cause);
        this.errorId = UUID.randomUUID().toString();
        this.errorCode = resolve(errorCode);
        this.metadata = metadata != null ? new HashMap<>(metadata) : new HashMap<>();
        this.timestamp = ZonedDateTime.now();
    }

    // ===== FLUENT API FOR METADATA ENRICHMENT =====

    /**
     * Add single metadata entry (fluent API). Null keys and values are ignored.
     */
    public BusinessException withMetadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, value);
        }
        return this;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public String getErrorId() {
        return errorId;
    }

    /**
     * Unmodifiable view; use {@link #withMetadata(String, Object)} to add entries
     */
    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public HttpStatus getStatus() {
        return errorCode.getStatus();
    }

    public ZonedDateTime getTimestamp() {
        return timestamp;
    }

    /**
     * Convert to error response DTO for API responses
     */
    public ErrorResponse toErrorResponse(String path) {
        return ErrorResponse.builder()
            .errorId(errorId)
            .status(getStatus().value())
            .error(getStatus().getReasonPhrase())
            .errorCode(errorCode.getCode())
            .message(getMessage())
            .path(path)
            .timestamp(timestamp)
            .details(metadata.isEmpty() ? null : getMetadata())
            .build();
    }

    private static ErrorCode resolve(ErrorCode errorCode) {
        return errorCode != null ? errorCode : ErrorCode.SYS_INTERNAL_ERROR;
    }
}
