package com.fundrecon.common.exception;

import com.fundrecon.common.error.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.time.ZonedDateTime;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Global exception handler shared by all services
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ErrorResponse> handleBusinessException(BusinessException ex, WebRequest request) {
        if (ex.getStatus().is5xxServerError()) {
            log.error("Business exception - Error ID: {} - {}", ex.getErrorId(), ex.getMessage(), ex);
        } else {
            log.warn("Business exception - Error ID: {} - Code: {} - {}",
                ex.getErrorId(), ex.getErrorCode().getCode(), ex.getMessage());
        }
        return new ResponseEntity<>(ex.toErrorResponse(path(request)), ex.getStatus());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex, WebRequest request) {
        String message = ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
        log.warn("Validation failed: {}", message);
        return buildErrorResponse(HttpStatus.BAD_REQUEST, ErrorCode.VAL_REQUIRED_FIELD, message, request);
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MissingServletRequestPartException.class})
    public ResponseEntity<ErrorResponse> handleMissingParameter(Exception ex, WebRequest request) {
        log.warn("Missing request input: {}", ex.getMessage());
        return buildErrorResponse(HttpStatus.BAD_REQUEST, ErrorCode.VAL_REQUIRED_FIELD, ex.getMessage(), request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableMessage(HttpMessageNotReadableException ex, WebRequest request) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return buildErrorResponse(HttpStatus.BAD_REQUEST, ErrorCode.VAL_INVALID_FORMAT,
            "Malformed request body", request);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleMaxUploadSizeExceeded(
            MaxUploadSizeExceededException ex, WebRequest request) {
        log.error("File upload size exceeded", ex);
        return buildErrorResponse(HttpStatus.PAYLOAD_TOO_LARGE, ErrorCode.VAL_INVALID_FORMAT,
            "File size exceeds maximum allowed limit", request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex, WebRequest request) {
        String errorId = UUID.randomUUID().toString();
        log.error("Unexpected error - Error ID: {}", errorId, ex);
        return buildErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR, ErrorCode.SYS_INTERNAL_ERROR,
            "An unexpected error occurred. Please try again later.", request, errorId);
    }

    protected ResponseEntity<ErrorResponse> buildErrorResponse(HttpStatus status, ErrorCode errorCode,
                                                               String message, WebRequest request) {
        return buildErrorResponse(status, errorCode, message, request, UUID.randomUUID().toString());
    }

    protected ResponseEntity<ErrorResponse> buildErrorResponse(HttpStatus status, ErrorCode errorCode,
                                                               String message, WebRequest request, String errorId) {
        ErrorResponse response = ErrorResponse.builder()
                .timestamp(ZonedDateTime.now())
                .status(status.value())
                .error(status.getReasonPhrase())
                .errorCode(errorCode.getCode())
                .message(message)
                .path(path(request))
                .errorId(errorId)
                .build();

        return new ResponseEntity<>(response, status);
    }

    private static String path(WebRequest request) {
        String description = request.getDescription(false);
        return description.startsWith("uri=") ? description.substring(4) : description;
    }
}
