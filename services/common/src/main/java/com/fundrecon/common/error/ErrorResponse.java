package com.fundrecon.common.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.ZonedDateTime;
import java.util.Map;

/**
 * Error response body returned by every API endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    /**
     * Unique id of this occurrence, also written to the service log
     */
    private String errorId;

    /**
     * HTTP status code
     */
    private int status;

    /**
     * HTTP reason phrase
     */
    private String error;

    /**
     * Platform error code, see {@code ErrorCode}
     */
    private String errorCode;

    private String message;

    /**
     * Request path
     */
    private String path;

    private ZonedDateTime timestamp;

    private Map<String, Object> details;
}
