package com.coagent.workflow.core.engine.rest.dto;

import com.coagent.workflow.core.exception.CoAgentWorkflowException;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Envelope of every JSON response.
 *
 * @param <T> the type of data in the response
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private boolean success;

    /**
     * The response data (null if error).
     */
    private T data;

    /**
     * Error message (null if success).
     */
    private String error;

    /**
     * Stable error code, e.g. {@code COAGENT_ERR_0002}.
     */
    private String errorCode;

    /**
     * Readable error kind, e.g. {@code WORKFLOW_NOT_FOUND}.
     */
    private String errorType;

    private Map<String, Object> details;

    @Builder.Default
    private Instant timestamp = Instant.now();

    public static <T> ApiResponse<T> success(T data) {
        return ApiResponse.<T>builder()
                .success(true)
                .data(data)
                .timestamp(Instant.now())
                .build();
    }

    public static <T> ApiResponse<T> error(String message, String errorCode) {
        return ApiResponse.<T>builder()
                .success(false)
                .error(message)
                .errorCode(errorCode)
                .errorType(errorCode)
                .timestamp(Instant.now())
                .build();
    }

    public static <T> ApiResponse<T> error(CoAgentWorkflowException exception) {
        String errorType = exception.getErrorInfo() instanceof Enum<?>
                ? ((Enum<?>) exception.getErrorInfo()).name()
                : exception.getErrorInfo().getErrorCode();
        return ApiResponse.<T>builder()
                .success(false)
                .error(exception.getMessage())
                .errorCode(exception.getErrorInfo().getErrorCode())
                .errorType(errorType)
                .details(exception.getDetails().isEmpty() ? null : exception.getDetails())
                .timestamp(Instant.now())
                .build();
    }
}
