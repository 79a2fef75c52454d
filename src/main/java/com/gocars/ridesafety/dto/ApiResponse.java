package com.gocars.ridesafety.dto;

import com.gocars.ridesafety.service.OperationResult;
import lombok.*;

/**
 * Generic API response wrapper.
 *
 * Provides Lombok @Builder for fine-grained construction AND
 * static factory helpers for the most common cases:
 *   ApiResponse.success(data, message)
 *   ApiResponse.error(message)
 *   ApiResponse.of(operationResult)
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ApiResponse {

    private boolean success;
    private String message;
    private Object data;

    /** Shorthand for a successful response with data. */
    public static ApiResponse success(Object data, String message) {
        ApiResponse r = new ApiResponse();
        r.setSuccess(true);
        r.setMessage(message);
        r.setData(data);
        return r;
    }

    /** Shorthand for an error response. */
    public static ApiResponse error(String message) {
        ApiResponse r = new ApiResponse();
        r.setSuccess(false);
        r.setMessage(message);
        return r;
    }

    /** Mirrors the outcome of a core operation. */
    public static ApiResponse of(OperationResult result) {
        ApiResponse r = new ApiResponse();
        r.setSuccess(result.isSuccess());
        r.setMessage(result.getMessage());
        return r;
    }

}
