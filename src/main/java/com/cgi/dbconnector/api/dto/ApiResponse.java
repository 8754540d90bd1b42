package com.cgi.dbconnector.api.dto;

import com.cgi.dbconnector.exception.BaseException;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Envelope of every driver API response.
 * Failures carry the error code and, for driver management errors, the engine, folder or
 * class path that the failure was about.
 *
 * @param <T> Type of data contained in the response
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ApiResponse<T> {
    private boolean success;
    private T data;
    private String error;
    private String errorCode;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private Map<String, String> details;

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(true, data, null, null, null);
    }

    /**
     * Creates an error response for failures outside the driver exception hierarchy.
     *
     * @param errorMessage Error message
     * @param errorCode Error code
     * @param <T> Type of data
     * @return Error API response
     */
    public static <T> ApiResponse<T> error(String errorMessage, String errorCode) {
        return new ApiResponse<>(false, null, errorMessage, errorCode, null);
    }

    /**
     * Creates an error response from a driver management failure.
     *
     * @param exception The failure
     * @param <T> Type of data
     * @return Error API response with the failure details
     */
    public static <T> ApiResponse<T> error(BaseException exception) {
        return new ApiResponse<>(false, null, exception.getMessage(), exception.getErrorCode(),
                exception.getDetails());
    }
}
