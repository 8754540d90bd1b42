package com.cgi.dbconnector.api.handler;

import com.cgi.dbconnector.api.dto.ApiResponse;
import com.cgi.dbconnector.exception.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.io.UncheckedIOException;

/**
 * Global exception handler for the application.
 * Maps driver management exceptions to API responses.
 */
@ControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Handles errors caused by the request itself: bad folder or unknown DBMS.
     *
     * @param e The exception
     * @return API response with error message
     */
    @ExceptionHandler({InvalidTargetException.class, UnsupportedEngineException.class})
    public ResponseEntity<ApiResponse<String>> handleBadRequest(BaseException e) {
        logger.warn("Rejected request: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, e);
    }

    /**
     * Handles NoMatchingDriverException.
     *
     * @param e NoMatchingDriverException
     * @return API response with error message
     */
    @ExceptionHandler(NoMatchingDriverException.class)
    public ResponseEntity<ApiResponse<String>> handleNoMatchingDriver(NoMatchingDriverException e) {
        logger.warn("Driver not installed: {}", e.getMessage());
        return error(HttpStatus.NOT_FOUND, e);
    }

    /**
     * Handles DownloadFailedException.
     *
     * @param e DownloadFailedException
     * @return API response with error message
     */
    @ExceptionHandler(DownloadFailedException.class)
    public ResponseEntity<ApiResponse<String>> handleDownloadFailed(DownloadFailedException e) {
        logger.error("Download error: {}", e.getMessage(), e);
        return error(HttpStatus.BAD_GATEWAY, e);
    }

    /**
     * Handles driver class and data source failures.
     *
     * @param e The exception
     * @return API response with error message
     */
    @ExceptionHandler({DriverClassNotFoundException.class, DriverLoadException.class, DataSourceException.class})
    public ResponseEntity<ApiResponse<String>> handleDriverError(BaseException e) {
        logger.error("Driver error: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e);
    }

    /**
     * Handles UncheckedIOException.
     *
     * @param e UncheckedIOException
     * @return API response with error message
     */
    @ExceptionHandler(UncheckedIOException.class)
    public ResponseEntity<ApiResponse<String>> handleIoException(UncheckedIOException e) {
        logger.error("I/O error: {}", e.getMessage(), e);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error(e.getMessage(), "IO_ERROR"));
    }

    /**
     * Handles IllegalArgumentException.
     *
     * @param e IllegalArgumentException
     * @return API response with error message
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<String>> handleIllegalArgumentException(IllegalArgumentException e) {
        logger.error("Invalid argument: {}", e.getMessage(), e);
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error("Invalid argument: " + e.getMessage(), "INVALID_ARGUMENT"));
    }

    /**
     * Handles all other exceptions.
     *
     * @param e Exception
     * @return API response with error message
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<String>> handleGenericException(Exception e) {
        logger.error("Unexpected error: {}", e.getMessage(), e);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error("An unexpected error occurred: " + e.getMessage(), "GENERAL_ERROR"));
    }

    private static ResponseEntity<ApiResponse<String>> error(HttpStatus status, BaseException e) {
        return ResponseEntity
                .status(status)
                .body(ApiResponse.error(e));
    }
}
