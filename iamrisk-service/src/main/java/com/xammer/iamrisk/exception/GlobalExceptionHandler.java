package com.xammer.iamrisk.exception;

import org.apache.catalina.connector.ClientAbortException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.context.request.async.AsyncRequestTimeoutException;

import java.util.Date;
import java.util.HashMap;
import java.util.Map;

@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * The client has disconnected; there is nobody left to answer.
     */
    @ExceptionHandler(ClientAbortException.class)
    public void handleClientAbortException() {
        logger.debug("Client disconnected before the response was complete");
    }

    @ExceptionHandler(InvalidScanRequestException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidRequest(InvalidScanRequestException ex) {
        return error(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException ex) {
        logger.warn("Failed to parse request body: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Invalid request body");
    }

    @ExceptionHandler(MissingAwsCredentialsException.class)
    public ResponseEntity<Map<String, Object>> handleMissingCredentials(MissingAwsCredentialsException ex) {
        return error(HttpStatus.UNAUTHORIZED, ex.getMessage());
    }

    @ExceptionHandler(ScanAlreadyRunningException.class)
    public ResponseEntity<Map<String, Object>> handleScanAlreadyRunning(ScanAlreadyRunningException ex) {
        ResponseEntity<Map<String, Object>> response = error(HttpStatus.CONFLICT, ex.getMessage());
        response.getBody().put("sessionId", ex.getSessionId());
        return response;
    }

    /**
     * A stream outlived its emitter timeout before the response was committed.
     */
    @ExceptionHandler(AsyncRequestTimeoutException.class)
    public ResponseEntity<Map<String, Object>> handleAsyncRequestTimeout(AsyncRequestTimeoutException ex) {
        logger.warn("Async request timed out before a response was written");
        return error(HttpStatus.SERVICE_UNAVAILABLE, "The scan took too long and was stopped.");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<?> globalExceptionHandler(Exception ex) {
        if (ex.getCause() instanceof ClientAbortException) {
            return null;
        }
        logger.error("Unhandled error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred: " + ex.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        Map<String, Object> body = new HashMap<>();
        body.put("timestamp", new Date());
        body.put("message", message);
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body);
    }
}
