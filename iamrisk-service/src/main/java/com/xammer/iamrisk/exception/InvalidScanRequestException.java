package com.xammer.iamrisk.exception;

/**
 * A request body that cannot be analysed. Reported as 400 before any work starts.
 */
public class InvalidScanRequestException extends RuntimeException {

    public InvalidScanRequestException(String message) {
        super(message);
    }
}
