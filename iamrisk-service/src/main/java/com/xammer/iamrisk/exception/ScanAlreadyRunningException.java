package com.xammer.iamrisk.exception;

public class ScanAlreadyRunningException extends RuntimeException {

    private final String sessionId;

    public ScanAlreadyRunningException(String sessionId) {
        super("An identical scan is already running in session " + sessionId);
        this.sessionId = sessionId;
    }

    public ScanAlreadyRunningException(String sessionId, String message) {
        super(message);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
