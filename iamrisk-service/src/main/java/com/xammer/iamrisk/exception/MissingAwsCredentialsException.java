package com.xammer.iamrisk.exception;

public class MissingAwsCredentialsException extends RuntimeException {

    public MissingAwsCredentialsException(String message) {
        super(message);
    }
}
