package com.provote.backend.exception;

import org.springframework.http.HttpStatus;

/**
 * Base of every rejection the cast flow can surface. The error code is part of
 * the public contract and must stay stable.
 */
public abstract class VotingException extends RuntimeException {

    private final String errorCode;
    private final HttpStatus status;

    protected VotingException(String errorCode, HttpStatus status, String message) {
        super(message);
        this.errorCode = errorCode;
        this.status = status;
    }

    protected VotingException(String errorCode, HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.status = status;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
