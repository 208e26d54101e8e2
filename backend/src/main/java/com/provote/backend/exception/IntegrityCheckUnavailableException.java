package com.provote.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * An authoritative check (block registry or vote history) could not be
 * completed. The vote is not accepted; the caller may retry.
 */
@ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
public class IntegrityCheckUnavailableException extends VotingException {
    public IntegrityCheckUnavailableException(String message, Throwable cause) {
        super("IntegrityCheckUnavailable", HttpStatus.SERVICE_UNAVAILABLE, message, cause);
    }
}
