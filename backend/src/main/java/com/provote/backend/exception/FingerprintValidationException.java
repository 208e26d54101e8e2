package com.provote.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

// Missing or malformed fingerprint; a specialisation of an invalid vote
@ResponseStatus(HttpStatus.BAD_REQUEST)
public class FingerprintValidationException extends InvalidVoteException {
    public FingerprintValidationException(String message) {
        super("FingerprintValidationError", message);
    }
}
