package com.provote.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidVoteException extends VotingException {
    public InvalidVoteException(String message) {
        super("InvalidVoteError", HttpStatus.BAD_REQUEST, message);
    }

    protected InvalidVoteException(String errorCode, String message) {
        super(errorCode, HttpStatus.BAD_REQUEST, message);
    }
}
