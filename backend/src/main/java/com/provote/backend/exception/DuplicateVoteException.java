package com.provote.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class DuplicateVoteException extends VotingException {
    public DuplicateVoteException(String message) {
        super("DuplicateVoteError", HttpStatus.CONFLICT, message);
    }
}
