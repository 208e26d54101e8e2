package com.provote.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class PollClosedException extends VotingException {
    public PollClosedException(String message) {
        super("PollClosedError", HttpStatus.BAD_REQUEST, message);
    }
}
