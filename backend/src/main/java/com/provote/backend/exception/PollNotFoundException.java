package com.provote.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class PollNotFoundException extends VotingException {
    public PollNotFoundException(String message) {
        super("PollNotFoundError", HttpStatus.NOT_FOUND, message);
    }
}
