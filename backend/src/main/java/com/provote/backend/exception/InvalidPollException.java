package com.provote.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidPollException extends VotingException {
    public InvalidPollException(String message) {
        super("InvalidPollError", HttpStatus.BAD_REQUEST, message);
    }
}
