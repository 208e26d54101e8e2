package com.provote.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.List;

@ResponseStatus(HttpStatus.FORBIDDEN)
public class FraudDetectedException extends VotingException {

    private final int riskScore;
    private final List<String> reasons;

    public FraudDetectedException(int riskScore, List<String> reasons) {
        super("FraudDetectedError", HttpStatus.FORBIDDEN,
                "Vote blocked due to suspicious activity: " + String.join(", ", reasons));
        this.riskScore = riskScore;
        this.reasons = List.copyOf(reasons);
    }

    public int getRiskScore() {
        return riskScore;
    }

    public List<String> getReasons() {
        return reasons;
    }
}
