package com.provote.backend.dto;

import com.provote.backend.domain.VoteRecord;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

public record VoteResponse(
    UUID id,
    UUID pollId,
    UUID optionId,
    UUID userId,
    String voterToken,
    String idempotencyKey,
    boolean isValid,
    int riskScore,
    List<String> fraudReasons,
    LocalDateTime createdAt,
    boolean isNew
) {
    public static VoteResponse from(CastResult result) {
        VoteRecord vote = result.vote();
        return new VoteResponse(vote.getId(), vote.getPollId(), vote.getOptionId(), vote.getUserId(),
                vote.getVoterToken(), vote.getIdempotencyKey(), Boolean.TRUE.equals(vote.getIsValid()),
                vote.getRiskScore() == null ? 0 : vote.getRiskScore(),
                vote.getFraudReasons() == null ? List.of() : List.copyOf(vote.getFraudReasons()),
                vote.getCreatedAt(), result.isNew());
    }
}
