package com.provote.backend.dto;

import java.util.Map;
import java.util.UUID;

public record PollResultsMessage(
    UUID pollId,
    int totalVotes,
    int uniqueVoters,
    Map<UUID, Integer> optionCounts
) {}
