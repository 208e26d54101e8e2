package com.provote.backend.dto;

import jakarta.validation.constraints.NotNull;
import java.util.UUID;

public record VoteRequest(
    @NotNull UUID pollId,
    @NotNull UUID optionId,
    String idempotencyKey // optional, derived when absent
) {}
