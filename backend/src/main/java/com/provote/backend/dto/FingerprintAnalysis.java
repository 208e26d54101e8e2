package com.provote.backend.dto;

import java.time.LocalDateTime;
import java.util.List;

public record FingerprintAnalysis(
    int historicalVoteCount,
    int historicalUserCount,
    int historicalIpCount,
    List<String> riskFactors,
    int riskScore,
    LocalDateTime analyzedAt
) {}
