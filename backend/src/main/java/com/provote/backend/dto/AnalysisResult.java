package com.provote.backend.dto;

import java.time.LocalDateTime;
import java.util.List;

public record AnalysisResult(
    int pollsAnalyzed,
    List<DetectedPattern> patternsDetected,
    int highestRiskScore,
    int alertsGenerated,
    int votesFlagged,
    LocalDateTime windowStart,
    LocalDateTime windowEnd
) {
    public AnalysisResult {
        patternsDetected = List.copyOf(patternsDetected);
    }

    public int totalSuspiciousPatterns() {
        return patternsDetected.size();
    }
}
