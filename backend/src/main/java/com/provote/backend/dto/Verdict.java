package com.provote.backend.dto;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a suspicion check. The risk score is always within 0..100.
 */
public record Verdict(
    boolean suspicious,
    boolean blockVote,
    int riskScore,
    List<String> reasons
) {
    public Verdict {
        riskScore = Math.max(0, Math.min(100, riskScore));
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }

    public static Verdict clean() {
        return new Verdict(false, false, 0, List.of());
    }

    public static Verdict blocked(String reason) {
        return new Verdict(true, true, 100, List.of(reason));
    }

    /**
     * Adds the signals of another check; scores add up and are capped.
     */
    public Verdict combine(Verdict other) {
        List<String> merged = new ArrayList<>(reasons);
        other.reasons().stream().filter(r -> !merged.contains(r)).forEach(merged::add);
        return new Verdict(suspicious || other.suspicious(), blockVote || other.blockVote(),
                riskScore + other.riskScore(), merged);
    }
}
