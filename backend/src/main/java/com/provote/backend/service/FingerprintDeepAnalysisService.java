package com.provote.backend.service;

import com.provote.backend.config.IntegrityProperties;
import com.provote.backend.dto.FingerprintAnalysis;
import com.provote.backend.dto.VoteTrace;
import com.provote.backend.repository.VoteRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Slower look at a fingerprint over a longer window, run after a vote commits.
 * The summary is written next to the activity entry for admin tooling.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FingerprintDeepAnalysisService {

    private final VoteRecordRepository voteRecordRepository;
    private final FingerprintActivityCache activityCache;
    private final IntegrityProperties properties;
    private final Clock clock;

    @Async
    public void analyzeAsync(String fingerprint, UUID pollId) {
        try {
            analyze(fingerprint, pollId);
        } catch (RuntimeException e) {
            log.error("Deep analysis failed for fingerprint {} on poll {}", fingerprint, pollId, e);
        }
    }

    public FingerprintAnalysis analyze(String fingerprint, UUID pollId) {
        IntegrityProperties.Fingerprint cfg = properties.getFingerprint();
        LocalDateTime now = LocalDateTime.now(clock);
        List<VoteTrace> traces = voteRecordRepository.findTracesByFingerprint(
                fingerprint, pollId, now.minusHours(cfg.getDeepAnalysisWindowHours()));

        int users = (int) traces.stream().map(VoteTrace::userId).filter(Objects::nonNull).distinct().count();
        int ips = (int) traces.stream().map(VoteTrace::ipAddress).filter(Objects::nonNull).distinct().count();

        List<String> riskFactors = new ArrayList<>();
        int score = 0;
        if (users >= cfg.getDifferentUsersThreshold()) {
            score += cfg.getDifferentUsersScore();
            riskFactors.add("Used by " + users + " different users");
        }
        if (ips >= cfg.getDifferentIpsThreshold()) {
            score += cfg.getDifferentIpsScore();
            riskFactors.add("Used from " + ips + " different IP addresses");
        }
        if (traces.size() >= 2) {
            Duration span = Duration.between(traces.get(0).createdAt(), traces.get(traces.size() - 1).createdAt());
            Duration floor = cfg.getMinimumVelocitySpan();
            double hours = (span.compareTo(floor) < 0 ? floor : span).toMillis() / 3_600_000.0;
            if (traces.size() / hours > cfg.getVelocityPerHour()) {
                score += cfg.getVelocityScore();
                riskFactors.add("Sustained high vote frequency");
            }
        }
        score = Math.min(score, 100);

        FingerprintAnalysis analysis = new FingerprintAnalysis(traces.size(), users, ips, riskFactors, score, now);
        activityCache.recordAnalysis(fingerprint, pollId, analysis);

        if (score >= cfg.getDeepAnalysisWarnScore()) {
            log.warn("High-risk fingerprint {} on poll {} (risk {}): {}", fingerprint, pollId, score, riskFactors);
        }
        return analysis;
    }
}
