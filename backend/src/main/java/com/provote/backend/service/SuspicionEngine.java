package com.provote.backend.service;

import com.provote.backend.config.IntegrityProperties;
import com.provote.backend.domain.FingerprintBlock;
import com.provote.backend.dto.ActivitySnapshot;
import com.provote.backend.dto.Verdict;
import com.provote.backend.dto.VoteTrace;
import com.provote.backend.exception.IntegrityCheckUnavailableException;
import com.provote.backend.repository.VoteRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Scores a cast attempt against the fingerprint's recent history.
 *
 * <p>The block registry and the vote history are authoritative: if either
 * cannot be read the check fails with {@link IntegrityCheckUnavailableException}
 * and the vote is not accepted. The activity cache is advisory; its signals can
 * raise the score but never block a vote by themselves.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SuspicionEngine {

    private final FingerprintBlockService blockService;
    private final FingerprintActivityCache activityCache;
    private final VoteRecordRepository voteRecordRepository;
    private final IntegrityProperties properties;
    private final Clock clock;

    public Verdict evaluate(String fingerprint, UUID pollId, UUID userId, String ipAddress) {
        if (fingerprint == null || fingerprint.isBlank()) {
            return Verdict.clean();
        }
        IntegrityProperties.Fingerprint cfg = properties.getFingerprint();

        // 1. Permanent blocks
        Optional<FingerprintBlock> block = authoritative("block registry", () -> blockService.isBlocked(fingerprint));
        if (block.isPresent()) {
            return Verdict.blocked("Fingerprint is permanently blocked: " + block.get().getReason());
        }

        // 2. Recent history, durable and cached
        List<VoteTrace> traces = recentTraces(fingerprint, pollId);
        Optional<ActivitySnapshot> cached = activityCache.read(fingerprint, pollId);

        Set<String> durableUsers = distinctUsers(traces, userId);
        Set<String> durableIps = distinctIps(traces, ipAddress);
        Set<String> allUsers = new HashSet<>(durableUsers);
        Set<String> allIps = new HashSet<>(durableIps);
        cached.ifPresent(snapshot -> {
            allUsers.addAll(snapshot.userIds());
            allIps.addAll(snapshot.ipAddresses());
        });

        // 3. Scoring
        List<String> reasons = new ArrayList<>();
        int score = 0;
        boolean hardBlock = false;

        if (allUsers.size() >= cfg.getDifferentUsersThreshold()) {
            score += cfg.getDifferentUsersScore();
            reasons.add("Fingerprint used by " + allUsers.size() + " different users");
            hardBlock = durableUsers.size() >= cfg.getDifferentUsersThreshold();
        }
        if (allIps.size() >= cfg.getDifferentIpsThreshold()) {
            score += cfg.getDifferentIpsScore();
            reasons.add("Fingerprint used from " + allIps.size() + " different IP addresses");
            hardBlock = hardBlock || durableIps.size() >= cfg.getDifferentIpsThreshold();
        }
        OptionalDouble velocity = velocityPerHour(traces);
        if (velocity.isPresent() && velocity.getAsDouble() > cfg.getVelocityPerHour()) {
            score += cfg.getVelocityScore();
            reasons.add(String.format(Locale.ROOT,
                    "Rapid voting detected: high frequency of %.1f votes/hour", velocity.getAsDouble()));
        }
        score = Math.min(score, 100);

        // cache-only signals are excluded from the threshold comparison
        int durableScore = durableScore(durableUsers.size(), durableIps.size(), velocity);
        boolean blockVote = hardBlock || durableScore >= cfg.getBlockScore();

        if (blockVote) {
            autoBlock(fingerprint, String.join("; ", reasons), traces, durableUsers.size(), pollId, userId);
        } else if (!reasons.isEmpty()) {
            log.info("Suspicious fingerprint {} on poll {} (risk {}): {}", fingerprint, pollId, score, reasons);
        }
        return new Verdict(!reasons.isEmpty(), blockVote, score, reasons);
    }

    /**
     * Only the "same fingerprint from several addresses" rule, with the same
     * blocking behaviour as {@link #evaluate}.
     */
    public Verdict checkIpCombination(String fingerprint, String ipAddress, UUID pollId) {
        if (fingerprint == null || fingerprint.isBlank()) {
            return Verdict.clean();
        }
        IntegrityProperties.Fingerprint cfg = properties.getFingerprint();
        List<VoteTrace> traces = recentTraces(fingerprint, pollId);
        Set<String> ips = distinctIps(traces, ipAddress);
        if (ips.size() < cfg.getDifferentIpsThreshold()) {
            return Verdict.clean();
        }
        String reason = "Fingerprint used from " + ips.size() + " different IP addresses";
        autoBlock(fingerprint, reason, traces, distinctUsers(traces, null).size(), pollId, null);
        return new Verdict(true, true, cfg.getDifferentIpsScore(), List.of(reason));
    }

    /**
     * Compares the fingerprint with those the same voter used recently: the same
     * user, or for anonymous votes the same address. Never blocks; a device
     * change is often legitimate.
     */
    public Verdict detectFingerprintChanges(String fingerprint, UUID userId, String ipAddress, UUID pollId) {
        if (fingerprint == null || fingerprint.isBlank()) {
            return Verdict.clean();
        }
        IntegrityProperties.Fingerprint cfg = properties.getFingerprint();
        LocalDateTime since = windowStart();

        List<VoteTrace> traces;
        if (userId != null) {
            traces = authoritative("vote history", () -> voteRecordRepository.findTracesByUser(userId, since));
        } else if (ipAddress != null) {
            traces = authoritative("vote history", () -> voteRecordRepository.findAnonymousTracesByIp(ipAddress, since));
        } else {
            return Verdict.clean();
        }

        Set<String> previous = new LinkedHashSet<>();
        traces.stream().map(VoteTrace::fingerprint).filter(Objects::nonNull).forEach(previous::add);
        if (previous.isEmpty()) {
            return Verdict.clean();
        }

        List<String> reasons = new ArrayList<>();
        int score = 0;
        if (!previous.contains(fingerprint)) {
            score += cfg.getFingerprintChangeScore();
            reasons.add("Fingerprint changed: " + previous.size() + " previous fingerprint(s) in the last "
                    + cfg.getWindowHours() + "h");
        }
        Set<String> distinct = new HashSet<>(previous);
        distinct.add(fingerprint);
        if (distinct.size() >= cfg.getRapidChangeThreshold()) {
            score += cfg.getRapidChangeScore();
            reasons.add("Rapid fingerprint changes: " + distinct.size() + " distinct fingerprints in the last "
                    + cfg.getWindowHours() + "h");
        }
        if (reasons.isEmpty()) {
            return Verdict.clean();
        }
        log.info("Fingerprint change for voter on poll {}: {}", pollId, reasons);
        return new Verdict(true, false, score, reasons);
    }

    private List<VoteTrace> recentTraces(String fingerprint, UUID pollId) {
        LocalDateTime since = windowStart();
        return authoritative("vote history",
                () -> voteRecordRepository.findTracesByFingerprint(fingerprint, pollId, since));
    }

    private LocalDateTime windowStart() {
        return LocalDateTime.now(clock).minusHours(properties.getFingerprint().getWindowHours());
    }

    private int durableScore(int users, int ips, OptionalDouble velocity) {
        IntegrityProperties.Fingerprint cfg = properties.getFingerprint();
        int score = 0;
        if (users >= cfg.getDifferentUsersThreshold()) score += cfg.getDifferentUsersScore();
        if (ips >= cfg.getDifferentIpsThreshold()) score += cfg.getDifferentIpsScore();
        if (velocity.isPresent() && velocity.getAsDouble() > cfg.getVelocityPerHour()) score += cfg.getVelocityScore();
        return score;
    }

    /**
     * Votes per hour over the traces; the span is floored so that two votes a
     * second apart do not produce an absurd rate.
     */
    OptionalDouble velocityPerHour(List<VoteTrace> traces) {
        if (traces.size() < 2) {
            return OptionalDouble.empty();
        }
        LocalDateTime first = traces.get(0).createdAt();
        LocalDateTime last = traces.get(traces.size() - 1).createdAt();
        Duration span = Duration.between(first, last);
        Duration floor = properties.getFingerprint().getMinimumVelocitySpan();
        if (span.compareTo(floor) < 0) {
            span = floor;
        }
        double hours = span.toMillis() / 3_600_000.0;
        return OptionalDouble.of(traces.size() / hours);
    }

    private static Set<String> distinctUsers(List<VoteTrace> traces, UUID current) {
        Set<String> users = new HashSet<>();
        traces.stream().map(VoteTrace::userId).filter(Objects::nonNull).map(UUID::toString).forEach(users::add);
        if (current != null) users.add(current.toString());
        return users;
    }

    private static Set<String> distinctIps(List<VoteTrace> traces, String current) {
        Set<String> ips = new HashSet<>();
        traces.stream().map(VoteTrace::ipAddress).filter(Objects::nonNull).forEach(ips::add);
        if (current != null) ips.add(current);
        return ips;
    }

    private void autoBlock(String fingerprint, String reason, List<VoteTrace> traces,
                           int totalUsers, UUID pollId, UUID triggeringUser) {
        UUID firstSeen = traces.stream().map(VoteTrace::userId).filter(Objects::nonNull).findFirst()
                .orElse(triggeringUser);
        try {
            blockService.autoBlock(fingerprint, reason, firstSeen, totalUsers, traces.size(), pollId, triggeringUser);
        } catch (DataIntegrityViolationException e) {
            // another cast blocked it first
            log.info("Fingerprint {} was blocked concurrently", fingerprint);
        } catch (DataAccessException e) {
            // the vote is rejected either way
            log.error("Could not persist automatic block for fingerprint {}", fingerprint, e);
        }
    }

    private <T> T authoritative(String source, Supplier<T> query) {
        try {
            return query.get();
        } catch (DataAccessException e) {
            log.error("Integrity check failed reading {}", source, e);
            throw new IntegrityCheckUnavailableException("Integrity check unavailable: " + source + " could not be read", e);
        }
    }
}
