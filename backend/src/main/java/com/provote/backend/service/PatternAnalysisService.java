package com.provote.backend.service;

import com.provote.backend.config.IntegrityProperties;
import com.provote.backend.domain.FraudAlert;
import com.provote.backend.domain.Poll;
import com.provote.backend.domain.VoteRecord;
import com.provote.backend.domain.enums.PatternType;
import com.provote.backend.dto.AnalysisResult;
import com.provote.backend.dto.DetectedPattern;
import com.provote.backend.event.VoteFlaggedEvent;
import com.provote.backend.repository.FraudAlertRepository;
import com.provote.backend.repository.PollRepository;
import com.provote.backend.repository.VoteRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Looks for coordinated voting over a poll's recent votes, raises alerts and
 * retroactively invalidates the votes involved.
 *
 * <p>Detection reads a snapshot; flagging re-reads each vote in its own short
 * transaction and relies on the vote's version column, so concurrent casts
 * are never blocked by a running analysis.
 */
@Slf4j
@Service
public class PatternAnalysisService {

    private static final int FLAG_ATTEMPTS = 2;

    private final PollRepository pollRepository;
    private final VoteRecordRepository voteRecordRepository;
    private final FraudAlertRepository fraudAlertRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final IntegrityProperties properties;
    private final Clock clock;
    private final TransactionTemplate readOnlyTransaction;
    private final TransactionTemplate writeTransaction;

    public PatternAnalysisService(PollRepository pollRepository,
                                  VoteRecordRepository voteRecordRepository,
                                  FraudAlertRepository fraudAlertRepository,
                                  ApplicationEventPublisher eventPublisher,
                                  IntegrityProperties properties,
                                  Clock clock,
                                  PlatformTransactionManager transactionManager) {
        this.pollRepository = pollRepository;
        this.voteRecordRepository = voteRecordRepository;
        this.fraudAlertRepository = fraudAlertRepository;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
        this.clock = clock;
        this.readOnlyTransaction = new TransactionTemplate(transactionManager);
        this.readOnlyTransaction.setReadOnly(true);
        this.writeTransaction = new TransactionTemplate(transactionManager);
    }

    public AnalysisResult analyze(UUID pollId) {
        return analyze(pollId, properties.getPatternAnalysis().getWindowHours());
    }

    /**
     * Detects, alerts and flags over one poll, or over every active poll when
     * pollId is null. A poll that fails is logged and skipped.
     */
    public AnalysisResult analyze(UUID pollId, int windowHours) {
        LocalDateTime windowEnd = LocalDateTime.now(clock);
        LocalDateTime windowStart = windowEnd.minusHours(windowHours);

        List<UUID> pollIds = pollId != null
                ? List.of(pollId)
                : pollRepository.findByIsActiveTrueAndIsDraftFalse().stream().map(Poll::getId).collect(Collectors.toList());

        List<DetectedPattern> allPatterns = new ArrayList<>();
        int analyzed = 0;
        int alerts = 0;
        int flagged = 0;
        for (UUID id : pollIds) {
            try {
                List<DetectedPattern> patterns = detectPatterns(id, windowStart);
                alerts += generateAlerts(id, patterns).size();
                flagged += flagSuspiciousVotes(id, patterns);
                allPatterns.addAll(patterns);
                analyzed++;
            } catch (RuntimeException e) {
                if (pollId != null) {
                    throw e;
                }
                log.error("Pattern analysis failed for poll {}, skipping", id, e);
            }
        }

        int highest = allPatterns.stream().mapToInt(DetectedPattern::riskScore).max().orElse(0);
        log.info("Pattern analysis over {} poll(s): {} pattern(s), {} alert(s), {} vote(s) flagged, highest risk {}",
                analyzed, allPatterns.size(), alerts, flagged, highest);
        return new AnalysisResult(analyzed, allPatterns, highest, alerts, flagged, windowStart, windowEnd);
    }

    @Scheduled(cron = "${provote.integrity.pattern-analysis.cron:0 0 * * * *}")
    public void runPeriodicAnalysis() {
        if (!properties.getPatternAnalysis().isEnabled()) {
            return;
        }
        log.info("Starting scheduled pattern analysis");
        analyze(null);
    }

    public List<DetectedPattern> detectPatterns(UUID pollId, LocalDateTime since) {
        List<VoteRecord> votes = readOnlyTransaction.execute(status ->
                voteRecordRepository.findByPollIdAndCreatedAtGreaterThanEqualOrderByCreatedAtAsc(pollId, since));
        if (votes == null || votes.isEmpty()) {
            return List.of();
        }
        List<DetectedPattern> patterns = new ArrayList<>();
        patterns.addAll(detectBursts(pollId, votes));
        patterns.addAll(detectIpClusters(pollId, votes));
        patterns.addAll(detectFingerprintReuse(pollId, votes));
        patterns.sort(Comparator.comparingInt(DetectedPattern::riskScore).reversed());
        return patterns;
    }

    /**
     * Persists one alert per pattern at or above the alert threshold. The
     * (poll, signature) pair is unique, so re-runs do not duplicate alerts.
     */
    public List<FraudAlert> generateAlerts(UUID pollId, List<DetectedPattern> patterns) {
        int threshold = properties.getPatternAnalysis().getAlertThreshold();
        Set<String> seen = new HashSet<>();
        List<FraudAlert> created = new ArrayList<>();
        for (DetectedPattern pattern : patterns) {
            if (!pollId.equals(pattern.pollId()) || pattern.riskScore() < threshold || !seen.add(pattern.signature())) {
                continue;
            }
            try {
                FraudAlert alert = writeTransaction.execute(status -> createAlert(pattern));
                if (alert != null) {
                    created.add(alert);
                }
            } catch (DataIntegrityViolationException e) {
                log.debug("Alert {} on poll {} already raised by a concurrent run", pattern.signature(), pollId);
            }
        }
        return created;
    }

    /**
     * Marks the votes behind high-risk patterns invalid. Returns how many votes
     * matched, whether or not they had already been flagged by an earlier run.
     */
    public int flagSuspiciousVotes(UUID pollId, List<DetectedPattern> patterns) {
        int threshold = properties.getPatternAnalysis().getFlagThreshold();
        Map<UUID, List<DetectedPattern>> byVote = new LinkedHashMap<>();
        for (DetectedPattern pattern : patterns) {
            if (!pollId.equals(pattern.pollId()) || pattern.riskScore() < threshold) {
                continue;
            }
            for (UUID voteId : pattern.voteIds()) {
                byVote.computeIfAbsent(voteId, id -> new ArrayList<>()).add(pattern);
            }
        }

        int matched = 0;
        for (Map.Entry<UUID, List<DetectedPattern>> entry : byVote.entrySet()) {
            if (flagVote(entry.getKey(), entry.getValue())) {
                matched++;
            }
        }
        return matched;
    }

    private FraudAlert createAlert(DetectedPattern pattern) {
        if (fraudAlertRepository.existsByPollIdAndPatternSignature(pattern.pollId(), pattern.signature())) {
            return null;
        }
        FraudAlert alert = new FraudAlert();
        alert.setPollId(pattern.pollId());
        alert.setPatternType(pattern.type());
        alert.setPatternSignature(pattern.signature());
        alert.setRiskScore(pattern.riskScore());
        alert.setReasons(String.join(", ", pattern.reasons()));
        alert.setIpAddress(pattern.ipAddress());
        if (pattern.voteIds().size() == 1) {
            alert.setVoteId(pattern.voteIds().iterator().next());
        }
        alert.setCreatedAt(LocalDateTime.now(clock));
        FraudAlert saved = fraudAlertRepository.saveAndFlush(alert);
        log.warn("Fraud alert on poll {}: {} (risk {})", pattern.pollId(), pattern.signature(), pattern.riskScore());
        return saved;
    }

    private boolean flagVote(UUID voteId, List<DetectedPattern> patterns) {
        for (int attempt = 1; attempt <= FLAG_ATTEMPTS; attempt++) {
            try {
                Boolean result = writeTransaction.execute(status -> applyFlag(voteId, patterns));
                return Boolean.TRUE.equals(result);
            } catch (ObjectOptimisticLockingFailureException e) {
                log.debug("Vote {} changed while flagging, attempt {}", voteId, attempt);
            }
        }
        log.warn("Gave up flagging vote {} after concurrent updates", voteId);
        return false;
    }

    // One reason per signature; a grown cluster refreshes its text in place
    private static boolean putReason(List<String> reasons, DetectedPattern pattern) {
        String reason = pattern.flagReason();
        String prefix = pattern.flagReasonPrefix();
        for (int i = 0; i < reasons.size(); i++) {
            if (reasons.get(i).startsWith(prefix)) {
                if (reasons.get(i).equals(reason)) {
                    return false;
                }
                reasons.set(i, reason);
                return true;
            }
        }
        reasons.add(reason);
        return true;
    }

    private Boolean applyFlag(UUID voteId, List<DetectedPattern> patterns) {
        VoteRecord vote = voteRecordRepository.findById(voteId).orElse(null);
        if (vote == null) {
            return false;
        }
        List<DetectedPattern> stillMatching = patterns.stream().filter(p -> p.matches(vote)).collect(Collectors.toList());
        if (stillMatching.isEmpty()) {
            return false;
        }

        List<String> reasons = vote.getFraudReasons() == null ? new ArrayList<>() : new ArrayList<>(vote.getFraudReasons());
        boolean changed = false;
        for (DetectedPattern pattern : stillMatching) {
            changed |= putReason(reasons, pattern);
        }
        int maxRisk = stillMatching.stream().mapToInt(DetectedPattern::riskScore).max().orElse(0);
        int currentRisk = vote.getRiskScore() == null ? 0 : vote.getRiskScore();
        boolean newlyInvalid = Boolean.TRUE.equals(vote.getIsValid());

        if (maxRisk > currentRisk) {
            vote.setRiskScore(maxRisk);
            changed = true;
        }
        if (newlyInvalid) {
            vote.setIsValid(false);
            changed = true;
        }
        if (changed) {
            vote.setFraudReasons(reasons);
            voteRecordRepository.saveAndFlush(vote);
        }
        if (newlyInvalid) {
            eventPublisher.publishEvent(new VoteFlaggedEvent(vote.getId(), vote.getUserId(), vote.getPollId(), reasons));
        }
        return true;
    }

    // ---------------------------------------------------------------------
    // Detectors
    // ---------------------------------------------------------------------

    private List<DetectedPattern> detectBursts(UUID pollId, List<VoteRecord> votes) {
        IntegrityProperties.PatternAnalysis cfg = properties.getPatternAnalysis();
        long bucketSeconds = Math.max(1, cfg.getBurstBucket().getSeconds());

        Map<Long, List<VoteRecord>> buckets = new TreeMap<>();
        for (VoteRecord vote : votes) {
            long bucket = Math.floorDiv(vote.getCreatedAt().toEpochSecond(ZoneOffset.UTC), bucketSeconds);
            buckets.computeIfAbsent(bucket, b -> new ArrayList<>()).add(vote);
        }

        List<DetectedPattern> patterns = new ArrayList<>();
        for (Map.Entry<Long, List<VoteRecord>> entry : buckets.entrySet()) {
            List<VoteRecord> bucketVotes = entry.getValue();
            if (bucketVotes.size() < cfg.getBurstThreshold()) {
                continue;
            }
            LocalDateTime start = LocalDateTime.ofEpochSecond(entry.getKey() * bucketSeconds, 0, ZoneOffset.UTC);
            LocalDateTime end = start.plus(Duration.ofSeconds(bucketSeconds));
            Set<UUID> ids = bucketVotes.stream().map(VoteRecord::getId).collect(Collectors.toSet());

            patterns.add(new DetectedPattern(pollId, PatternType.VOTE_BURST,
                    "VOTE_BURST:" + start,
                    cfg.getBurstScore(),
                    List.of(bucketVotes.size() + " votes within " + bucketSeconds + "s starting " + start),
                    ids, distinctVoters(bucketVotes), null, null, null, start, end));

            detectOptionSurge(pollId, bucketVotes, start, end).ifPresent(patterns::add);
        }
        return patterns;
    }

    private Optional<DetectedPattern> detectOptionSurge(UUID pollId, List<VoteRecord> bucketVotes,
                                                                  LocalDateTime start, LocalDateTime end) {
        IntegrityProperties.PatternAnalysis cfg = properties.getPatternAnalysis();
        Map<UUID, List<VoteRecord>> byOption = bucketVotes.stream()
                .collect(Collectors.groupingBy(VoteRecord::getOptionId));
        for (Map.Entry<UUID, List<VoteRecord>> entry : byOption.entrySet()) {
            List<VoteRecord> optionVotes = entry.getValue();
            int percent = optionVotes.size() * 100 / bucketVotes.size();
            if (percent >= cfg.getOptionSurgePercent()) {
                Set<UUID> ids = optionVotes.stream().map(VoteRecord::getId).collect(Collectors.toSet());
                return Optional.of(new DetectedPattern(pollId, PatternType.OPTION_SURGE,
                        "OPTION_SURGE:" + start + ":" + entry.getKey(),
                        cfg.getOptionSurgeScore(),
                        List.of(percent + "% of a " + bucketVotes.size() + "-vote burst went to option " + entry.getKey()),
                        ids, distinctVoters(optionVotes), null, null, entry.getKey(), start, end));
            }
        }
        return Optional.empty();
    }

    private List<DetectedPattern> detectIpClusters(UUID pollId, List<VoteRecord> votes) {
        IntegrityProperties.PatternAnalysis cfg = properties.getPatternAnalysis();
        Map<String, List<VoteRecord>> byIp = votes.stream()
                .filter(v -> v.getIpAddress() != null)
                .collect(Collectors.groupingBy(VoteRecord::getIpAddress, TreeMap::new, Collectors.toList()));

        List<DetectedPattern> patterns = new ArrayList<>();
        byIp.forEach((ip, ipVotes) -> {
            int voters = distinctVoters(ipVotes);
            if (voters >= cfg.getIpClusterThreshold()) {
                Set<UUID> ids = ipVotes.stream().map(VoteRecord::getId).collect(Collectors.toSet());
                patterns.add(new DetectedPattern(pollId, PatternType.IP_CLUSTER, "IP_CLUSTER:" + ip,
                        cfg.getIpClusterScore(),
                        List.of(voters + " different voters from IP " + ip),
                        ids, voters, ip, null, null, null, null));
            }
        });
        return patterns;
    }

    private List<DetectedPattern> detectFingerprintReuse(UUID pollId, List<VoteRecord> votes) {
        IntegrityProperties.PatternAnalysis cfg = properties.getPatternAnalysis();
        Map<String, List<VoteRecord>> byFingerprint = votes.stream()
                .filter(v -> v.getFingerprint() != null && !v.getFingerprint().isBlank())
                .collect(Collectors.groupingBy(VoteRecord::getFingerprint, TreeMap::new, Collectors.toList()));

        List<DetectedPattern> patterns = new ArrayList<>();
        byFingerprint.forEach((fp, fpVotes) -> {
            int voters = distinctVoters(fpVotes);
            if (voters >= cfg.getFingerprintClusterThreshold()) {
                Set<UUID> ids = fpVotes.stream().map(VoteRecord::getId).collect(Collectors.toSet());
                patterns.add(new DetectedPattern(pollId, PatternType.FINGERPRINT_REUSE, "FINGERPRINT_REUSE:" + fp,
                        cfg.getFingerprintReuseScore(),
                        List.of("Fingerprint shared by " + voters + " different voters"),
                        ids, voters, null, fp, null, null, null));
            }
        });
        return patterns;
    }

    // Authenticated voters count by user id, anonymous ones by voter token
    private static int distinctVoters(List<VoteRecord> votes) {
        return (int) votes.stream()
                .map(v -> v.getUserId() != null ? "user:" + v.getUserId() : "token:" + v.getVoterToken())
                .distinct()
                .count();
    }
}
