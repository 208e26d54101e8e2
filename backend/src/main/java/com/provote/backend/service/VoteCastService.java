package com.provote.backend.service;

import com.provote.backend.config.IntegrityProperties;
import com.provote.backend.core.request.FingerprintExtractor;
import com.provote.backend.domain.Poll;
import com.provote.backend.domain.PollOption;
import com.provote.backend.domain.VoteAttempt;
import com.provote.backend.domain.VoteRecord;
import com.provote.backend.dto.CastResult;
import com.provote.backend.dto.CastVoteCommand;
import com.provote.backend.dto.IdempotencyCheck;
import com.provote.backend.dto.RequestMetadata;
import com.provote.backend.dto.Verdict;
import com.provote.backend.event.VoteCastEvent;
import com.provote.backend.exception.DuplicateVoteException;
import com.provote.backend.exception.FraudDetectedException;
import com.provote.backend.exception.InvalidPollException;
import com.provote.backend.exception.InvalidVoteException;
import com.provote.backend.exception.PollClosedException;
import com.provote.backend.exception.PollNotFoundException;
import com.provote.backend.exception.VotingException;
import com.provote.backend.repository.PollOptionRepository;
import com.provote.backend.repository.PollRepository;
import com.provote.backend.repository.VoteRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for casting a vote. Validation, replay detection, the suspicion
 * checks and the insert with its counter updates share one transaction.
 */
@Slf4j
@Service
public class VoteCastService {

    // column widths of vote_records / vote_attempts
    private static final int MAX_IP_LENGTH = 45;
    private static final int MAX_AUDIT_FINGERPRINT_LENGTH = 128;
    private static final int MAX_AUDIT_KEY_LENGTH = 128;
    private static final int MAX_ERROR_CODE_LENGTH = 255;

    private final PollRepository pollRepository;
    private final PollOptionRepository pollOptionRepository;
    private final VoteRecordRepository voteRecordRepository;
    private final IdempotencyService idempotencyService;
    private final VoterIdentityService voterIdentityService;
    private final FingerprintExtractor fingerprintExtractor;
    private final SuspicionEngine suspicionEngine;
    private final VoteAttemptService voteAttemptService;
    private final ApplicationEventPublisher eventPublisher;
    private final IntegrityProperties properties;
    private final Clock clock;
    private final TransactionTemplate castTransaction;

    public VoteCastService(PollRepository pollRepository,
                           PollOptionRepository pollOptionRepository,
                           VoteRecordRepository voteRecordRepository,
                           IdempotencyService idempotencyService,
                           VoterIdentityService voterIdentityService,
                           FingerprintExtractor fingerprintExtractor,
                           SuspicionEngine suspicionEngine,
                           VoteAttemptService voteAttemptService,
                           ApplicationEventPublisher eventPublisher,
                           IntegrityProperties properties,
                           Clock clock,
                           PlatformTransactionManager transactionManager) {
        this.pollRepository = pollRepository;
        this.pollOptionRepository = pollOptionRepository;
        this.voteRecordRepository = voteRecordRepository;
        this.idempotencyService = idempotencyService;
        this.voterIdentityService = voterIdentityService;
        this.fingerprintExtractor = fingerprintExtractor;
        this.suspicionEngine = suspicionEngine;
        this.voteAttemptService = voteAttemptService;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
        this.clock = clock;
        this.castTransaction = new TransactionTemplate(transactionManager);
        this.castTransaction.setTimeout(properties.getCast().getTimeoutSeconds());
    }

    public CastResult castVote(CastVoteCommand request) {
        CastVoteCommand command = normalize(request);
        CastContext ctx = new CastContext(command);
        try {
            CastResult result = castWithConflictRetry(ctx);
            recordAttempt(ctx, result.vote().getId(), null, null);
            return result;
        } catch (VotingException e) {
            log.warn("Vote rejected on poll {} ({}): {}", command.pollId(), e.getErrorCode(), e.getMessage());
            recordAttempt(ctx, null, e.getErrorCode(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Unexpected failure casting vote on poll {}", command.pollId(), e);
            recordAttempt(ctx, null, "InternalServerError", e.getMessage());
            throw e;
        }
    }

    private CastResult castWithConflictRetry(CastContext ctx) {
        int attempts = properties.getCast().getConflictRetries() + 1;
        for (int attempt = 1; ; attempt++) {
            try {
                return castTransaction.execute(status -> castInTransaction(ctx));
            } catch (DataIntegrityViolationException e) {
                if (attempt >= attempts) {
                    throw e;
                }
                // a concurrent cast won the unique constraint; the retry sees its row
                log.info("Unique constraint conflict on poll {}, retrying cast", ctx.command.pollId());
            }
        }
    }

    private CastResult castInTransaction(CastContext ctx) {
        CastVoteCommand command = ctx.command;
        RequestMetadata meta = command.metadata();
        UUID pollId = command.pollId();
        UUID userId = command.userId();
        LocalDateTime now = LocalDateTime.now(clock);

        // 1. Poll and option
        Poll poll = pollRepository.findById(pollId)
                .orElseThrow(() -> new PollNotFoundException("Poll " + pollId + " not found"));
        validatePollOpen(poll, now);
        PollOption option = pollOptionRepository.findById(command.optionId())
                .filter(o -> pollId.equals(o.getPollId()))
                .orElseThrow(() -> new InvalidVoteException(
                        "Option " + command.optionId() + " does not belong to poll " + pollId));

        // 2. Identity
        fingerprintExtractor.requireFingerprintForAnonymous(userId, meta.fingerprint());
        String voterToken = voterIdentityService.tokenFor(userId, meta.ipAddress(), meta.userAgent(), meta.fingerprint());
        String key = resolveKey(command.idempotencyKey(), userId, voterToken, pollId, option.getId());
        ctx.voterToken = voterToken;
        ctx.idempotencyKey = key;

        // 3. Replay
        Optional<VoteRecord> replay = findReplay(key, pollId, option.getId(), voterToken);
        if (replay.isPresent()) {
            log.info("Replayed cast {} on poll {}", replay.get().getId(), pollId);
            ctx.riskScore = replay.get().getRiskScore();
            return new CastResult(replay.get(), false);
        }

        // 4. One vote per authenticated user
        if (userId != null && voteRecordRepository.existsByPollIdAndUserId(pollId, userId)) {
            throw new DuplicateVoteException("User " + userId + " has already voted on poll " + pollId);
        }

        // 5. Suspicion
        Verdict verdict = suspicionEngine.evaluate(meta.fingerprint(), pollId, userId, meta.ipAddress());
        ctx.riskScore = verdict.riskScore();
        if (verdict.blockVote()) {
            throw new FraudDetectedException(verdict.riskScore(), verdict.reasons());
        }
        verdict = verdict.combine(
                suspicionEngine.detectFingerprintChanges(meta.fingerprint(), userId, meta.ipAddress(), pollId));
        ctx.riskScore = verdict.riskScore();

        // 6. Persist and count
        boolean firstForVoter = !voteRecordRepository.existsByPollIdAndVoterToken(pollId, voterToken);

        VoteRecord vote = new VoteRecord();
        vote.setPollId(pollId);
        vote.setOptionId(option.getId());
        vote.setUserId(userId);
        vote.setVoterToken(voterToken);
        vote.setFingerprint(meta.fingerprint());
        vote.setIpAddress(meta.ipAddress());
        vote.setUserAgent(meta.userAgent());
        vote.setIdempotencyKey(key);
        vote.setIsValid(true);
        vote.setRiskScore(verdict.riskScore());
        vote.setFraudReasons(new ArrayList<>(verdict.reasons()));
        vote.setCreatedAt(now);
        vote = voteRecordRepository.saveAndFlush(vote);

        pollOptionRepository.incrementVoteCount(option.getId());
        pollRepository.incrementTotalVotes(pollId);
        if (firstForVoter) {
            pollRepository.incrementUniqueVoters(pollId);
        }

        eventPublisher.publishEvent(new VoteCastEvent(vote.getId(), pollId, option.getId(), userId,
                meta.fingerprint(), meta.ipAddress(), key));
        log.info("Vote {} accepted on poll {} (risk {})", vote.getId(), pollId, verdict.riskScore());
        return new CastResult(vote, true);
    }

    private void validatePollOpen(Poll poll, LocalDateTime now) {
        if (Boolean.TRUE.equals(poll.getIsDraft())) {
            throw new InvalidPollException("Poll " + poll.getId() + " is a draft and cannot receive votes");
        }
        if (!Boolean.TRUE.equals(poll.getIsActive())) {
            throw new PollClosedException("Poll " + poll.getId() + " is not active");
        }
        if (!poll.hasStarted(now)) {
            throw new PollClosedException("Poll " + poll.getId() + " has not started yet");
        }
        if (poll.isExpired(now)) {
            throw new PollClosedException("Poll " + poll.getId() + " has expired");
        }
    }

    private String resolveKey(String supplied, UUID userId, String voterToken, UUID pollId, UUID optionId) {
        if (idempotencyService.isValidKey(supplied)) {
            return supplied.toLowerCase();
        }
        if (supplied != null && !supplied.isBlank()) {
            log.debug("Ignoring malformed idempotency key on poll {}", pollId);
        }
        String voterId = userId != null ? userId.toString() : voterToken;
        return idempotencyService.deriveKey(voterId, pollId, optionId);
    }

    private Optional<VoteRecord> findReplay(String key, UUID pollId, UUID optionId, String voterToken) {
        Optional<VoteRecord> existing = Optional.empty();
        IdempotencyCheck cached = idempotencyService.check(key);
        if (cached.duplicate()) {
            existing = parseUuid(cached.cachedResult())
                    .flatMap(voteRecordRepository::findById)
                    .filter(v -> key.equals(v.getIdempotencyKey()));
        }
        if (existing.isEmpty()) {
            existing = idempotencyService.checkDuplicateByKey(key).flatMap(voteRecordRepository::findById);
        }
        if (existing.isPresent()) {
            VoteRecord vote = existing.get();
            if (!pollId.equals(vote.getPollId())
                    || !optionId.equals(vote.getOptionId())
                    || !Objects.equals(voterToken, vote.getVoterToken())) {
                throw new InvalidVoteException("Idempotency key was already used for a different vote");
            }
        }
        return existing;
    }

    private static Optional<UUID> parseUuid(String value) {
        try {
            return Optional.of(UUID.fromString(value));
        } catch (IllegalArgumentException | NullPointerException e) {
            return Optional.empty();
        }
    }

    private void recordAttempt(CastContext ctx, UUID voteId, String errorCode, String errorMessage) {
        CastVoteCommand command = ctx.command;
        VoteAttempt attempt = new VoteAttempt();
        attempt.setPollId(command.pollId());
        attempt.setOptionId(command.optionId());
        attempt.setUserId(command.userId());
        attempt.setVoteId(voteId);
        attempt.setVoterToken(ctx.voterToken);
        attempt.setFingerprint(truncate(command.metadata().fingerprint(), MAX_AUDIT_FINGERPRINT_LENGTH));
        attempt.setIpAddress(command.metadata().ipAddress());
        attempt.setUserAgent(command.metadata().userAgent());
        attempt.setIdempotencyKey(truncate(ctx.idempotencyKey != null ? ctx.idempotencyKey : command.idempotencyKey(),
                MAX_AUDIT_KEY_LENGTH));
        attempt.setSuccess(voteId != null);
        attempt.setErrorCode(truncate(errorCode, MAX_ERROR_CODE_LENGTH));
        attempt.setErrorMessage(errorMessage);
        attempt.setRiskScore(ctx.riskScore);
        attempt.setCreatedAt(LocalDateTime.now(clock));
        try {
            voteAttemptService.record(attempt);
        } catch (RuntimeException e) {
            // the cast outcome stands without its audit row
            log.error("Could not record vote attempt on poll {} (success={})",
                    command.pollId(), attempt.getSuccess(), e);
        }
    }

    // Header values are client controlled; the address is cut to what a column holds
    private static CastVoteCommand normalize(CastVoteCommand command) {
        RequestMetadata meta = command.metadata();
        String ip = meta.ipAddress() == null ? null : truncate(meta.ipAddress().trim(), MAX_IP_LENGTH);
        if (Objects.equals(ip, meta.ipAddress())) {
            return command;
        }
        return new CastVoteCommand(command.userId(), command.pollId(), command.optionId(), command.idempotencyKey(),
                new RequestMetadata(ip, meta.userAgent(), meta.fingerprint()));
    }

    private static String truncate(String value, int max) {
        return value == null || value.length() <= max ? value : value.substring(0, max);
    }

    // Mutable facts gathered while casting, kept for the audit row
    private static final class CastContext {
        private final CastVoteCommand command;
        private String voterToken;
        private String idempotencyKey;
        private Integer riskScore;

        private CastContext(CastVoteCommand command) {
            this.command = command;
        }
    }
}
