package com.provote.backend.service;

import com.provote.backend.config.IntegrityProperties;
import com.provote.backend.domain.FingerprintBlock;
import com.provote.backend.domain.FingerprintBlockEvent;
import com.provote.backend.domain.enums.BlockAction;
import com.provote.backend.dto.VoteTrace;
import com.provote.backend.event.VoteFlaggedEvent;
import com.provote.backend.repository.FingerprintBlockEventRepository;
import com.provote.backend.repository.FingerprintBlockRepository;
import com.provote.backend.repository.VoteRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Registry of permanently blocked fingerprints. Writes run in their own
 * transaction so a block outlives the rollback of the cast that triggered it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FingerprintBlockService {

    private final FingerprintBlockRepository blockRepository;
    private final FingerprintBlockEventRepository eventRepository;
    private final VoteRecordRepository voteRecordRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final IntegrityProperties properties;
    private final Clock clock;

    @Transactional(readOnly = true)
    public Optional<FingerprintBlock> isBlocked(String fingerprint) {
        if (fingerprint == null || fingerprint.isBlank()) {
            return Optional.empty();
        }
        return blockRepository.findByFingerprintAndIsActiveTrue(fingerprint);
    }

    /**
     * Creates the block or reactivates the existing row. A concurrent insert of
     * the same fingerprint surfaces as DataIntegrityViolationException; callers
     * resolve it with {@link #isBlocked(String)}.
     *
     * @param blockedBy admin id, or null for an automatic block
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public FingerprintBlock block(String fingerprint, String reason, UUID firstSeenUser,
                                  int totalUsers, int totalVotes, UUID blockedBy) {
        return doBlock(fingerprint, reason, firstSeenUser, totalUsers, totalVotes, blockedBy);
    }

    /**
     * Admin block. The first-seen user and the totals are taken from the
     * fingerprint's votes in the recent window, across all polls.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public FingerprintBlock blockManually(String fingerprint, String reason, UUID blockedBy) {
        LocalDateTime since = LocalDateTime.now(clock).minusHours(properties.getFingerprint().getWindowHours());
        List<VoteTrace> traces = voteRecordRepository.findTracesByFingerprintAcrossPolls(fingerprint, since);
        UUID firstSeen = traces.stream().map(VoteTrace::userId).filter(Objects::nonNull).findFirst().orElse(null);
        int users = (int) traces.stream().map(VoteTrace::userId).filter(Objects::nonNull).distinct().count();
        return doBlock(fingerprint, reason, firstSeen, users, traces.size(), blockedBy);
    }

    /**
     * Automatic block raised while a user was voting; also notifies that user.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public FingerprintBlock autoBlock(String fingerprint, String reason, UUID firstSeenUser,
                                      int totalUsers, int totalVotes, UUID pollId, UUID triggeringUser) {
        FingerprintBlock block = doBlock(fingerprint, reason, firstSeenUser, totalUsers, totalVotes, null);
        eventPublisher.publishEvent(new VoteFlaggedEvent(null, triggeringUser, pollId, List.of(reason)));
        return block;
    }

    @Transactional
    public void unblock(String fingerprint, UUID unblockedBy) {
        Optional<FingerprintBlock> active = blockRepository.findByFingerprintAndIsActiveTrue(fingerprint);
        if (active.isEmpty()) {
            log.info("Unblock requested for fingerprint {} which is not blocked", fingerprint);
            return;
        }
        FingerprintBlock block = active.get();
        LocalDateTime now = LocalDateTime.now(clock);
        block.setIsActive(false);
        block.setUnblockedAt(now);
        block.setUnblockedBy(unblockedBy);
        blockRepository.save(block);
        appendEvent(fingerprint, BlockAction.UNBLOCKED, unblockedBy, null, now);
        log.info("Fingerprint {} unblocked by {}", fingerprint, unblockedBy);
    }

    @Transactional(readOnly = true)
    public List<FingerprintBlockEvent> history(String fingerprint) {
        return eventRepository.findByFingerprintOrderByOccurredAtAsc(fingerprint);
    }

    @Transactional(readOnly = true)
    public List<FingerprintBlock> listActive() {
        return blockRepository.findByIsActiveTrueOrderByBlockedAtDesc();
    }

    @Transactional(readOnly = true)
    public Optional<FingerprintBlock> find(String fingerprint) {
        return blockRepository.findByFingerprint(fingerprint);
    }

    private FingerprintBlock doBlock(String fingerprint, String reason, UUID firstSeenUser,
                                     int totalUsers, int totalVotes, UUID blockedBy) {
        LocalDateTime now = LocalDateTime.now(clock);
        Optional<FingerprintBlock> existing = blockRepository.findByFingerprint(fingerprint);

        if (existing.isPresent() && Boolean.TRUE.equals(existing.get().getIsActive())) {
            return existing.get();
        }

        FingerprintBlock block;
        BlockAction action;
        if (existing.isPresent()) {
            block = existing.get();
            block.setIsActive(true);
            block.setUnblockedAt(null);
            block.setUnblockedBy(null);
            action = BlockAction.REACTIVATED;
        } else {
            block = new FingerprintBlock();
            block.setFingerprint(fingerprint);
            action = BlockAction.BLOCKED;
        }
        block.setReason(reason);
        block.setBlockedAt(now);
        block.setBlockedBy(blockedBy);
        block.setFirstSeenUserId(firstSeenUser);
        block.setTotalUsers(totalUsers);
        block.setTotalVotes(totalVotes);

        // flush so a racing insert fails here, inside this transaction
        FingerprintBlock saved = blockRepository.saveAndFlush(block);
        appendEvent(fingerprint, action, blockedBy, reason, now);

        if (blockedBy == null) {
            log.warn("Fingerprint {} blocked automatically: {}", fingerprint, reason);
        } else {
            log.info("Fingerprint {} blocked by {}: {}", fingerprint, blockedBy, reason);
        }
        return saved;
    }

    private void appendEvent(String fingerprint, BlockAction action, UUID actor, String reason, LocalDateTime at) {
        FingerprintBlockEvent event = new FingerprintBlockEvent();
        event.setFingerprint(fingerprint);
        event.setAction(action);
        event.setActorId(actor);
        event.setReason(reason);
        event.setOccurredAt(at);
        eventRepository.save(event);
    }
}
