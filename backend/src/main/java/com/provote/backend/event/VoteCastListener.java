package com.provote.backend.event;

import com.provote.backend.service.FingerprintActivityCache;
import com.provote.backend.service.FingerprintDeepAnalysisService;
import com.provote.backend.service.IdempotencyService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Follow-up work for an accepted vote. Runs only once the vote is committed,
 * so nothing here can describe a vote that was rolled back.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VoteCastListener {

    private final IdempotencyService idempotencyService;
    private final FingerprintActivityCache activityCache;
    private final FingerprintDeepAnalysisService deepAnalysisService;
    private final ApplicationEventPublisher eventPublisher;

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onVoteCast(VoteCastEvent event) {
        // 1. Fast path for replays
        idempotencyService.store(event.idempotencyKey(), event.voteId().toString());

        // 2. Shared activity counters
        activityCache.record(event.fingerprint(), event.pollId(), event.userId(), event.ipAddress());

        // 3. Live results
        eventPublisher.publishEvent(new PollResultsChangedEvent(event.pollId()));

        // 4. Longer-window analysis
        if (event.fingerprint() != null && !event.fingerprint().isBlank()) {
            deepAnalysisService.analyzeAsync(event.fingerprint(), event.pollId());
        }
        log.debug("Post-commit work dispatched for vote {}", event.voteId());
    }
}
