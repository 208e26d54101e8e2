package com.provote.backend.service;

import com.provote.backend.domain.VoteAttempt;
import com.provote.backend.repository.VoteAttemptRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Audit trail of cast attempts. Runs in its own transaction so rejected casts
 * are recorded too. The row is flushed here, so a failing write surfaces from
 * this call and the caller decides what it means for the cast.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VoteAttemptService {

    private final VoteAttemptRepository voteAttemptRepository;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void record(VoteAttempt attempt) {
        voteAttemptRepository.saveAndFlush(attempt);
        log.debug("Recorded vote attempt on poll {} (success={})", attempt.getPollId(), attempt.getSuccess());
    }
}
