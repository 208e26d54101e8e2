package com.provote.backend.service;

import com.provote.backend.config.CacheConfig;
import com.provote.backend.config.IntegrityConfig;
import com.provote.backend.core.cache.FingerprintActivityStore;
import com.provote.backend.core.cache.InMemoryFingerprintActivityStore;
import com.provote.backend.core.cache.InMemoryKeyValueCache;
import com.provote.backend.core.cache.KeyValueCache;
import com.provote.backend.core.request.FingerprintExtractor;
import com.provote.backend.domain.Poll;
import com.provote.backend.domain.PollOption;
import com.provote.backend.domain.VoteAttempt;
import com.provote.backend.domain.VoteRecord;
import com.provote.backend.dto.CastResult;
import com.provote.backend.dto.CastVoteCommand;
import com.provote.backend.dto.RequestMetadata;
import com.provote.backend.exception.DuplicateVoteException;
import com.provote.backend.exception.FingerprintValidationException;
import com.provote.backend.exception.FraudDetectedException;
import com.provote.backend.exception.InvalidPollException;
import com.provote.backend.exception.InvalidVoteException;
import com.provote.backend.exception.PollClosedException;
import com.provote.backend.exception.PollNotFoundException;
import com.provote.backend.repository.FingerprintBlockEventRepository;
import com.provote.backend.repository.FingerprintBlockRepository;
import com.provote.backend.repository.PollOptionRepository;
import com.provote.backend.repository.PollRepository;
import com.provote.backend.repository.VoteAttemptRepository;
import com.provote.backend.repository.VoteRecordRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs the cast flow against a real database with every transaction
 * committing, as in production.
 */
@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import({IntegrityConfig.class, CacheConfig.class, FingerprintExtractor.class, VoterIdentityService.class,
        IdempotencyService.class, FingerprintActivityCache.class, FingerprintBlockService.class,
        SuspicionEngine.class, VoteAttemptService.class, VoteCastService.class})
@DisplayName("VoteCastService")
class VoteCastServiceTest {

    private static final String FP_A = "a".repeat(64);
    private static final String FP_B = "b".repeat(64);

    @Autowired private VoteCastService voteCastService;
    @Autowired private PollRepository pollRepository;
    @Autowired private PollOptionRepository pollOptionRepository;
    @Autowired private VoteRecordRepository voteRecordRepository;
    @Autowired private VoteAttemptRepository voteAttemptRepository;
    @Autowired private FingerprintBlockRepository blockRepository;
    @Autowired private FingerprintBlockEventRepository blockEventRepository;
    @Autowired private KeyValueCache keyValueCache;
    @Autowired private FingerprintActivityStore activityStore;

    private Poll poll;
    private PollOption optionA;
    private PollOption optionB;

    @BeforeEach
    void setUp() {
        poll = newPoll(p -> { });
        optionA = newOption(poll, "Yes");
        optionB = newOption(poll, "No");
    }

    @AfterEach
    void tearDown() {
        voteAttemptRepository.deleteAll();
        voteRecordRepository.deleteAll();
        blockEventRepository.deleteAll();
        blockRepository.deleteAll();
        pollOptionRepository.deleteAll();
        pollRepository.deleteAll();
        ((InMemoryKeyValueCache) keyValueCache).clear();
        ((InMemoryFingerprintActivityStore) activityStore).clear();
    }

    private Poll newPoll(java.util.function.Consumer<Poll> customizer) {
        Poll p = new Poll();
        p.setTitle("Should the pool open on Sundays?");
        customizer.accept(p);
        return pollRepository.save(p);
    }

    private PollOption newOption(Poll owner, String text) {
        PollOption option = new PollOption();
        option.setPollId(owner.getId());
        option.setText(text);
        return pollOptionRepository.save(option);
    }

    private CastVoteCommand command(UUID userId, PollOption option, String key, String ip, String fingerprint) {
        return new CastVoteCommand(userId, option.getPollId(), option.getId(), key,
                new RequestMetadata(ip, "JUnit/5", fingerprint));
    }

    private Poll reloadPoll() {
        return pollRepository.findById(poll.getId()).orElseThrow();
    }

    @Nested
    @DisplayName("Accepted votes")
    class Accepted {

        @Test
        @DisplayName("First vote is stored and counted")
        void firstVote() {
            UUID user = UUID.randomUUID();

            CastResult result = voteCastService.castVote(command(user, optionA, null, "10.0.0.1", FP_A));

            assertThat(result.isNew()).isTrue();
            assertThat(result.vote().getIsValid()).isTrue();
            assertThat(result.vote().getRiskScore()).isZero();
            assertThat(reloadPoll().getCachedTotalVotes()).isEqualTo(1);
            assertThat(reloadPoll().getCachedUniqueVoters()).isEqualTo(1);
            assertThat(pollOptionRepository.findById(optionA.getId()).orElseThrow().getCachedVoteCount()).isEqualTo(1);

            List<VoteAttempt> attempts = voteAttemptRepository.findByPollIdOrderByCreatedAtDesc(poll.getId());
            assertThat(attempts).singleElement().satisfies(a -> {
                assertThat(a.getSuccess()).isTrue();
                assertThat(a.getVoteId()).isEqualTo(result.vote().getId());
            });
        }

        @Test
        @DisplayName("Anonymous voters with their own devices are counted separately")
        void anonymousVoters() {
            voteCastService.castVote(command(null, optionA, null, "10.0.0.1", FP_A));
            voteCastService.castVote(command(null, optionB, null, "10.0.0.2", FP_B));

            assertThat(reloadPoll().getCachedTotalVotes()).isEqualTo(2);
            assertThat(reloadPoll().getCachedUniqueVoters()).isEqualTo(2);
        }

        @Test
        @DisplayName("A device change across polls is recorded but accepted")
        void fingerprintChange() {
            UUID user = UUID.randomUUID();
            Poll other = newPoll(p -> { });
            PollOption otherOption = newOption(other, "Maybe");
            voteCastService.castVote(command(user, optionA, null, "10.0.0.1", FP_A));

            CastResult result = voteCastService.castVote(command(user, otherOption, null, "10.0.0.1", FP_B));

            assertThat(result.isNew()).isTrue();
            assertThat(result.vote().getRiskScore()).isEqualTo(30);
            assertThat(result.vote().getFraudReasons()).anyMatch(r -> r.startsWith("Fingerprint changed"));
        }

        @Test
        @DisplayName("An over-long forwarded address is shortened before it is stored")
        void oversizedAddress() {
            String address = "2001:db8:" + "f".repeat(60);

            CastResult result = voteCastService.castVote(command(UUID.randomUUID(), optionA, null, address, FP_A));

            assertThat(result.isNew()).isTrue();
            assertThat(voteRecordRepository.findById(result.vote().getId()).orElseThrow().getIpAddress())
                    .hasSize(45)
                    .startsWith("2001:db8:");
            assertThat(voteAttemptRepository.findByPollIdOrderByCreatedAtDesc(poll.getId()))
                    .singleElement()
                    .satisfies(a -> assertThat(a.getSuccess()).isTrue());
        }
    }

    @Nested
    @DisplayName("Idempotency")
    class Idempotency {

        @Test
        @DisplayName("Replaying a key returns the original vote without counting again")
        void explicitKeyReplay() {
            UUID user = UUID.randomUUID();
            String key = "c".repeat(64);
            CastResult first = voteCastService.castVote(command(user, optionA, key, "10.0.0.1", FP_A));

            CastResult replay = voteCastService.castVote(command(user, optionA, key, "10.0.0.1", FP_A));

            assertThat(replay.isNew()).isFalse();
            assertThat(replay.vote().getId()).isEqualTo(first.vote().getId());
            assertThat(voteRecordRepository.count()).isEqualTo(1);
            assertThat(reloadPoll().getCachedTotalVotes()).isEqualTo(1);
            assertThat(voteAttemptRepository.count()).isEqualTo(2);
        }

        @Test
        @DisplayName("Without a key the derived key makes retries safe")
        void derivedKeyReplay() {
            UUID user = UUID.randomUUID();
            CastResult first = voteCastService.castVote(command(user, optionA, null, "10.0.0.1", FP_A));

            CastResult retry = voteCastService.castVote(command(user, optionA, "not-a-valid-key", "10.0.0.1", FP_A));

            assertThat(retry.isNew()).isFalse();
            assertThat(retry.vote().getIdempotencyKey()).isEqualTo(first.vote().getIdempotencyKey());
        }

        @Test
        @DisplayName("A key already used by another voter is rejected")
        void keyOfAnotherVoter() {
            String key = "d".repeat(64);
            voteCastService.castVote(command(UUID.randomUUID(), optionA, key, "10.0.0.1", FP_A));

            assertThatThrownBy(() -> voteCastService.castVote(command(UUID.randomUUID(), optionA, key, "10.0.0.2", FP_B)))
                    .isInstanceOf(InvalidVoteException.class)
                    .hasMessageContaining("Idempotency key");
            assertThat(voteRecordRepository.count()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Rejected votes")
    class Rejected {

        @Test
        @DisplayName("A second vote by the same user is a duplicate")
        void duplicateUser() {
            UUID user = UUID.randomUUID();
            voteCastService.castVote(command(user, optionA, null, "10.0.0.1", FP_A));

            assertThatThrownBy(() -> voteCastService.castVote(command(user, optionB, null, "10.0.0.1", FP_A)))
                    .isInstanceOf(DuplicateVoteException.class);

            assertThat(reloadPoll().getCachedTotalVotes()).isEqualTo(1);
            assertThat(voteAttemptRepository.countByPollIdAndSuccessFalse(poll.getId())).isEqualTo(1);
            assertThat(voteAttemptRepository.findByPollIdOrderByCreatedAtDesc(poll.getId()))
                    .anySatisfy(a -> assertThat(a.getErrorCode()).isEqualTo("DuplicateVoteError"));
        }

        @Test
        @DisplayName("A shared device across users is blocked for good")
        void sharedDevice() {
            voteCastService.castVote(command(UUID.randomUUID(), optionA, null, "10.0.0.1", FP_A));

            assertThatThrownBy(() -> voteCastService.castVote(command(UUID.randomUUID(), optionA, null, "10.0.0.1", FP_A)))
                    .isInstanceOfSatisfying(FraudDetectedException.class, e -> {
                        assertThat(e.getReasons()).anyMatch(r -> r.contains("different users"));
                        assertThat(e.getErrorCode()).isEqualTo("FraudDetectedError");
                    });

            // the block survives the rollback of the rejected cast
            assertThat(blockRepository.findByFingerprintAndIsActiveTrue(FP_A)).isPresent();
            assertThat(voteRecordRepository.count()).isEqualTo(1);

            assertThatThrownBy(() -> voteCastService.castVote(command(UUID.randomUUID(), optionB, null, "10.0.0.9", FP_A)))
                    .isInstanceOfSatisfying(FraudDetectedException.class,
                            e -> assertThat(e.getReasons()).singleElement().asString().startsWith("Fingerprint is permanently blocked"));
        }

        @Test
        @DisplayName("Unknown poll")
        void unknownPoll() {
            CastVoteCommand cmd = new CastVoteCommand(UUID.randomUUID(), UUID.randomUUID(), optionA.getId(), null,
                    new RequestMetadata("10.0.0.1", "JUnit/5", FP_A));

            assertThatThrownBy(() -> voteCastService.castVote(cmd)).isInstanceOf(PollNotFoundException.class);
        }

        @Test
        @DisplayName("Draft poll")
        void draftPoll() {
            Poll draft = newPoll(p -> p.setIsDraft(true));
            PollOption option = newOption(draft, "Yes");

            assertThatThrownBy(() -> voteCastService.castVote(command(UUID.randomUUID(), option, null, "10.0.0.1", FP_A)))
                    .isInstanceOf(InvalidPollException.class);
        }

        @Test
        @DisplayName("Inactive, future and expired polls are closed")
        void closedPolls() {
            Poll inactive = newPoll(p -> p.setIsActive(false));
            Poll future = newPoll(p -> p.setStartsAt(LocalDateTime.now().plusDays(1)));
            Poll expired = newPoll(p -> p.setEndsAt(LocalDateTime.now().minusMinutes(1)));

            for (Poll closed : List.of(inactive, future, expired)) {
                PollOption option = newOption(closed, "Yes");
                assertThatThrownBy(() -> voteCastService.castVote(command(UUID.randomUUID(), option, null, "10.0.0.1", FP_A)))
                        .isInstanceOf(PollClosedException.class);
            }
            assertThat(voteRecordRepository.count()).isZero();
        }

        @Test
        @DisplayName("Option from another poll")
        void foreignOption() {
            PollOption foreign = newOption(newPoll(p -> { }), "Elsewhere");
            CastVoteCommand cmd = new CastVoteCommand(UUID.randomUUID(), poll.getId(), foreign.getId(), null,
                    new RequestMetadata("10.0.0.1", "JUnit/5", FP_A));

            assertThatThrownBy(() -> voteCastService.castVote(cmd))
                    .isInstanceOf(InvalidVoteException.class)
                    .hasMessageContaining("does not belong");
        }

        @Test
        @DisplayName("Anonymous vote without a fingerprint")
        void anonymousWithoutFingerprint() {
            assertThatThrownBy(() -> voteCastService.castVote(command(null, optionA, null, "10.0.0.1", null)))
                    .isInstanceOf(FingerprintValidationException.class);
            assertThat(voteAttemptRepository.count()).isEqualTo(1);
        }
        @Test
        @DisplayName("An over-long fingerprint is a validation error and is still audited")
        void oversizedFingerprint() {
            assertThatThrownBy(() -> voteCastService.castVote(command(null, optionA, null, "10.0.0.1", "z".repeat(200))))
                    .isInstanceOf(FingerprintValidationException.class);

            assertThat(voteRecordRepository.count()).isZero();
            assertThat(voteAttemptRepository.findByPollIdOrderByCreatedAtDesc(poll.getId()))
                    .singleElement()
                    .satisfies(a -> {
                        assertThat(a.getSuccess()).isFalse();
                        assertThat(a.getErrorCode()).isEqualTo("FingerprintValidationError");
                        assertThat(a.getFingerprint()).hasSize(128);
                    });
        }
    }

    @Nested
    @DisplayName("Concurrent casts")
    class Concurrent {

        private <T> List<Future<T>> runTogether(List<Callable<T>> tasks) throws InterruptedException {
            ExecutorService pool = Executors.newFixedThreadPool(tasks.size());
            CountDownLatch start = new CountDownLatch(1);
            List<Future<T>> futures = new ArrayList<>();
            for (Callable<T> task : tasks) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return task.call();
                }));
            }
            start.countDown();
            pool.shutdown();
            assertThat(pool.awaitTermination(60, TimeUnit.SECONDS)).isTrue();
            return futures;
        }

        @Test
        @DisplayName("Counters match the stored votes when many users vote at once")
        void manyUsers() throws Exception {
            int voters = 8;
            List<Callable<CastResult>> tasks = new ArrayList<>();
            for (int i = 0; i < voters; i++) {
                String fingerprint = String.format("%064x", i + 1);
                String address = "10.1.0." + (i + 1);
                PollOption option = i % 2 == 0 ? optionA : optionB;
                tasks.add(() -> voteCastService.castVote(command(UUID.randomUUID(), option, null, address, fingerprint)));
            }

            for (Future<CastResult> future : runTogether(tasks)) {
                assertThat(future.get().isNew()).isTrue();
            }

            List<VoteRecord> stored = voteRecordRepository.findAll();
            assertThat(stored).hasSize(voters);
            long forA = stored.stream().filter(v -> optionA.getId().equals(v.getOptionId())).count();
            long forB = stored.stream().filter(v -> optionB.getId().equals(v.getOptionId())).count();
            assertThat((long) pollOptionRepository.findById(optionA.getId()).orElseThrow().getCachedVoteCount()).isEqualTo(forA);
            assertThat((long) pollOptionRepository.findById(optionB.getId()).orElseThrow().getCachedVoteCount()).isEqualTo(forB);
            assertThat((long) reloadPoll().getCachedTotalVotes()).isEqualTo(voters);
            assertThat((long) reloadPoll().getCachedUniqueVoters()).isEqualTo(voters);
            assertThat(voteAttemptRepository.count()).isEqualTo(voters);
        }

        @Test
        @DisplayName("A user racing themselves ends up with exactly one vote")
        void sameUserRacing() throws Exception {
            UUID user = UUID.randomUUID();
            int racers = 4;
            List<Callable<CastResult>> tasks = new ArrayList<>();
            for (int i = 0; i < racers; i++) {
                tasks.add(() -> voteCastService.castVote(command(user, optionA, null, "10.0.0.1", FP_A)));
            }

            int created = 0;
            for (Future<CastResult> future : runTogether(tasks)) {
                try {
                    if (future.get().isNew()) {
                        created++;
                    }
                } catch (ExecutionException e) {
                    assertThat(e.getCause()).isInstanceOf(DuplicateVoteException.class);
                }
            }

            assertThat(created).isEqualTo(1);
            assertThat(voteRecordRepository.findAll()).singleElement()
                    .satisfies(v -> assertThat(v.getUserId()).isEqualTo(user));
            assertThat(pollOptionRepository.findById(optionA.getId()).orElseThrow().getCachedVoteCount()).isEqualTo(1);
            assertThat(reloadPoll().getCachedTotalVotes()).isEqualTo(1);
        }
    }
}
