package com.provote.backend.service;

import com.provote.backend.config.IntegrityProperties;
import com.provote.backend.domain.FingerprintBlock;
import com.provote.backend.dto.ActivitySnapshot;
import com.provote.backend.dto.Verdict;
import com.provote.backend.dto.VoteTrace;
import com.provote.backend.exception.IntegrityCheckUnavailableException;
import com.provote.backend.repository.VoteRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("SuspicionEngine")
class SuspicionEngineTest {

    private static final String FP = "a".repeat(64);
    private static final LocalDateTime NOW = LocalDateTime.of(2024, 5, 1, 12, 0);

    @Mock
    private FingerprintBlockService blockService;

    @Mock
    private FingerprintActivityCache activityCache;

    @Mock
    private VoteRecordRepository voteRecordRepository;

    private SuspicionEngine engine;

    private final UUID pollId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        engine = new SuspicionEngine(blockService, activityCache, voteRecordRepository, new IntegrityProperties(), clock);
        when(blockService.isBlocked(anyString())).thenReturn(Optional.empty());
        when(activityCache.read(anyString(), any())).thenReturn(Optional.empty());
        when(voteRecordRepository.findTracesByFingerprint(anyString(), any(), any())).thenReturn(List.of());
        when(voteRecordRepository.findTracesByUser(any(), any())).thenReturn(List.of());
        when(voteRecordRepository.findAnonymousTracesByIp(anyString(), any())).thenReturn(List.of());
    }

    private static VoteTrace trace(UUID userId, String ip, String fingerprint, LocalDateTime at) {
        return new VoteTrace(userId, ip, fingerprint, at);
    }

    @Nested
    @DisplayName("evaluate")
    class Evaluate {

        @Test
        @DisplayName("Blank fingerprint is clean without any lookup")
        void blankFingerprint() {
            Verdict verdict = engine.evaluate("  ", pollId, UUID.randomUUID(), "10.0.0.1");

            assertThat(verdict.suspicious()).isFalse();
            assertThat(verdict.riskScore()).isZero();
            verifyNoInteractions(blockService, voteRecordRepository);
        }

        @Test
        @DisplayName("First vote of a fingerprint is clean")
        void firstVote() {
            Verdict verdict = engine.evaluate(FP, pollId, UUID.randomUUID(), "10.0.0.1");

            assertThat(verdict.suspicious()).isFalse();
            assertThat(verdict.blockVote()).isFalse();
            verify(blockService, never()).autoBlock(any(), any(), any(), anyInt(), anyInt(), any(), any());
        }

        @Test
        @DisplayName("Blocked fingerprint is rejected with full risk")
        void blockedFingerprint() {
            FingerprintBlock block = new FingerprintBlock();
            block.setReason("shared device farm");
            when(blockService.isBlocked(FP)).thenReturn(Optional.of(block));

            Verdict verdict = engine.evaluate(FP, pollId, UUID.randomUUID(), "10.0.0.1");

            assertThat(verdict.blockVote()).isTrue();
            assertThat(verdict.riskScore()).isEqualTo(100);
            assertThat(verdict.reasons()).containsExactly("Fingerprint is permanently blocked: shared device farm");
        }

        @Test
        @DisplayName("A second user on the same fingerprint is blocked")
        void differentUsers() {
            UUID first = UUID.randomUUID();
            when(voteRecordRepository.findTracesByFingerprint(eq(FP), eq(pollId), any()))
                    .thenReturn(List.of(trace(first, "10.0.0.1", FP, NOW.minusMinutes(10))));

            Verdict verdict = engine.evaluate(FP, pollId, UUID.randomUUID(), "10.0.0.1");

            assertThat(verdict.blockVote()).isTrue();
            assertThat(verdict.riskScore()).isGreaterThanOrEqualTo(40);
            assertThat(verdict.reasons()).anyMatch(r -> r.contains("different users"));
            verify(blockService).autoBlock(eq(FP), contains("different users"), eq(first), eq(2), eq(1), eq(pollId), any());
        }

        @Test
        @DisplayName("The same fingerprint from a second address is blocked")
        void differentIps() {
            when(voteRecordRepository.findTracesByFingerprint(eq(FP), eq(pollId), any()))
                    .thenReturn(List.of(trace(null, "10.0.0.1", FP, NOW.minusMinutes(10))));

            Verdict verdict = engine.evaluate(FP, pollId, null, "10.0.0.2");

            assertThat(verdict.blockVote()).isTrue();
            assertThat(verdict.reasons()).anyMatch(r -> r.toLowerCase().contains("different ip"));
        }

        @Test
        @DisplayName("Rapid voting from one fingerprint is reported")
        void rapidVoting() {
            UUID user = UUID.randomUUID();
            List<VoteTrace> traces = new ArrayList<>();
            for (int i = 15; i > 0; i--) {
                traces.add(trace(user, "10.0.0.1", FP, NOW.minusMinutes(i * 4L)));
            }
            when(voteRecordRepository.findTracesByFingerprint(eq(FP), eq(pollId), any())).thenReturn(traces);

            Verdict verdict = engine.evaluate(FP, pollId, user, "10.0.0.1");

            assertThat(verdict.suspicious()).isTrue();
            assertThat(verdict.reasons()).anyMatch(r -> r.toLowerCase().contains("rapid"));
            assertThat(verdict.riskScore()).isEqualTo(20);
            assertThat(verdict.blockVote()).isFalse();
        }

        @Test
        @DisplayName("Two votes seconds apart use the minimum span, not a near-zero one")
        void velocityFloor() {
            UUID user = UUID.randomUUID();
            when(voteRecordRepository.findTracesByFingerprint(eq(FP), eq(pollId), any())).thenReturn(List.of(
                    trace(user, "10.0.0.1", FP, NOW.minusSeconds(2)),
                    trace(user, "10.0.0.1", FP, NOW.minusSeconds(1))));

            Verdict verdict = engine.evaluate(FP, pollId, user, "10.0.0.1");

            // 2 votes per minute = 120/h, still rapid but finite
            assertThat(verdict.reasons()).containsExactly("Rapid voting detected: high frequency of 120.0 votes/hour");
        }

        @Test
        @DisplayName("Cache-only signals raise the score but do not block")
        void cacheOnlySignals() {
            UUID user = UUID.randomUUID();
            when(activityCache.read(FP, pollId)).thenReturn(Optional.of(new ActivitySnapshot(
                    4, Set.of(UUID.randomUUID().toString(), UUID.randomUUID().toString()),
                    Set.of("10.9.9.9", "10.8.8.8"), null)));

            Verdict verdict = engine.evaluate(FP, pollId, user, "10.0.0.1");

            assertThat(verdict.suspicious()).isTrue();
            assertThat(verdict.riskScore()).isEqualTo(70);
            assertThat(verdict.blockVote()).isFalse();
            verify(blockService, never()).autoBlock(any(), any(), any(), anyInt(), anyInt(), any(), any());
        }

        @Test
        @DisplayName("A concurrent block of the same fingerprint does not fail the check")
        void concurrentBlock() {
            when(voteRecordRepository.findTracesByFingerprint(eq(FP), eq(pollId), any()))
                    .thenReturn(List.of(trace(UUID.randomUUID(), "10.0.0.1", FP, NOW.minusMinutes(1))));
            when(blockService.autoBlock(any(), any(), any(), anyInt(), anyInt(), any(), any()))
                    .thenThrow(new DataIntegrityViolationException("uk_fingerprint_blocks_fingerprint"));

            Verdict verdict = engine.evaluate(FP, pollId, UUID.randomUUID(), "10.0.0.1");

            assertThat(verdict.blockVote()).isTrue();
        }
    }

    @Nested
    @DisplayName("Failure semantics")
    class Failures {

        @Test
        @DisplayName("Registry outage fails closed")
        void registryDown() {
            when(blockService.isBlocked(FP)).thenThrow(new DataAccessResourceFailureException("db down"));

            assertThatThrownBy(() -> engine.evaluate(FP, pollId, UUID.randomUUID(), "10.0.0.1"))
                    .isInstanceOf(IntegrityCheckUnavailableException.class)
                    .extracting("errorCode").isEqualTo("IntegrityCheckUnavailable");
        }

        @Test
        @DisplayName("History outage fails closed")
        void historyDown() {
            when(voteRecordRepository.findTracesByFingerprint(eq(FP), eq(pollId), any()))
                    .thenThrow(new DataAccessResourceFailureException("db down"));

            assertThatThrownBy(() -> engine.evaluate(FP, pollId, UUID.randomUUID(), "10.0.0.1"))
                    .isInstanceOf(IntegrityCheckUnavailableException.class);
        }
    }

    @Nested
    @DisplayName("checkIpCombination")
    class IpCombination {

        @Test
        @DisplayName("Single address is clean")
        void singleAddress() {
            when(voteRecordRepository.findTracesByFingerprint(eq(FP), eq(pollId), any()))
                    .thenReturn(List.of(trace(null, "10.0.0.1", FP, NOW.minusMinutes(5))));

            assertThat(engine.checkIpCombination(FP, "10.0.0.1", pollId).blockVote()).isFalse();
        }

        @Test
        @DisplayName("Second address blocks and registers the fingerprint")
        void secondAddress() {
            when(voteRecordRepository.findTracesByFingerprint(eq(FP), eq(pollId), any()))
                    .thenReturn(List.of(trace(null, "10.0.0.1", FP, NOW.minusMinutes(5))));

            Verdict verdict = engine.checkIpCombination(FP, "10.0.0.2", pollId);

            assertThat(verdict.blockVote()).isTrue();
            verify(blockService).autoBlock(eq(FP), contains("2 different IP addresses"), any(), anyInt(), eq(1), eq(pollId), any());
        }
    }

    @Nested
    @DisplayName("detectFingerprintChanges")
    class FingerprintChanges {

        @Test
        @DisplayName("A new fingerprint for the same user is reported, never blocked")
        void changed() {
            UUID user = UUID.randomUUID();
            when(voteRecordRepository.findTracesByUser(eq(user), any()))
                    .thenReturn(List.of(trace(user, "10.0.0.1", "b".repeat(64), NOW.minusHours(2))));

            Verdict verdict = engine.detectFingerprintChanges(FP, user, "10.0.0.1", pollId);

            assertThat(verdict.blockVote()).isFalse();
            assertThat(verdict.riskScore()).isEqualTo(30);
            assertThat(verdict.reasons()).singleElement().asString().startsWith("Fingerprint changed");
        }

        @Test
        @DisplayName("Three distinct fingerprints add the rapid-change reason")
        void rapidChanges() {
            UUID user = UUID.randomUUID();
            when(voteRecordRepository.findTracesByUser(eq(user), any())).thenReturn(List.of(
                    trace(user, "10.0.0.1", "b".repeat(64), NOW.minusHours(3)),
                    trace(user, "10.0.0.1", "c".repeat(64), NOW.minusHours(2))));

            Verdict verdict = engine.detectFingerprintChanges(FP, user, "10.0.0.1", pollId);

            assertThat(verdict.riskScore()).isEqualTo(60);
            assertThat(verdict.reasons()).anyMatch(r -> r.startsWith("Rapid fingerprint changes"));
            assertThat(verdict.blockVote()).isFalse();
        }

        @Test
        @DisplayName("Anonymous voters are compared by address")
        void anonymousByIp() {
            when(voteRecordRepository.findAnonymousTracesByIp(eq("10.0.0.1"), any()))
                    .thenReturn(List.of(trace(null, "10.0.0.1", "b".repeat(64), NOW.minusHours(1))));

            Verdict verdict = engine.detectFingerprintChanges(FP, null, "10.0.0.1", pollId);

            assertThat(verdict.suspicious()).isTrue();
            verify(voteRecordRepository, never()).findTracesByUser(any(), any());
        }

        @Test
        @DisplayName("History outside the window means a legitimate change")
        void noRecentHistory() {
            Verdict verdict = engine.detectFingerprintChanges(FP, UUID.randomUUID(), "10.0.0.1", pollId);

            assertThat(verdict.suspicious()).isFalse();
        }
    }
}
