package com.provote.backend.core.notification;

import com.provote.backend.dto.VoteFlaggedMessage;
import com.provote.backend.event.VoteFlaggedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.Set;

/**
 * Hands vote-flagged notices to the dispatcher topic, with the channels the
 * affected user accepts. Delivery itself happens elsewhere.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VoteFlaggedNotifier {

    public static final String TOPIC = "/topic/notifications/vote-flagged";

    private final NotificationPreferenceProvider preferenceProvider;
    private final SimpMessagingTemplate messagingTemplate;

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onVoteFlagged(VoteFlaggedEvent event) {
        Set<DeliveryChannel> channels = event.userId() == null
                ? Set.of(DeliveryChannel.IN_APP)
                : preferenceProvider.preferencesFor(event.userId()).channelsFor(NotificationType.VOTE_FLAGGED);
        if (channels.isEmpty()) {
            log.debug("User {} opted out of vote-flagged notices", event.userId());
            return;
        }
        try {
            messagingTemplate.convertAndSend(TOPIC,
                    new VoteFlaggedMessage(event.voteId(), event.userId(), event.pollId(), event.reasons(), channels));
        } catch (RuntimeException e) {
            log.warn("Could not publish vote-flagged notice for vote {}: {}", event.voteId(), e.getMessage());
        }
    }
}
