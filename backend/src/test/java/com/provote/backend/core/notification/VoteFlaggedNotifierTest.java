package com.provote.backend.core.notification;

import com.provote.backend.dto.VoteFlaggedMessage;
import com.provote.backend.event.VoteFlaggedEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@DisplayName("VoteFlaggedNotifier")
class VoteFlaggedNotifierTest {

    private final SimpMessagingTemplate messagingTemplate = mock(SimpMessagingTemplate.class);
    private final NotificationPreferenceProvider preferenceProvider = mock(NotificationPreferenceProvider.class);
    private final VoteFlaggedNotifier notifier = new VoteFlaggedNotifier(preferenceProvider, messagingTemplate);

    @Test
    @DisplayName("Publishes with the channels the user accepts")
    void publishesWithChannels() {
        UUID userId = UUID.randomUUID();
        when(preferenceProvider.preferencesFor(userId)).thenReturn(NotificationPreferences.defaults()
                .set(NotificationType.VOTE_FLAGGED, DeliveryChannel.EMAIL, false));

        notifier.onVoteFlagged(new VoteFlaggedEvent(UUID.randomUUID(), userId, UUID.randomUUID(),
                List.of("Pattern IP_CLUSTER:203.0.113.9")));

        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(messagingTemplate).convertAndSend(eq(VoteFlaggedNotifier.TOPIC), payload.capture());
        VoteFlaggedMessage message = (VoteFlaggedMessage) payload.getValue();
        assertThat(message.userId()).isEqualTo(userId);
        assertThat(message.channels()).containsExactly(DeliveryChannel.IN_APP);
    }

    @Test
    @DisplayName("Users who opted out get nothing")
    void optedOut() {
        UUID userId = UUID.randomUUID();
        when(preferenceProvider.preferencesFor(userId)).thenReturn(NotificationPreferences.defaults().unsubscribeAll());

        notifier.onVoteFlagged(new VoteFlaggedEvent(UUID.randomUUID(), userId, UUID.randomUUID(), List.of("x")));

        verify(messagingTemplate, never()).convertAndSend(anyString(), any(Object.class));
    }
}
