package com.provote.backend.core.notification;

import org.springframework.stereotype.Component;

import java.util.UUID;

@Component
public class DefaultNotificationPreferenceProvider implements NotificationPreferenceProvider {

    @Override
    public NotificationPreferences preferencesFor(UUID userId) {
        return NotificationPreferences.defaults();
    }
}
