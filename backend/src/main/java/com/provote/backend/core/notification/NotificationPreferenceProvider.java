package com.provote.backend.core.notification;

import java.util.UUID;

/**
 * Source of per-user notification settings. The settings themselves live in the
 * accounts application; the default implementation returns the defaults.
 */
public interface NotificationPreferenceProvider {

    NotificationPreferences preferencesFor(UUID userId);
}
