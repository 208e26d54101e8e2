package com.provote.backend.core.notification;

public enum NotificationType {
    VOTE_FLAGGED,
    FINGERPRINT_BLOCKED,
    FRAUD_ALERT
}
