package com.provote.backend.core.notification;

public enum DeliveryChannel {
    EMAIL,
    IN_APP,
    PUSH
}
