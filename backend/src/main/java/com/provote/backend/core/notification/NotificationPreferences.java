package com.provote.backend.core.notification;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Per-user delivery settings. A notification goes out on a channel only when
 * the user is subscribed, the channel is switched on globally and the
 * (type, channel) pair is enabled.
 */
public class NotificationPreferences {

    private final Map<NotificationType, EnumMap<DeliveryChannel, Boolean>> matrix = new EnumMap<>(NotificationType.class);
    private final EnumMap<DeliveryChannel, Boolean> globalSwitches = new EnumMap<>(DeliveryChannel.class);
    private boolean unsubscribed;

    public NotificationPreferences() {
        for (DeliveryChannel channel : DeliveryChannel.values()) {
            globalSwitches.put(channel, true);
        }
        for (NotificationType type : NotificationType.values()) {
            EnumMap<DeliveryChannel, Boolean> row = new EnumMap<>(DeliveryChannel.class);
            row.put(DeliveryChannel.EMAIL, true);
            row.put(DeliveryChannel.IN_APP, true);
            row.put(DeliveryChannel.PUSH, false);
            matrix.put(type, row);
        }
    }

    public static NotificationPreferences defaults() {
        return new NotificationPreferences();
    }

    public boolean isEnabled(NotificationType type, DeliveryChannel channel) {
        return !unsubscribed
                && globalSwitches.get(channel)
                && matrix.get(type).get(channel);
    }

    public Set<DeliveryChannel> channelsFor(NotificationType type) {
        EnumSet<DeliveryChannel> channels = EnumSet.noneOf(DeliveryChannel.class);
        for (DeliveryChannel channel : DeliveryChannel.values()) {
            if (isEnabled(type, channel)) {
                channels.add(channel);
            }
        }
        return channels;
    }

    public NotificationPreferences set(NotificationType type, DeliveryChannel channel, boolean enabled) {
        matrix.get(type).put(channel, enabled);
        return this;
    }

    public NotificationPreferences setChannel(DeliveryChannel channel, boolean enabled) {
        globalSwitches.put(channel, enabled);
        return this;
    }

    public NotificationPreferences unsubscribeAll() {
        unsubscribed = true;
        return this;
    }

    public NotificationPreferences resubscribe() {
        unsubscribed = false;
        return this;
    }

    public boolean isUnsubscribed() {
        return unsubscribed;
    }
}
