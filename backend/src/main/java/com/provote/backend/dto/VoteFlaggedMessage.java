package com.provote.backend.dto;

import com.provote.backend.core.notification.DeliveryChannel;

import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Handed to the external notification dispatcher, which owns actual delivery.
 */
public record VoteFlaggedMessage(
    UUID voteId,
    UUID userId,
    UUID pollId,
    List<String> reasons,
    Set<DeliveryChannel> channels
) {}
