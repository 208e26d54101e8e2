package com.provote.backend.event;

import java.util.UUID;

public record PollResultsChangedEvent(UUID pollId) {}
