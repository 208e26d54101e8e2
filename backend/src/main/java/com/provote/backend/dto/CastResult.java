package com.provote.backend.dto;

import com.provote.backend.domain.VoteRecord;

/**
 * @param isNew false when the call replayed an earlier cast with the same key
 */
public record CastResult(VoteRecord vote, boolean isNew) {}
