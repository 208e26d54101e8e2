package com.provote.backend.dto;

public record IdempotencyCheck(boolean duplicate, String cachedResult) {

    public static IdempotencyCheck notDuplicate() {
        return new IdempotencyCheck(false, null);
    }
}
