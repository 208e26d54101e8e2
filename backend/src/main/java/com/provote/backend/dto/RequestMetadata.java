package com.provote.backend.dto;

/**
 * Client facts captured at the HTTP boundary.
 */
public record RequestMetadata(
    String ipAddress,
    String userAgent,
    String fingerprint
) {}
