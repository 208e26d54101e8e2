package com.provote.backend.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import jakarta.servlet.http.HttpServletRequest;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

@Service
public class VoterIdentityService {

    private static final ObjectMapper CANONICAL_JSON = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    /**
     * Stable pseudonymous id of the voter. Authenticated voters hash their user
     * id; anonymous voters hash the client facts, so the same device behind the
     * same address gets the same token.
     */
    public String tokenFor(UUID userId, String ipAddress, String userAgent, String fingerprint) {
        if (userId != null) {
            return DigestUtils.sha256Hex("user:" + userId);
        }
        Map<String, String> data = new HashMap<>();
        data.put("fp", nullToEmpty(fingerprint));
        data.put("ip", nullToEmpty(ipAddress));
        data.put("ua", nullToEmpty(userAgent));
        try {
            return DigestUtils.sha256Hex(CANONICAL_JSON.writeValueAsString(data));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize voter identity", e);
        }
    }

    public String extractIp(String forwardedFor, String realIp, String remoteAddr) {
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            String first = forwardedFor.split(",")[0].trim();
            if (!first.isEmpty()) {
                return first;
            }
        }
        if (realIp != null && !realIp.isBlank()) {
            return realIp.trim();
        }
        if (remoteAddr != null && !remoteAddr.isBlank()) {
            return remoteAddr.trim();
        }
        return null;
    }

    public String extractIp(HttpServletRequest request) {
        return extractIp(request.getHeader("X-Forwarded-For"), request.getHeader("X-Real-IP"), request.getRemoteAddr());
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
