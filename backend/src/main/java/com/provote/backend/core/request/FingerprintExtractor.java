package com.provote.backend.core.request;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.provote.backend.exception.FingerprintValidationException;
import jakarta.servlet.http.HttpServletRequest;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Reads the device fingerprint sent by the client, or derives a weaker one
 * from the request headers when the client did not send any.
 */
@Component
public class FingerprintExtractor {

    public static final String FINGERPRINT_HEADER = "X-Fingerprint";

    private static final List<String> DERIVATION_HEADERS = List.of(
            "User-Agent", "Accept-Language", "Accept-Encoding", "Accept", "Connection", "DNT");

    private static final Pattern HEX = Pattern.compile("^[0-9a-fA-F]*$");

    private static final ObjectMapper CANONICAL_JSON = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    public String extract(HttpServletRequest request) {
        String supplied = request.getHeader(FINGERPRINT_HEADER);
        if (supplied != null && !supplied.isBlank()) {
            return supplied.trim();
        }
        return derive(request);
    }

    /**
     * Hash of the sorted header map. Returns null when the request carries none
     * of the headers, so an anonymous caller still fails validation.
     */
    public String derive(HttpServletRequest request) {
        Map<String, String> data = new HashMap<>();
        for (String header : DERIVATION_HEADERS) {
            String value = request.getHeader(header);
            if (value != null && !value.isBlank()) {
                data.put(header.toLowerCase(Locale.ROOT), value);
            }
        }
        if (data.isEmpty()) {
            return null;
        }
        try {
            return DigestUtils.sha256Hex(CANONICAL_JSON.writeValueAsString(data));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize fingerprint headers", e);
        }
    }

    public void validateFingerprint(String fingerprint) {
        if (fingerprint == null || fingerprint.isBlank()) {
            throw new FingerprintValidationException("Fingerprint is required");
        }
        if (fingerprint.length() != 64) {
            throw new FingerprintValidationException(
                    "Fingerprint must be 64 characters long, got " + fingerprint.length());
        }
        if (!HEX.matcher(fingerprint).matches()) {
            throw new FingerprintValidationException("Fingerprint must contain only hexadecimal characters");
        }
    }

    /**
     * Anonymous voters must present a valid fingerprint. Authenticated voters may
     * omit it, but one they do send must still be well-formed.
     */
    public void requireFingerprintForAnonymous(UUID userId, String fingerprint) {
        if (userId == null) {
            if (fingerprint == null || fingerprint.isBlank()) {
                throw new FingerprintValidationException("Fingerprint is required for anonymous votes");
            }
            validateFingerprint(fingerprint);
        } else if (fingerprint != null && !fingerprint.isBlank()) {
            validateFingerprint(fingerprint);
        }
    }
}
