package com.unwind.backend.modules.auth.infrastructure.jwt;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.jsonwebtoken.io.DecodingException;
import io.jsonwebtoken.io.Decoders;

/**
 * Reads the payload segment of a compact JWT without checking its signature.
 * Nothing read here may be treated as an authenticated claim.
 */
public class UnverifiedTokenDecoder {

    private static final Logger log = LoggerFactory.getLogger(UnverifiedTokenDecoder.class);
    private static final TypeReference<Map<String, Object>> CLAIMS_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public UnverifiedTokenDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Optional<Map<String, Object>> decodePayload(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        String[] segments = token.trim().split("\\.", -1);
        if (segments.length < 2 || segments[1].isEmpty()) {
            log.error("Failed to decode token: expected header.payload[.signature]");
            return Optional.empty();
        }
        try {
            byte[] payload = Decoders.BASE64URL.decode(segments[1]);
            return Optional.ofNullable(objectMapper.readValue(payload, CLAIMS_TYPE));
        } catch (DecodingException | IOException ex) {
            log.error("Failed to decode token: {}", ex.getMessage());
            return Optional.empty();
        }
    }
}
