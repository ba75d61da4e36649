package com.example.forecast.stage;

import com.example.forecast.model.StageKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 fingerprint of a stage invocation: stage name, JSON payload and JSON config.
 */
public class StageFingerprints {

    private final ObjectMapper objectMapper;

    public StageFingerprints(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String of(StageKind kind, Object payload, Object config) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(kind.stageName().getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
            digest.update(objectMapper.writeValueAsBytes(payload));
            digest.update((byte) 0);
            digest.update(objectMapper.writeValueAsBytes(config));
            return HexFormat.of().formatHex(digest.digest());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot fingerprint " + kind.stageName() + " payload", e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
