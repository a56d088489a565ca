package com.spacesync.backend.global.security;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * HS256 signing key for operator access tokens. {@code jwt.secret} is read as base64 first and as
 * raw UTF-8 otherwise; either way it must carry at least 256 bits.
 */
@Component
public class JwtTokenProvider {

    static final int MIN_KEY_BYTES = 32;

    private final SecretKey secretKey;

    public JwtTokenProvider(@Value("${jwt.secret}") String secret) {
        if (!StringUtils.hasText(secret)) {
            throw new IllegalStateException("jwt.secret must be configured");
        }
        byte[] keyBytes = decode(secret.trim());
        if (keyBytes.length < MIN_KEY_BYTES) {
            throw new IllegalStateException("jwt.secret must be at least " + MIN_KEY_BYTES + " bytes, got " + keyBytes.length);
        }
        this.secretKey = new SecretKeySpec(keyBytes, "HmacSHA256");
    }

    public SecretKey getSecretKey() {
        return secretKey;
    }

    private static byte[] decode(String secret) {
        try {
            return Base64.getDecoder().decode(secret);
        } catch (IllegalArgumentException notBase64) {
            return secret.getBytes(StandardCharsets.UTF_8);
        }
    }
}
