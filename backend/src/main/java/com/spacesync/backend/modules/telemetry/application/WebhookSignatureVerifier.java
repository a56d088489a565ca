package com.spacesync.backend.modules.telemetry.application;

import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.UUID;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import com.spacesync.backend.global.error.ProblemException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * HMAC-SHA256 over the raw body, hex encoded, optionally prefixed with {@code sha256=}.
 * Secrets come from configuration only so verification never waits on storage.
 */
@Component
public class WebhookSignatureVerifier {

    private static final Logger log = LoggerFactory.getLogger(WebhookSignatureVerifier.class);
    private static final String HMAC_SHA_256 = "HmacSHA256";
    private static final String PREFIX = "sha256=";

    private final WebhookProperties properties;

    public WebhookSignatureVerifier(WebhookProperties properties) {
        this.properties = properties;
    }

    public void verify(byte[] body, String signatureHeader, UUID tenantHint) {
        String secret = resolveSecret(tenantHint);
        if (!StringUtils.hasText(secret)) {
            if (properties.isAllowUnsigned()) {
                return;
            }
            log.warn("[ALERT] Webhook rejected: no signing secret configured");
            throw invalidSignature();
        }
        if (!StringUtils.hasText(signatureHeader)) {
            log.warn("Webhook rejected: missing signature");
            throw invalidSignature();
        }

        byte[] presented;
        try {
            presented = HexFormat.of().parseHex(stripPrefix(signatureHeader.trim()));
        } catch (IllegalArgumentException ex) {
            log.warn("Webhook rejected: signature is not hex");
            throw invalidSignature();
        }
        if (!MessageDigest.isEqual(sign(body, secret), presented)) {
            log.warn("Webhook rejected: signature mismatch (tenant hint {})", tenantHint);
            throw invalidSignature();
        }
    }

    public static byte[] sign(byte[] body, String secret) {
        try {
            Mac mac = Mac.getInstance(HMAC_SHA_256);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_SHA_256));
            return mac.doFinal(body);
        } catch (NoSuchAlgorithmException | InvalidKeyException ex) {
            throw new IllegalStateException("HmacSHA256 unavailable", ex);
        }
    }

    public static String signHex(byte[] body, String secret) {
        return HexFormat.of().formatHex(sign(body, secret));
    }

    private String resolveSecret(UUID tenantHint) {
        if (tenantHint != null) {
            String tenantSecret = properties.getTenantSecrets().get(tenantHint);
            if (StringUtils.hasText(tenantSecret)) {
                return tenantSecret;
            }
        }
        return properties.getSecret();
    }

    private static String stripPrefix(String signature) {
        if (signature.toLowerCase(Locale.ROOT).startsWith(PREFIX)) {
            return signature.substring(PREFIX.length());
        }
        return signature;
    }

    private static ProblemException invalidSignature() {
        return new ProblemException(HttpStatus.UNAUTHORIZED, "webhook.invalid_signature", "Invalid webhook signature");
    }
}
