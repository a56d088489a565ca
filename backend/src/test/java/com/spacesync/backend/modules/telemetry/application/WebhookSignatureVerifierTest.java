package com.spacesync.backend.modules.telemetry.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

import com.spacesync.backend.global.error.ProblemException;

import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

class WebhookSignatureVerifierTest {

    private static final byte[] BODY = "{\"deviceInfo\":{\"devEui\":\"0102030405060708\"},\"fCnt\":5}"
            .getBytes(StandardCharsets.UTF_8);
    private static final UUID TENANT = UUID.fromString("00000000-0000-0000-0000-0000000000a1");

    private WebhookProperties properties;
    private WebhookSignatureVerifier verifier;

    @BeforeEach
    void setUp() {
        properties = new WebhookProperties();
        properties.setSecret("platform-secret");
        properties.getTenantSecrets().put(TENANT, "tenant-secret");
        verifier = new WebhookSignatureVerifier(properties);
    }

    @Test
    void acceptsPlatformSignature() {
        String hex = WebhookSignatureVerifier.signHex(BODY, "platform-secret");

        assertThatCode(() -> verifier.verify(BODY, hex, null)).doesNotThrowAnyException();
        assertThatCode(() -> verifier.verify(BODY, "sha256=" + hex.toUpperCase(), null)).doesNotThrowAnyException();
    }

    @Test
    void tenantSecretSelectedByHeader() {
        String tenantSignature = WebhookSignatureVerifier.signHex(BODY, "tenant-secret");
        String platformSignature = WebhookSignatureVerifier.signHex(BODY, "platform-secret");

        assertThatCode(() -> verifier.verify(BODY, tenantSignature, TENANT)).doesNotThrowAnyException();
        assertUnauthorized(() -> verifier.verify(BODY, platformSignature, TENANT));
    }

    @Test
    void unknownTenantFallsBack() {
        String platformSignature = WebhookSignatureVerifier.signHex(BODY, "platform-secret");

        assertThatCode(() -> verifier.verify(BODY, platformSignature, UUID.randomUUID())).doesNotThrowAnyException();
    }

    @Test
    void rejectsBadSignatures() {
        String hex = WebhookSignatureVerifier.signHex(BODY, "platform-secret");
        byte[] tampered = "{\"fCnt\":6}".getBytes(StandardCharsets.UTF_8);

        assertUnauthorized(() -> verifier.verify(tampered, hex, null));
        assertUnauthorized(() -> verifier.verify(BODY, null, null));
        assertUnauthorized(() -> verifier.verify(BODY, "not-hex", null));
    }

    @Test
    void noSecretConfigured() {
        properties.setSecret("");
        properties.getTenantSecrets().clear();

        assertUnauthorized(() -> verifier.verify(BODY, "deadbeef", null));

        properties.setAllowUnsigned(true);
        assertThatCode(() -> verifier.verify(BODY, null, null)).doesNotThrowAnyException();
    }

    private static void assertUnauthorized(ThrowingCallable call) {
        assertThatThrownBy(call)
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
                    assertThat(ex.getCode()).isEqualTo("webhook.invalid_signature");
                });
    }
}
