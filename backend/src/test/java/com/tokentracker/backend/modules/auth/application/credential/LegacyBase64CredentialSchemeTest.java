package com.tokentracker.backend.modules.auth.application.credential;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class LegacyBase64CredentialSchemeTest {

    private final LegacyBase64CredentialScheme scheme = new LegacyBase64CredentialScheme();

    @Test
    void supportsOnlyBase64ShapedValues() {
        assertThat(scheme.supports("YWRtaW4xMjM=")).isTrue();
        assertThat(scheme.supports("dXNlcjEyMw==")).isTrue();
        assertThat(scheme.supports("$2a$10$abcdefghijklmnopqrstuv")).isFalse();
        assertThat(scheme.supports("")).isFalse();
        assertThat(scheme.supports(null)).isFalse();
    }

    @Test
    void matchesEncodedPlaintext() {
        assertThat(scheme.encode("executive123")).isEqualTo("ZXhlY3V0aXZlMTIz");
        assertThat(scheme.matches("executive123", "ZXhlY3V0aXZlMTIz")).isTrue();
        assertThat(scheme.matches("executive12", "ZXhlY3V0aXZlMTIz")).isFalse();
        assertThat(scheme.matches(null, "ZXhlY3V0aXZlMTIz")).isFalse();
    }
}
