package com.example.iam.token.mfa;

import com.example.iam.config.properties.MfaProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TotpGenerator")
class TotpGeneratorTest {

    // Base32 of the ASCII key "12345678901234567890" used by the RFC 6238 reference vectors
    private static final String RFC_SECRET = "GEZDGNBVGY3TQOJQGEZDGNBVGY3TQOJQ";

    private static TotpGenerator generator(int digits) {
        return new TotpGenerator(new MfaProperties(null, digits, Duration.ofSeconds(30), 1, 0, 0, 0));
    }

    @Test
    @DisplayName("should produce the RFC 6238 SHA-1 reference codes")
    void shouldMatchReferenceVectors() {
        TotpGenerator totp = generator(8);

        assertThat(totp.generate(RFC_SECRET, totp.timeStep(Instant.ofEpochSecond(59)))).isEqualTo("94287082");
        assertThat(totp.generate(RFC_SECRET, totp.timeStep(Instant.ofEpochSecond(1111111109)))).isEqualTo("07081804");
        assertThat(totp.generate(RFC_SECRET, totp.timeStep(Instant.ofEpochSecond(1234567890)))).isEqualTo("89005924");
    }

    @Test
    @DisplayName("should accept codes within the skew window only")
    void shouldHonorSkew() {
        TotpGenerator totp = generator(6);
        Instant now = Instant.ofEpochSecond(1_700_000_000L);
        long step = totp.timeStep(now);

        assertThat(totp.verify(RFC_SECRET, totp.generate(RFC_SECRET, step - 1), now, 1)).hasValue(step - 1);
        assertThat(totp.verify(RFC_SECRET, totp.generate(RFC_SECRET, step + 1), now, 1)).hasValue(step + 1);
        assertThat(totp.verify(RFC_SECRET, totp.generate(RFC_SECRET, step - 2), now, 1)).isEmpty();
    }

    @Test
    @DisplayName("should reject codes of the wrong shape")
    void shouldRejectMalformedCodes() {
        TotpGenerator totp = generator(6);
        Instant now = Instant.ofEpochSecond(1_700_000_000L);

        assertThat(totp.verify(RFC_SECRET, "12345", now, 1)).isEmpty();
        assertThat(totp.verify(RFC_SECRET, "12a456", now, 1)).isEmpty();
        assertThat(totp.verify(RFC_SECRET, null, now, 1)).isEmpty();
    }

    @Test
    @DisplayName("should generate 160-bit secrets without padding")
    void shouldGenerateSecrets() {
        String secret = generator(6).newSecret();

        assertThat(secret).hasSize(32).matches("[A-Z2-7]+");
    }
}
