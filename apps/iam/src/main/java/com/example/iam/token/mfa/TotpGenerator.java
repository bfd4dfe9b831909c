package com.example.iam.token.mfa;

import com.example.iam.config.properties.MfaProperties;
import org.apache.commons.codec.binary.Base32;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.Locale;
import java.util.OptionalLong;

/**
 * RFC 6238 time-based one-time passwords (HMAC-SHA1).
 */
public class TotpGenerator {

    private static final String ALGORITHM = "HmacSHA1";
    private static final int SECRET_BYTES = 20;
    private static final int[] POWERS_OF_TEN = {1, 10, 100, 1_000, 10_000, 100_000, 1_000_000, 10_000_000, 100_000_000};

    private final Base32 base32 = new Base32();
    private final SecureRandom random = new SecureRandom();
    private final int digits;
    private final long periodSeconds;

    public TotpGenerator(MfaProperties properties) {
        this.digits = properties.digits();
        this.periodSeconds = properties.period().toSeconds();
    }

    /**
     * New random shared secret, Base32 encoded without padding.
     */
    public String newSecret() {
        byte[] bytes = new byte[SECRET_BYTES];
        random.nextBytes(bytes);
        return base32.encodeAsString(bytes).replace("=", "");
    }

    public long timeStep(Instant instant) {
        return Math.floorDiv(instant.getEpochSecond(), periodSeconds);
    }

    public String generate(String secret, long timeStep) {
        byte[] key = base32.decode(secret.toUpperCase(Locale.ROOT));
        byte[] counter = ByteBuffer.allocate(Long.BYTES).putLong(timeStep).array();
        byte[] hash;
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(key, ALGORITHM));
            hash = mac.doFinal(counter);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA1 is not available", e);
        }

        int offset = hash[hash.length - 1] & 0x0F;
        int binary = ((hash[offset] & 0x7F) << 24)
                | ((hash[offset + 1] & 0xFF) << 16)
                | ((hash[offset + 2] & 0xFF) << 8)
                | (hash[offset + 3] & 0xFF);
        int otp = binary % POWERS_OF_TEN[digits];
        return String.format("%0" + digits + "d", otp);
    }

    /**
     * Checks a code against the current step and {@code skewSteps} steps on either side.
     *
     * @return the matching time step, or empty if none matched
     */
    public OptionalLong verify(String secret, String code, Instant now, int skewSteps) {
        if (code == null || code.length() != digits || !code.chars().allMatch(Character::isDigit)) {
            return OptionalLong.empty();
        }
        long current = timeStep(now);
        byte[] presented = code.getBytes(StandardCharsets.US_ASCII);
        for (long step = current - skewSteps; step <= current + skewSteps; step++) {
            byte[] expected = generate(secret, step).getBytes(StandardCharsets.US_ASCII);
            if (MessageDigest.isEqual(expected, presented)) {
                return OptionalLong.of(step);
            }
        }
        return OptionalLong.empty();
    }
}
