package com.example.iam.token.mfa;

import com.example.iam.common.exception.NotFoundException;
import com.example.iam.common.exception.ValidationException;
import com.example.iam.common.util.StringSanitizer;
import com.example.iam.config.properties.MfaProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * TOTP enrollment and verification with single-use backup codes.
 *
 * <p>An enrollment starts unconfirmed; the first accepted TOTP code confirms it and from
 * then on the subject counts as MFA-enabled. Backup codes are accepted only for confirmed
 * enrollments and each one is consumed by its first successful use.
 */
@Slf4j
public class MfaService {

    private static final char[] BACKUP_CODE_ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789".toCharArray();

    private final MfaEnrollmentStore store;
    private final TotpGenerator totp;
    private final PasswordEncoder passwordEncoder;
    private final MfaProperties properties;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public MfaService(MfaEnrollmentStore store, TotpGenerator totp, PasswordEncoder passwordEncoder,
                      MfaProperties properties, Clock clock) {
        this.store = store;
        this.totp = totp;
        this.passwordEncoder = passwordEncoder;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Starts (or restarts) enrollment. Rejected once MFA is already enabled.
     *
     * @param accountName label shown in the authenticator app, usually an email
     */
    @NonNull
    public MfaSetup setupMfa(@NonNull String subjectId, String accountName) {
        if (isEnabled(subjectId)) {
            throw new ValidationException("MFA is already enabled for subject " + subjectId);
        }
        String secret = totp.newSecret();
        List<String> plainCodes = new ArrayList<>();
        List<MfaEnrollment.BackupCode> hashedCodes = new ArrayList<>();
        for (int i = 0; i < properties.backupCodeCount(); i++) {
            String code = newBackupCode();
            plainCodes.add(code);
            hashedCodes.add(new MfaEnrollment.BackupCode(passwordEncoder.encode(code), null));
        }

        Instant now = clock.instant();
        store.save(new MfaEnrollment(subjectId, secret, false, now, null, -1L, hashedCodes));
        log.info("MFA enrollment started for subject {}", StringSanitizer.forLog(subjectId));

        String account = accountName != null && !accountName.isBlank() ? accountName : subjectId;
        return new MfaSetup(secret, provisioningUri(secret, account), plainCodes);
    }

    /**
     * Verifies a TOTP code (current step plus or minus the configured skew) or a backup code.
     *
     * @throws NotFoundException if the subject has no enrollment
     */
    public boolean verifyMfaCode(@NonNull String subjectId, String code) {
        MfaEnrollment enrollment = store.find(subjectId)
                .orElseThrow(() -> new NotFoundException("mfa enrollment", subjectId));
        if (code == null || code.isBlank()) {
            return false;
        }

        String trimmed = code.trim();
        OptionalLong step = totp.verify(enrollment.secret(), trimmed, clock.instant(), properties.allowedSkewSteps());
        if (step.isPresent()) {
            return acceptTotp(subjectId, step.getAsLong());
        }
        if (enrollment.confirmed()) {
            return consumeBackupCode(subjectId, normalizeBackupCode(trimmed));
        }
        return false;
    }

    public void disableMfa(@NonNull String subjectId) {
        store.delete(subjectId);
        log.info("MFA disabled for subject {}", StringSanitizer.forLog(subjectId));
    }

    @NonNull
    public MfaStatus status(@NonNull String subjectId) {
        return store.find(subjectId)
                .map(e -> new MfaStatus(e.confirmed(), e.enrolledAt(), e.verifiedAt()))
                .orElseGet(MfaStatus::notEnrolled);
    }

    public int remainingBackupCodes(@NonNull String subjectId) {
        return store.find(subjectId).map(MfaEnrollment::remainingBackupCodes).orElse(0);
    }

    public boolean isEnabled(String subjectId) {
        return store.find(subjectId).map(MfaEnrollment::confirmed).orElse(false);
    }

    private boolean acceptTotp(String subjectId, long step) {
        AtomicBoolean accepted = new AtomicBoolean(false);
        Instant now = clock.instant();
        store.update(subjectId, current -> {
            if (step <= current.lastAcceptedStep()) {
                return current;
            }
            accepted.set(true);
            return current.withAcceptedStep(step, now);
        });
        if (!accepted.get()) {
            log.warn("Replayed TOTP code rejected for subject {}", StringSanitizer.forLog(subjectId));
        }
        return accepted.get();
    }

    private boolean consumeBackupCode(String subjectId, String candidate) {
        AtomicBoolean consumed = new AtomicBoolean(false);
        Instant now = clock.instant();
        store.update(subjectId, current -> {
            List<MfaEnrollment.BackupCode> codes = current.backupCodes();
            for (int i = 0; i < codes.size(); i++) {
                MfaEnrollment.BackupCode backupCode = codes.get(i);
                if (!backupCode.isUsed() && passwordEncoder.matches(candidate, backupCode.hash())) {
                    consumed.set(true);
                    return current.withBackupCodeUsed(i, now);
                }
            }
            return current;
        });
        if (consumed.get()) {
            log.info("Backup code consumed for subject {} ({} remaining)",
                    StringSanitizer.forLog(subjectId), remainingBackupCodes(subjectId));
        }
        return consumed.get();
    }

    private String newBackupCode() {
        char[] code = new char[properties.backupCodeLength()];
        for (int i = 0; i < code.length; i++) {
            code[i] = BACKUP_CODE_ALPHABET[random.nextInt(BACKUP_CODE_ALPHABET.length)];
        }
        return new String(code);
    }

    private static String normalizeBackupCode(String code) {
        return code.replace("-", "").replace(" ", "").toUpperCase(Locale.ROOT);
    }

    private String provisioningUri(String secret, String account) {
        String issuer = encode(properties.issuer());
        return "otpauth://totp/" + issuer + ":" + encode(account)
                + "?secret=" + secret
                + "&issuer=" + issuer
                + "&algorithm=SHA1"
                + "&digits=" + properties.digits()
                + "&period=" + properties.period().toSeconds();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
