package com.example.iam.token.mfa;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * MFA state of one subject.
 *
 * @param confirmed        set by the first successful TOTP verification
 * @param lastAcceptedStep last TOTP time step accepted, codes at or before it are replays
 * @param backupCodes      hashed single-use codes
 */
public record MfaEnrollment(
        String subjectId,
        String secret,
        boolean confirmed,
        Instant enrolledAt,
        Instant verifiedAt,
        long lastAcceptedStep,
        List<BackupCode> backupCodes
) {
    public record BackupCode(String hash, Instant usedAt) {
        public boolean isUsed() {
            return usedAt != null;
        }
    }

    public MfaEnrollment {
        backupCodes = backupCodes == null ? List.of() : List.copyOf(backupCodes);
    }

    public MfaEnrollment withAcceptedStep(long step, Instant now) {
        return new MfaEnrollment(subjectId, secret, true, enrolledAt,
                verifiedAt != null ? verifiedAt : now, step, backupCodes);
    }

    public MfaEnrollment withBackupCodeUsed(int index, Instant now) {
        List<BackupCode> updated = new ArrayList<>(backupCodes);
        updated.set(index, new BackupCode(backupCodes.get(index).hash(), now));
        return new MfaEnrollment(subjectId, secret, confirmed, enrolledAt, verifiedAt, lastAcceptedStep, updated);
    }

    public int remainingBackupCodes() {
        return (int) backupCodes.stream().filter(code -> !code.isUsed()).count();
    }
}
