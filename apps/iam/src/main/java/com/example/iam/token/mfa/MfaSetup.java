package com.example.iam.token.mfa;

import java.util.List;

/**
 * Returned once by enrollment. The plain backup codes are never retrievable again.
 *
 * @param provisioningUri {@code otpauth://} URI for authenticator apps
 */
public record MfaSetup(
        String secret,
        String provisioningUri,
        List<String> backupCodes
) {
    public MfaSetup {
        backupCodes = List.copyOf(backupCodes);
    }

    @Override
    public String toString() {
        return "MfaSetup[provisioningUri=<redacted>, backupCodes=" + backupCodes.size() + "]";
    }
}
