package com.example.iam.claims;

import com.example.iam.authz.model.Subject;
import com.example.iam.common.util.StringSanitizer;
import com.example.iam.token.jwt.TokenClaims;
import com.example.iam.token.mfa.MfaService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the {@link Subject} for one request from verified access-token claims.
 *
 * <p>Roles and trust level come from the token. Direct permissions, attributes and the
 * MFA flag are read from their stores on every call and never cached.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ClaimsResolver {

    private final SubjectDirectory directory;
    private final MfaService mfaService;

    @NonNull
    public Subject resolve(@NonNull TokenClaims claims) {
        SubjectProfile profile = directory.find(claims.subjectId()).orElse(null);
        if (profile == null) {
            log.warn("No directory profile for subject {}, resolving from token claims only",
                    StringSanitizer.forLog(claims.subjectId()));
        }

        Map<String, Object> attributes = new LinkedHashMap<>();
        if (profile != null) {
            attributes.putAll(profile.attributes());
        }
        attributes.put("tokenVersion", claims.version());

        return new Subject(
                claims.subjectId(),
                new HashSet<>(claims.roleIds()),
                profile != null ? profile.permissionIds() : null,
                mfaService.isEnabled(claims.subjectId()),
                claims.trustLevel(),
                attributes,
                claims.sessionId());
    }
}
