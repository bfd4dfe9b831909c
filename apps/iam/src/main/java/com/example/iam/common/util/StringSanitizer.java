package com.example.iam.common.util;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.regex.Pattern;

/**
 * Log-safe rendering of caller-supplied strings and the identifier syntax shared by
 * roles, permissions, policies and subjects.
 */
public final class StringSanitizer {

    private static final Pattern SAFE_ID_PATTERN = Pattern.compile("^[a-zA-Z0-9_@.:-]{1,128}$");
    private static final int DEFAULT_LOG_MAX_LENGTH = 64;

    private StringSanitizer() {}

    @NonNull
    public static String forLog(@Nullable String value) {
        return forLog(value, DEFAULT_LOG_MAX_LENGTH);
    }

    @NonNull
    public static String forLog(@Nullable String value, int maxLength) {
        if (value == null) {
            return "null";
        }
        String sanitized = value
                .replace("\n", "")
                .replace("\r", "")
                .replace("\t", "");
        return sanitized.substring(0, Math.min(sanitized.length(), maxLength));
    }

    /**
     * Identifiers for subjects, roles, permissions and policies.
     */
    public static boolean isValidId(@Nullable String id) {
        if (id == null || id.isBlank()) {
            return false;
        }
        return SAFE_ID_PATTERN.matcher(id).matches();
    }
}
