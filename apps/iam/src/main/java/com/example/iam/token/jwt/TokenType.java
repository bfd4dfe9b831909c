package com.example.iam.token.jwt;

import java.util.Locale;

public enum TokenType {
    ACCESS,
    REFRESH;

    public String claimValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TokenType fromClaim(String value) {
        for (TokenType type : values()) {
            if (type.claimValue().equals(value)) {
                return type;
            }
        }
        return null;
    }
}
