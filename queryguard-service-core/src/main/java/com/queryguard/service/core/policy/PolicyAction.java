package com.queryguard.service.core.policy;

import java.util.Locale;

public enum PolicyAction {
    ALLOW,
    REJECT;

    public static PolicyAction fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("action is required (allow or reject)");
        }
        return switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "ALLOW" -> ALLOW;
            case "REJECT" -> REJECT;
            default -> throw new IllegalArgumentException("Unsupported policy action: " + value);
        };
    }
}
